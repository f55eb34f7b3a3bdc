package com.flowmaestro.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Ledger-issued handle for a credit hold. Serializable so it can cross an activity boundary.
 */
public final class ReservationHandle {

    private final String id;
    private final String subjectId;
    private final long amount;

    @JsonCreator
    public ReservationHandle(
            @JsonProperty("id") String id,
            @JsonProperty("subjectId") String subjectId,
            @JsonProperty("amount") long amount) {
        this.id = Objects.requireNonNull(id, "id");
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId");
        this.amount = amount;
    }

    public String getId() {
        return id;
    }

    public String getSubjectId() {
        return subjectId;
    }

    /** Credits held. */
    public long getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReservationHandle)) return false;
        return id.equals(((ReservationHandle) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ReservationHandle{" + id + ", subject=" + subjectId + ", amount=" + amount + "}";
    }
}
