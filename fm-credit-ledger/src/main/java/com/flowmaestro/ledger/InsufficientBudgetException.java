package com.flowmaestro.ledger;

/**
 * Thrown when a subject's available credits do not cover the requested amount.
 * Raised before any step runs, so there are no partial side effects.
 */
public final class InsufficientBudgetException extends RuntimeException {

    public static final String ERROR_CODE = "InsufficientBudget";

    private final String subjectId;
    private final long requested;
    private final long available;

    public InsufficientBudgetException(String subjectId, long requested, long available) {
        super(String.format("Insufficient credits for subject=%s: requested=%d available=%d",
                subjectId, requested, available));
        this.subjectId = subjectId;
        this.requested = requested;
        this.available = available;
    }

    /** For ledgers that do not report the available amount; {@link #getAvailable()} is then -1. */
    public InsufficientBudgetException(String subjectId, long requested) {
        super(String.format("Insufficient credits for subject=%s: requested=%d", subjectId, requested));
        this.subjectId = subjectId;
        this.requested = requested;
        this.available = -1L;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public long getRequested() {
        return requested;
    }

    public long getAvailable() {
        return available;
    }
}
