package com.flowmaestro.ledger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A run's credit hold plus the cost accumulated against it. Lifecycle HELD → SETTLED or
 * HELD → RELEASED, exactly once; the transition is a CAS so concurrent finishers cannot both win.
 */
public final class Reservation {

    public enum State { HELD, SETTLED, RELEASED }

    private final String runId;
    private final ReservationHandle handle;
    private final AtomicLong actualCost = new AtomicLong();
    private final AtomicReference<State> state = new AtomicReference<>(State.HELD);

    Reservation(String runId, ReservationHandle handle) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.handle = Objects.requireNonNull(handle, "handle");
    }

    public String getRunId() {
        return runId;
    }

    public ReservationHandle getHandle() {
        return handle;
    }

    public long getAmountHeld() {
        return handle.getAmount();
    }

    public long getActualCost() {
        return actualCost.get();
    }

    public State getState() {
        return state.get();
    }

    long addCost(long cost) {
        return actualCost.addAndGet(cost);
    }

    boolean transition(State target) {
        return state.compareAndSet(State.HELD, target);
    }
}
