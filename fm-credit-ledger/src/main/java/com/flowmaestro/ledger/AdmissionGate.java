package com.flowmaestro.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Wraps a run with a credit check, a hold, cost accumulation and a single settlement.
 * <p>
 * Usage: {@link #preflight} before the first dispatch; {@link #reserve} once admitted;
 * {@link #recordCost} per completed step; {@link #finish} in a {@code finally} block.
 * Exactly one of settle/release reaches the ledger per reservation: later calls are no-ops.
 */
public final class AdmissionGate {

    private static final Logger log = LoggerFactory.getLogger(AdmissionGate.class);

    private final CreditLedger ledger;

    public AdmissionGate(CreditLedger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    /**
     * Checks whether the subject can afford the estimated cost. A ledger failure denies admission.
     */
    public AdmissionDecision preflight(String subjectId, long estimatedCost) {
        if (estimatedCost < 0) {
            log.warn("Admission denied | subject={} | invalid estimatedCost={}", subjectId, estimatedCost);
            return AdmissionDecision.deny("Invalid estimated cost " + estimatedCost);
        }
        try {
            if (ledger.checkAllowance(subjectId, estimatedCost)) {
                return AdmissionDecision.allow();
            }
            log.info("Admission denied | subject={} | estimatedCost={}", subjectId, estimatedCost);
            return AdmissionDecision.deny("Insufficient credits for estimated cost " + estimatedCost);
        } catch (RuntimeException e) {
            log.warn("Admission check failed | subject={} | error={}", subjectId, e.getMessage(), e);
            return AdmissionDecision.deny("Credit check failed: " + e.getMessage());
        }
    }

    /**
     * Places the hold for the run.
     *
     * @throws InsufficientBudgetException when the hold cannot be placed
     */
    public Reservation reserve(String runId, String subjectId, long estimatedCost) {
        ReservationHandle handle = ledger.hold(subjectId, estimatedCost);
        log.info("Reservation held | runId={} | subject={} | amount={}", runId, subjectId, estimatedCost);
        return new Reservation(runId, handle);
    }

    /** Accumulates a step's reported cost. Negative costs are ignored. */
    public void recordCost(Reservation reservation, String stepId, long cost) {
        if (reservation == null || cost <= 0) return;
        long total = reservation.addCost(cost);
        if (log.isDebugEnabled()) {
            log.debug("Cost recorded | runId={} | stepId={} | cost={} | total={}", reservation.getRunId(), stepId, cost, total);
        }
    }

    /**
     * Settles when any step was dispatched (the run consumed resources), releases otherwise.
     *
     * @return true if this call performed the settlement or release
     */
    public boolean finish(Reservation reservation, boolean anyStepDispatched) {
        if (reservation == null) return false;
        return anyStepDispatched ? settle(reservation) : release(reservation);
    }

    /** Debits the accumulated cost. No-op when the reservation was already finished. */
    public boolean settle(Reservation reservation) {
        if (!reservation.transition(Reservation.State.SETTLED)) {
            log.warn("Reservation already finished; settle ignored | runId={} | state={}", reservation.getRunId(), reservation.getState());
            return false;
        }
        long actual = reservation.getActualCost();
        try {
            ledger.settle(reservation.getHandle(), actual);
            log.info("Reservation settled | runId={} | held={} | actual={}", reservation.getRunId(), reservation.getAmountHeld(), actual);
        } catch (RuntimeException e) {
            log.error("Reservation settle failed | runId={} | handle={} | actual={}", reservation.getRunId(), reservation.getHandle(), actual, e);
        }
        return true;
    }

    /** Returns the full hold. No-op when the reservation was already finished. */
    public boolean release(Reservation reservation) {
        if (!reservation.transition(Reservation.State.RELEASED)) {
            log.warn("Reservation already finished; release ignored | runId={} | state={}", reservation.getRunId(), reservation.getState());
            return false;
        }
        try {
            ledger.release(reservation.getHandle());
            log.info("Reservation released | runId={} | amount={}", reservation.getRunId(), reservation.getAmountHeld());
        } catch (RuntimeException e) {
            log.error("Reservation release failed | runId={} | handle={}", reservation.getRunId(), reservation.getHandle(), e);
        }
        return true;
    }
}
