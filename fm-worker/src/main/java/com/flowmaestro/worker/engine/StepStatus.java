package com.flowmaestro.worker.engine;

/**
 * Runtime status of a step within one run. Single source of truth for readiness.
 */
public enum StepStatus {
    /** Waiting on at least one predecessor. */
    PENDING,
    /** Every required predecessor settled through a satisfied edge; eligible for dispatch. */
    READY,
    /** Dispatched; the executor has not reported back. */
    EXECUTING,
    /** Completed, or failed and routed through its error edges. */
    SETTLED,
    /** Failed with no error edge. Outgoing edges are blocked. */
    FAILED,
    /** Excluded by branch selection; never runs and never blocks completion. */
    PRUNED,
    /** Downstream of a fatal failure; can never run. */
    UNREACHABLE,
    /** Was executing when the run was cancelled. */
    CANCELLED;

    /** True once the step will not change state again. */
    public boolean isFinal() {
        return this != PENDING && this != READY && this != EXECUTING;
    }
}
