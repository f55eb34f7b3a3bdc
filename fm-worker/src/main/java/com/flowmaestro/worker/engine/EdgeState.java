package com.flowmaestro.worker.engine;

/**
 * Runtime state of an edge. An edge leaves PENDING exactly once, when its source step completes.
 */
public enum EdgeState {
    /** Source step has not completed. */
    PENDING,
    /** Source completed and this edge was the path taken. */
    SATISFIED,
    /** Source completed but took another path (unselected handle, or the other of success/error). */
    PRUNED,
    /** Source failed fatally, or became unreachable. */
    BLOCKED
}
