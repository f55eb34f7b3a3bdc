package com.flowmaestro.annotations;

/**
 * When a feature is invoked relative to step execution.
 */
public enum FeaturePhase {
    /** Invoked before the step is dispatched. */
    PRE,
    /** Invoked after the step settles successfully. */
    POST_SUCCESS,
    /** Invoked after the step fails (routed or fatal). */
    POST_ERROR,
    /** Invoked before the step and again after it (success or error). */
    PRE_FINALLY
}
