package com.flowmaestro.features;

/**
 * Feature logic that runs after a step completes. The context carries the outcome; the result is
 * the step output (or the structured error output on failure).
 */
@FunctionalInterface
public interface PostStepCall {

    /**
     * @param context    step context with outcome set
     * @param stepResult step output, may be null
     */
    void after(StepHookContext context, Object stepResult);
}
