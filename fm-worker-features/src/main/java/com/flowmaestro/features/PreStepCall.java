package com.flowmaestro.features;

/**
 * Feature logic that runs before a step is dispatched.
 * Annotate the implementing class with {@link com.flowmaestro.annotations.FlowFeature}.
 */
@FunctionalInterface
public interface PreStepCall {

    void before(StepHookContext context);
}
