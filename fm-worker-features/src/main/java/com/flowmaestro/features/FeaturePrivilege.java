package com.flowmaestro.features;

/**
 * Privilege level of a step feature. Determines how the runner treats its failures.
 * <p>
 * <b>INTERNAL:</b> part of the worker. A failing pre hook propagates and fails the step.
 * <p>
 * <b>COMMUNITY:</b> observer only. It can read {@link StepHookContext}, log and emit metrics, but
 * never blocks execution: if it throws, the runner logs and continues.
 */
public enum FeaturePrivilege {

    /** Worker-owned; a failing pre hook fails the step. */
    INTERNAL,

    /** Observer only; failures are logged and execution continues. */
    COMMUNITY
}
