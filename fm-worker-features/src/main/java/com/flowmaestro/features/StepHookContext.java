package com.flowmaestro.features;

import java.util.Map;
import java.util.Objects;

/**
 * Context passed to feature hooks when a step is about to be dispatched (pre) or has just
 * completed (post). Outcome fields are set for post phases via {@link #withOutcome}.
 */
public final class StepHookContext {

    private final String runId;
    private final String stepId;
    private final String kind;
    private final String stepName;
    private final Map<String, Object> attributes;
    /** True = success path, false = error path, null = pre. */
    private final Boolean executionSucceeded;
    private final long durationMs;
    private final Long cost;
    private final String errorMessage;

    public StepHookContext(String runId, String stepId, String kind, String stepName, Map<String, Object> attributes) {
        this(runId, stepId, kind, stepName, attributes, null, 0L, null, null);
    }

    private StepHookContext(String runId, String stepId, String kind, String stepName, Map<String, Object> attributes,
                            Boolean executionSucceeded, long durationMs, Long cost, String errorMessage) {
        this.runId = runId != null ? runId : "";
        this.stepId = Objects.requireNonNull(stepId, "stepId");
        this.kind = kind != null ? kind : "";
        this.stepName = stepName != null ? stepName : stepId;
        this.attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
        this.executionSucceeded = executionSucceeded;
        this.durationMs = durationMs;
        this.cost = cost;
        this.errorMessage = errorMessage;
    }

    /** Returns a new context carrying the step outcome (for post hooks). */
    public StepHookContext withOutcome(boolean succeeded, long durationMs, Long cost, String errorMessage) {
        return new StepHookContext(runId, stepId, kind, stepName, attributes, succeeded, durationMs, cost, errorMessage);
    }

    public String getRunId() {
        return runId;
    }

    public String getStepId() {
        return stepId;
    }

    /** Step kind (e.g. input, llm, http, output). */
    public String getKind() {
        return kind;
    }

    public String getStepName() {
        return stepName;
    }

    /** Extra context (e.g. depth, workflow name). Unmodifiable. */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /** True on the success path, false on the error path, null before execution. */
    public Boolean getExecutionSucceeded() {
        return executionSucceeded;
    }

    public boolean isExecutionSucceeded() {
        return Boolean.TRUE.equals(executionSucceeded);
    }

    public long getDurationMs() {
        return durationMs;
    }

    /** Cost reported by the step, or null when it reported none. */
    public Long getCost() {
        return cost;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
