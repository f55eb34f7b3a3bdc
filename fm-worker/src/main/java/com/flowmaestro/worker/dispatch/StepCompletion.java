package com.flowmaestro.worker.dispatch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A step's outcome plus how long it took.
 */
public final class StepCompletion {

    private final String stepId;
    private final StepOutcome outcome;
    private final long durationMs;

    @JsonCreator
    public StepCompletion(
            @JsonProperty("stepId") String stepId,
            @JsonProperty("outcome") StepOutcome outcome,
            @JsonProperty("durationMs") long durationMs) {
        this.stepId = Objects.requireNonNull(stepId, "stepId");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.durationMs = Math.max(0L, durationMs);
    }

    public String getStepId() {
        return stepId;
    }

    public StepOutcome getOutcome() {
        return outcome;
    }

    public long getDurationMs() {
        return durationMs;
    }
}
