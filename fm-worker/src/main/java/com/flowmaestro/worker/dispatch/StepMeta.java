package com.flowmaestro.worker.dispatch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Identity and position of the step being executed, passed to the executor alongside its config.
 */
public final class StepMeta {

    private final String runId;
    private final String stepId;
    private final String stepName;
    private final int depth;
    private final List<String> sourceStepIds;

    @JsonCreator
    public StepMeta(
            @JsonProperty("runId") String runId,
            @JsonProperty("stepId") String stepId,
            @JsonProperty("stepName") String stepName,
            @JsonProperty("depth") int depth,
            @JsonProperty("sourceStepIds") List<String> sourceStepIds) {
        this.runId = runId;
        this.stepId = Objects.requireNonNull(stepId, "stepId");
        this.stepName = stepName != null ? stepName : stepId;
        this.depth = depth;
        this.sourceStepIds = sourceStepIds != null ? List.copyOf(sourceStepIds) : List.of();
    }

    public String getRunId() {
        return runId;
    }

    public String getStepId() {
        return stepId;
    }

    public String getStepName() {
        return stepName;
    }

    public int getDepth() {
        return depth;
    }

    /** Predecessors whose edge into this step was taken, in compile order. */
    public List<String> getSourceStepIds() {
        return sourceStepIds;
    }
}
