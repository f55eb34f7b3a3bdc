package com.flowmaestro.worker.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowmaestro.config.FlowConfig;
import com.flowmaestro.graph.definition.WorkflowDefinition;

import java.util.Objects;

/**
 * Start payload of {@link FlowWorkflow}. Carries the run limits so the workflow never reads
 * the environment.
 */
public final class RunWorkflowRequest {

    private final WorkflowDefinition definition;
    private final ObjectNode inputs;
    private final String budgetSubject;
    private final int defaultMaxConcurrent;
    private final int runTimeoutSeconds;
    private final int stepTimeoutSeconds;
    private final int maxOutputBytes;
    private final long defaultStepCost;

    @JsonCreator
    public RunWorkflowRequest(
            @JsonProperty("definition") WorkflowDefinition definition,
            @JsonProperty("inputs") ObjectNode inputs,
            @JsonProperty("budgetSubject") String budgetSubject,
            @JsonProperty("defaultMaxConcurrent") int defaultMaxConcurrent,
            @JsonProperty("runTimeoutSeconds") int runTimeoutSeconds,
            @JsonProperty("stepTimeoutSeconds") int stepTimeoutSeconds,
            @JsonProperty("maxOutputBytes") int maxOutputBytes,
            @JsonProperty("defaultStepCost") long defaultStepCost) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.inputs = inputs != null ? inputs : JsonNodeFactory.instance.objectNode();
        this.budgetSubject = Objects.requireNonNull(budgetSubject, "budgetSubject");
        this.defaultMaxConcurrent = defaultMaxConcurrent > 0 ? defaultMaxConcurrent : FlowConfig.DEFAULT_MAX_CONCURRENT_STEPS;
        this.runTimeoutSeconds = Math.max(0, runTimeoutSeconds);
        this.stepTimeoutSeconds = stepTimeoutSeconds > 0 ? stepTimeoutSeconds : 300;
        this.maxOutputBytes = maxOutputBytes > 0 ? maxOutputBytes : FlowConfig.DEFAULT_MAX_OUTPUT_BYTES;
        this.defaultStepCost = Math.max(0L, defaultStepCost);
    }

    /** Request with limits taken from the worker configuration. */
    public static RunWorkflowRequest of(FlowConfig config, WorkflowDefinition definition, ObjectNode inputs, String budgetSubject) {
        return new RunWorkflowRequest(definition, inputs, budgetSubject, config.getMaxConcurrentSteps(),
                config.getRunTimeoutSeconds(), config.getStepTimeoutSeconds(), config.getMaxOutputBytes(),
                config.getDefaultStepCost());
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    public ObjectNode getInputs() {
        return inputs;
    }

    public String getBudgetSubject() {
        return budgetSubject;
    }

    public int getDefaultMaxConcurrent() {
        return defaultMaxConcurrent;
    }

    /** 0 = no run-level timeout. */
    public int getRunTimeoutSeconds() {
        return runTimeoutSeconds;
    }

    public int getStepTimeoutSeconds() {
        return stepTimeoutSeconds;
    }

    public int getMaxOutputBytes() {
        return maxOutputBytes;
    }

    public long getDefaultStepCost() {
        return defaultStepCost;
    }
}
