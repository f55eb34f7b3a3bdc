package com.flowmaestro.worker.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * How a failed step's signal leaves it: through its error edges (routed) or nowhere (fatal).
 */
public final class RoutingDecision {

    private final String stepId;
    private final boolean routed;
    private final ObjectNode errorOutput;
    private final List<String> satisfiedEdgeIds;
    private final List<String> prunedEdgeIds;
    private final List<String> blockedEdgeIds;

    private RoutingDecision(String stepId, boolean routed, ObjectNode errorOutput,
                            List<String> satisfiedEdgeIds, List<String> prunedEdgeIds, List<String> blockedEdgeIds) {
        this.stepId = stepId;
        this.routed = routed;
        this.errorOutput = errorOutput;
        this.satisfiedEdgeIds = List.copyOf(satisfiedEdgeIds);
        this.prunedEdgeIds = List.copyOf(prunedEdgeIds);
        this.blockedEdgeIds = List.copyOf(blockedEdgeIds);
    }

    static RoutingDecision routed(String stepId, ObjectNode errorOutput, List<String> errorEdgeIds, List<String> defaultEdgeIds) {
        return new RoutingDecision(stepId, true, errorOutput, errorEdgeIds, defaultEdgeIds, List.of());
    }

    static RoutingDecision fatal(String stepId, ObjectNode errorOutput, List<String> outgoingEdgeIds) {
        return new RoutingDecision(stepId, false, errorOutput, List.of(), List.of(), outgoingEdgeIds);
    }

    public String getStepId() {
        return stepId;
    }

    /** True when at least one error edge carries the failure onward. */
    public boolean isRouted() {
        return routed;
    }

    /** Status the failed step ends in. */
    public StepStatus getResultingStatus() {
        return routed ? StepStatus.SETTLED : StepStatus.FAILED;
    }

    /** {@code {_error: true, message}}, recorded as the step's output either way. */
    public ObjectNode getErrorOutput() {
        return errorOutput.deepCopy();
    }

    public List<String> getSatisfiedEdgeIds() {
        return satisfiedEdgeIds;
    }

    public List<String> getPrunedEdgeIds() {
        return prunedEdgeIds;
    }

    public List<String> getBlockedEdgeIds() {
        return blockedEdgeIds;
    }
}
