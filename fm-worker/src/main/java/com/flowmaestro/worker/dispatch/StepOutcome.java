package com.flowmaestro.worker.dispatch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;

/**
 * What a step executor reports: success with an output, or failure with a message. Either may
 * carry the cost the step consumed. {@code selectedHandles} restricts which outgoing default
 * edges are taken (branch selection); empty means all.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StepOutcome {

    private final boolean success;
    private final JsonNode output;
    private final Long cost;
    private final List<String> selectedHandles;
    private final String error;

    @JsonCreator
    public StepOutcome(
            @JsonProperty("success") boolean success,
            @JsonProperty("output") JsonNode output,
            @JsonProperty("cost") Long cost,
            @JsonProperty("selectedHandles") List<String> selectedHandles,
            @JsonProperty("error") String error) {
        this.success = success;
        this.output = output != null ? output : NullNode.getInstance();
        this.cost = cost;
        this.selectedHandles = selectedHandles != null ? List.copyOf(selectedHandles) : List.of();
        this.error = error;
    }

    public static StepOutcome success(JsonNode output) {
        return new StepOutcome(true, output, null, null, null);
    }

    public static StepOutcome success(JsonNode output, long cost) {
        return new StepOutcome(true, output, cost, null, null);
    }

    public static StepOutcome failure(String error) {
        return new StepOutcome(false, null, null, null, error != null ? error : "Step failed");
    }

    public static StepOutcome failure(String error, Long cost) {
        return new StepOutcome(false, null, cost, null, error != null ? error : "Step failed");
    }

    /** Copy of this outcome that takes only the given handles. */
    public StepOutcome selecting(String... handles) {
        return new StepOutcome(success, output, cost, List.of(handles), error);
    }

    public StepOutcome withCost(Long cost) {
        return new StepOutcome(success, output, cost, selectedHandles, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public JsonNode getOutput() {
        return output;
    }

    /** Cost reported by the step; null when it reported none. */
    public Long getCost() {
        return cost;
    }

    public List<String> getSelectedHandles() {
        return selectedHandles;
    }

    public String getError() {
        return error;
    }
}
