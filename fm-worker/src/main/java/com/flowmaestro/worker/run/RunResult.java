package com.flowmaestro.worker.run;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a run. Always returned, never thrown: {@code outputs} holds every terminal output
 * that settled, so partial results are visible on failure. {@code error} is a
 * {@link RunErrorCode} code; {@code message} explains it.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class RunResult {

    private final String runId;
    private final boolean success;
    private final ObjectNode outputs;
    private final String error;
    private final String message;
    private final List<String> unreachedTerminals;
    private final Map<String, String> failedSteps;
    private final int dispatchedSteps;
    private final long actualCost;

    @JsonCreator
    public RunResult(
            @JsonProperty("runId") String runId,
            @JsonProperty("success") boolean success,
            @JsonProperty("outputs") ObjectNode outputs,
            @JsonProperty("error") String error,
            @JsonProperty("message") String message,
            @JsonProperty("unreachedTerminals") List<String> unreachedTerminals,
            @JsonProperty("failedSteps") Map<String, String> failedSteps,
            @JsonProperty("dispatchedSteps") int dispatchedSteps,
            @JsonProperty("actualCost") long actualCost) {
        this.runId = runId;
        this.success = success;
        this.outputs = outputs != null ? outputs : JsonNodeFactory.instance.objectNode();
        this.error = error;
        this.message = message;
        this.unreachedTerminals = unreachedTerminals != null ? List.copyOf(unreachedTerminals) : List.of();
        this.failedSteps = failedSteps != null ? Map.copyOf(failedSteps) : Map.of();
        this.dispatchedSteps = dispatchedSteps;
        this.actualCost = actualCost;
    }

    public static RunResult succeeded(String runId, ObjectNode outputs, Map<String, String> failedSteps,
                                      int dispatchedSteps, long actualCost) {
        return new RunResult(runId, true, outputs, null, null, null, failedSteps, dispatchedSteps, actualCost);
    }

    public static RunResult failed(String runId, RunErrorCode error, String message, ObjectNode outputs,
                                   List<String> unreachedTerminals, Map<String, String> failedSteps,
                                   int dispatchedSteps, long actualCost) {
        return new RunResult(runId, false, outputs, error.getCode(), message, unreachedTerminals, failedSteps,
                dispatchedSteps, actualCost);
    }

    /** Failure before any step was dispatched. */
    public static RunResult rejected(String runId, RunErrorCode error, String message) {
        return failed(runId, error, message, null, null, null, 0, 0L);
    }

    public String getRunId() {
        return runId;
    }

    public boolean isSuccess() {
        return success;
    }

    public ObjectNode getOutputs() {
        return outputs;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getUnreachedTerminals() {
        return unreachedTerminals;
    }

    /** Error message by step id for every step that failed, including error-routed ones. */
    public Map<String, String> getFailedSteps() {
        return failedSteps;
    }

    public int getDispatchedSteps() {
        return dispatchedSteps;
    }

    public long getActualCost() {
        return actualCost;
    }

    @Override
    public String toString() {
        return "RunResult{runId=" + runId + ", success=" + success + ", error=" + error
                + ", unreachedTerminals=" + unreachedTerminals + ", outputs=" + outputs + "}";
    }
}
