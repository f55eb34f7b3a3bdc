package com.flowmaestro.worker.telemetry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowmaestro.graph.compiled.Step;
import com.flowmaestro.worker.engine.ExecutionProgress;

import java.util.Objects;

/**
 * Fire-and-forget lifecycle notification. Fields not relevant to the event type are null and
 * omitted from JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExecutionEvent {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ExecutionEventType type;
    private final String executionId;
    private final String nodeId;
    private final String nodeName;
    private final String nodeType;
    private final JsonNode output;
    private final Long duration;
    private final String error;
    private final Integer totalNodes;
    private final Integer completed;
    private final Integer percentage;
    private final long timestamp;

    @JsonCreator
    public ExecutionEvent(
            @JsonProperty("type") ExecutionEventType type,
            @JsonProperty("executionId") String executionId,
            @JsonProperty("nodeId") String nodeId,
            @JsonProperty("nodeName") String nodeName,
            @JsonProperty("nodeType") String nodeType,
            @JsonProperty("output") JsonNode output,
            @JsonProperty("duration") Long duration,
            @JsonProperty("error") String error,
            @JsonProperty("totalNodes") Integer totalNodes,
            @JsonProperty("completed") Integer completed,
            @JsonProperty("percentage") Integer percentage,
            @JsonProperty("timestamp") long timestamp) {
        this.type = Objects.requireNonNull(type, "type");
        this.executionId = executionId;
        this.nodeId = nodeId;
        this.nodeName = nodeName;
        this.nodeType = nodeType;
        this.output = output;
        this.duration = duration;
        this.error = error;
        this.totalNodes = totalNodes;
        this.completed = completed;
        this.percentage = percentage;
        this.timestamp = timestamp;
    }

    public static ExecutionEvent executionStarted(String runId, int totalNodes, long timestamp) {
        return new ExecutionEvent(ExecutionEventType.EXECUTION_STARTED, runId, null, null, null, null,
                null, null, totalNodes, null, null, timestamp);
    }

    public static ExecutionEvent executionProgress(String runId, ExecutionProgress progress, long timestamp) {
        return new ExecutionEvent(ExecutionEventType.EXECUTION_PROGRESS, runId, null, null, null, null,
                null, null, progress.getTotal(), progress.getCompleted(), progress.getPercentage(), timestamp);
    }

    public static ExecutionEvent executionCompleted(String runId, JsonNode outputs, long durationMs, long timestamp) {
        return new ExecutionEvent(ExecutionEventType.EXECUTION_COMPLETED, runId, null, null, null, outputs,
                durationMs, null, null, null, null, timestamp);
    }

    public static ExecutionEvent executionFailed(String runId, String error, long timestamp) {
        return new ExecutionEvent(ExecutionEventType.EXECUTION_FAILED, runId, null, null, null, null,
                null, error, null, null, null, timestamp);
    }

    public static ExecutionEvent nodeStarted(String runId, Step step, long timestamp) {
        return new ExecutionEvent(ExecutionEventType.NODE_STARTED, runId, step.getId(), step.getName(), step.getKind(),
                null, null, null, null, null, null, timestamp);
    }

    public static ExecutionEvent nodeCompleted(String runId, Step step, JsonNode output, long durationMs, long timestamp) {
        return new ExecutionEvent(ExecutionEventType.NODE_COMPLETED, runId, step.getId(), step.getName(), step.getKind(),
                output, durationMs, null, null, null, null, timestamp);
    }

    public static ExecutionEvent nodeFailed(String runId, Step step, String error, long timestamp) {
        return new ExecutionEvent(ExecutionEventType.NODE_FAILED, runId, step.getId(), step.getName(), step.getKind(),
                null, null, error, null, null, null, timestamp);
    }

    public ExecutionEventType getType() {
        return type;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getNodeName() {
        return nodeName;
    }

    public String getNodeType() {
        return nodeType;
    }

    public JsonNode getOutput() {
        return output;
    }

    public Long getDuration() {
        return duration;
    }

    public String getError() {
        return error;
    }

    public Integer getTotalNodes() {
        return totalNodes;
    }

    public Integer getCompleted() {
        return completed;
    }

    public Integer getPercentage() {
        return percentage;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @JsonIgnore
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + type, e);
        }
    }

    public static ExecutionEvent fromJson(String json) {
        try {
            return MAPPER.readValue(json, ExecutionEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid event JSON: " + e.getMessage(), e);
        }
    }
}
