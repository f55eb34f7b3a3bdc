package com.flowmaestro.executioncontext;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of an {@link ExecutionContext} taken when a step is dispatched. It never changes
 * afterwards, so concurrently running siblings cannot observe each other's in-flight results.
 * Accessors hand out copies; mutating a returned node does not affect the snapshot.
 * <p>
 * Serializable with Jackson so it can travel to a step activity.
 */
public final class ContextSnapshot {

    private final ObjectNode inputs;
    private final Map<String, JsonNode> outputs;
    private final Map<String, JsonNode> variables;

    private ContextSnapshot(ObjectNode inputs, Map<String, JsonNode> outputs, Map<String, JsonNode> variables) {
        this.inputs = inputs;
        this.outputs = outputs;
        this.variables = variables;
    }

    /** Builds a snapshot from untrusted data (e.g. a deserialized activity payload); copies everything. */
    @JsonCreator
    public static ContextSnapshot of(
            @JsonProperty("inputs") ObjectNode inputs,
            @JsonProperty("outputs") Map<String, JsonNode> outputs,
            @JsonProperty("variables") Map<String, JsonNode> variables) {
        return new ContextSnapshot(
                inputs != null ? inputs.deepCopy() : JsonNodeFactory.instance.objectNode(),
                copyOf(outputs),
                copyOf(variables));
    }

    /** Wraps maps that the caller guarantees are never mutated again (no copying). */
    static ContextSnapshot ofFrozen(ObjectNode inputs, Map<String, JsonNode> outputs, Map<String, JsonNode> variables) {
        return new ContextSnapshot(inputs, outputs, variables);
    }

    public static ContextSnapshot empty() {
        return of(null, null, null);
    }

    public ObjectNode getInputs() {
        return inputs.deepCopy();
    }

    /** Step outputs by step id (copies). */
    public Map<String, JsonNode> getOutputs() {
        return deepCopyValues(outputs);
    }

    public Map<String, JsonNode> getVariables() {
        return deepCopyValues(variables);
    }

    public Optional<JsonNode> getOutput(String stepId) {
        JsonNode node = outputs.get(stepId);
        return node != null ? Optional.of(node.deepCopy()) : Optional.empty();
    }

    public boolean hasOutput(String stepId) {
        return outputs.containsKey(stepId);
    }

    /**
     * Looks up a root name: workflow variables first, then step outputs, then run inputs.
     * Returned node is shared; callers that keep it must copy it.
     */
    JsonNode lookupRoot(String name) {
        JsonNode v = variables.get(name);
        if (v != null) return v;
        v = outputs.get(name);
        if (v != null) return v;
        return inputs.get(name);
    }

    private static Map<String, JsonNode> copyOf(Map<String, JsonNode> source) {
        if (source == null || source.isEmpty()) return Map.of();
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> e : source.entrySet()) {
            copy.put(e.getKey(), e.getValue() != null ? e.getValue().deepCopy() : JsonNodeFactory.instance.nullNode());
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, JsonNode> deepCopyValues(Map<String, JsonNode> source) {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> e : source.entrySet()) {
            copy.put(e.getKey(), e.getValue().deepCopy());
        }
        return Collections.unmodifiableMap(copy);
    }
}
