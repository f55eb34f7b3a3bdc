package com.flowmaestro.executioncontext;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only store of per-step outputs plus a scratch variable namespace for one run.
 * <p>
 * Every update returns a new context; existing instances and the snapshots taken from them never
 * change. A step output can be recorded once; recording the same step id twice is rejected.
 * Outputs larger than {@code maxOutputBytes} are stored truncated (see {@link OutputTruncator}).
 */
public final class ExecutionContext {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    public static final int DEFAULT_MAX_OUTPUT_BYTES = 1024 * 1024;

    private final ObjectNode inputs;
    private final Map<String, JsonNode> outputs;
    private final Map<String, JsonNode> variables;
    private final int maxOutputBytes;

    private ExecutionContext(ObjectNode inputs, Map<String, JsonNode> outputs, Map<String, JsonNode> variables, int maxOutputBytes) {
        this.inputs = inputs;
        this.outputs = outputs;
        this.variables = variables;
        this.maxOutputBytes = maxOutputBytes;
    }

    public static ExecutionContext create(ObjectNode inputs) {
        return create(inputs, DEFAULT_MAX_OUTPUT_BYTES);
    }

    public static ExecutionContext create(ObjectNode inputs, int maxOutputBytes) {
        ObjectNode in = inputs != null ? inputs.deepCopy() : JsonNodeFactory.instance.objectNode();
        return new ExecutionContext(in, Map.of(), Map.of(), maxOutputBytes > 0 ? maxOutputBytes : DEFAULT_MAX_OUTPUT_BYTES);
    }

    /**
     * Returns a new context with the step's output recorded.
     *
     * @throws IllegalStateException if an output was already recorded for the step
     */
    public ExecutionContext recordOutput(String stepId, JsonNode value) {
        Objects.requireNonNull(stepId, "stepId");
        if (outputs.containsKey(stepId)) {
            throw new IllegalStateException("Output already recorded for step " + stepId);
        }
        JsonNode copy = value != null ? value.deepCopy() : JsonNodeFactory.instance.nullNode();
        JsonNode stored = OutputTruncator.truncateIfNeeded(copy, maxOutputBytes);
        if (stored != copy && log.isWarnEnabled()) {
            log.warn("Context recordOutput | output truncated | stepId={} | originalSize={} | limit={}",
                    stepId, stored.get(OutputTruncator.ORIGINAL_SIZE_KEY).asLong(), maxOutputBytes);
        }
        Map<String, JsonNode> next = new LinkedHashMap<>(outputs);
        next.put(stepId, stored);
        return new ExecutionContext(inputs, Collections.unmodifiableMap(next), variables, maxOutputBytes);
    }

    /** Returns a new context with the variable set (variables may be overwritten). */
    public ExecutionContext withVariable(String name, JsonNode value) {
        Objects.requireNonNull(name, "name");
        Map<String, JsonNode> next = new LinkedHashMap<>(variables);
        next.put(name, value != null ? value.deepCopy() : JsonNodeFactory.instance.nullNode());
        return new ExecutionContext(inputs, outputs, Collections.unmodifiableMap(next), maxOutputBytes);
    }

    /** Frozen view of everything recorded so far. */
    public ContextSnapshot snapshot() {
        return ContextSnapshot.ofFrozen(inputs, outputs, variables);
    }

    public Optional<JsonNode> getOutput(String stepId) {
        JsonNode node = outputs.get(stepId);
        return node != null ? Optional.of(node.deepCopy()) : Optional.empty();
    }

    public boolean hasOutput(String stepId) {
        return outputs.containsKey(stepId);
    }

    public int outputCount() {
        return outputs.size();
    }

    public ObjectNode getInputs() {
        return inputs.deepCopy();
    }

    /** Resolves {@code {{stepId.path}}} placeholders against the current state. */
    public String resolveTemplate(String template) {
        return TemplateResolver.resolve(snapshot(), template);
    }

    /**
     * Final run result: each listed step's output under its id. Steps without a recorded output
     * are left out, so partial results remain representable.
     */
    public ObjectNode aggregateOutputs(Collection<String> terminalStepIds) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        if (terminalStepIds == null) return result;
        for (String id : terminalStepIds) {
            JsonNode node = outputs.get(id);
            if (node != null) {
                result.set(id, node.deepCopy());
            }
        }
        return result;
    }

    /** Structured error output recorded for a failed step: {@code {_error: true, message}}. */
    public static ObjectNode errorOutput(String message) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("_error", true);
        node.put("message", message != null ? message : "Step failed");
        return node;
    }

    public static boolean isErrorOutput(JsonNode node) {
        return node != null && node.isObject() && node.path("_error").asBoolean(false);
    }
}
