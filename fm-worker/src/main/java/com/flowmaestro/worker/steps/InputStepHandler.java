package com.flowmaestro.worker.steps;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowmaestro.executioncontext.ContextSnapshot;
import com.flowmaestro.worker.dispatch.StepMeta;
import com.flowmaestro.worker.dispatch.StepOutcome;

/**
 * {@code input}: outputs {@code inputs[config.inputName]}, or every run input when no name is set.
 * A missing input falls back to {@code config.defaultValue}; with {@code config.required} it fails.
 */
final class InputStepHandler implements StepHandler {

    static final String KIND = "input";

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public StepOutcome handle(ObjectNode config, ContextSnapshot snapshot, StepMeta meta) {
        ObjectNode inputs = snapshot.getInputs();
        String name = config.path("inputName").asText("");
        if (name.isEmpty()) {
            return StepOutcome.success(inputs);
        }
        JsonNode value = inputs.get(name);
        if (value == null || value.isNull()) {
            if (config.path("required").asBoolean(false)) {
                throw new IllegalArgumentException("Required input missing: " + name);
            }
            value = config.has("defaultValue") ? config.get("defaultValue") : NullNode.getInstance();
        }
        return StepOutcome.success(value);
    }
}
