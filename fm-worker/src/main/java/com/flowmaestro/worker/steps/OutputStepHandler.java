package com.flowmaestro.worker.steps;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowmaestro.executioncontext.ContextSnapshot;
import com.flowmaestro.worker.dispatch.StepMeta;
import com.flowmaestro.worker.dispatch.StepOutcome;

import java.util.Optional;

/**
 * {@code output}: outputs {@code config.value} when set. Otherwise passes through the output of
 * the predecessor it was reached from; when reached from several, their outputs keyed by step id.
 */
final class OutputStepHandler implements StepHandler {

    static final String KIND = "output";

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public StepOutcome handle(ObjectNode config, ContextSnapshot snapshot, StepMeta meta) {
        if (config.has("value")) {
            return StepOutcome.success(config.get("value"));
        }
        ObjectNode merged = JsonNodeFactory.instance.objectNode();
        JsonNode single = null;
        for (String sourceId : meta.getSourceStepIds()) {
            Optional<JsonNode> out = snapshot.getOutput(sourceId);
            if (out.isPresent()) {
                merged.set(sourceId, out.get());
                single = out.get();
            }
        }
        if (merged.size() == 1) {
            return StepOutcome.success(single);
        }
        return StepOutcome.success(merged.size() == 0 ? NullNode.getInstance() : merged);
    }
}
