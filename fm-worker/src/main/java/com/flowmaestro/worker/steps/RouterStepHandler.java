package com.flowmaestro.worker.steps;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowmaestro.executioncontext.ContextSnapshot;
import com.flowmaestro.worker.dispatch.StepMeta;
import com.flowmaestro.worker.dispatch.StepOutcome;

/**
 * {@code router}: takes the handle named by {@code config.route}, or {@code default} when the
 * route is blank or unresolved.
 */
final class RouterStepHandler implements StepHandler {

    static final String KIND = "router";
    static final String DEFAULT_ROUTE = "default";

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public StepOutcome handle(ObjectNode config, ContextSnapshot snapshot, StepMeta meta) {
        String route = config.path("route").asText("").trim();
        if (route.isEmpty() || route.startsWith("<unresolved:")) {
            route = DEFAULT_ROUTE;
        }
        ObjectNode output = JsonNodeFactory.instance.objectNode();
        output.put("route", route);
        return StepOutcome.success(output).selecting(route);
    }
}
