package com.flowmaestro.worker.steps;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowmaestro.executioncontext.ContextSnapshot;
import com.flowmaestro.worker.dispatch.StepMeta;
import com.flowmaestro.worker.dispatch.StepOutcome;

/**
 * Implementation of one step kind. {@code config} arrives with its placeholders already resolved
 * against the snapshot; shape validation of the config belongs to the handler.
 */
public interface StepHandler {

    String kind();

    StepOutcome handle(ObjectNode config, ContextSnapshot snapshot, StepMeta meta) throws Exception;
}
