package com.flowmaestro.worker.dispatch;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowmaestro.executioncontext.ContextSnapshot;

/**
 * Executes one step. Called once per dispatched step; a thrown exception is treated the same as
 * {@link StepOutcome#failure(String)}.
 */
@FunctionalInterface
public interface StepExecutor {

    StepOutcome execute(String kind, ObjectNode config, ContextSnapshot snapshot, StepMeta meta) throws Exception;
}
