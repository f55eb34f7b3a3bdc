package com.flowmaestro.worker.dispatch;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowmaestro.executioncontext.ContextSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutorBatchDispatcherTest {

    private ExecutorBatchDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) dispatcher.onExit();
    }

    private static StepInvocation invocation(String stepId, String kind) {
        return new StepInvocation(kind, JsonNodeFactory.instance.objectNode(), ContextSnapshot.empty(),
                new StepMeta("run-1", stepId, stepId, 1, List.of()));
    }

    private static Map<String, StepCompletion> byStep(BatchResult result) {
        return result.getCompletions().stream().collect(Collectors.toMap(StepCompletion::getStepId, c -> c));
    }

    @Test
    void dispatch_waitsForAllMembers_andReportsFailuresAsOutcomes() {
        dispatcher = new ExecutorBatchDispatcher(new StepInvoker((kind, config, snapshot, meta) -> {
            if ("boom".equals(kind)) throw new IllegalArgumentException("bad config");
            if ("slow".equals(kind)) Thread.sleep(60);
            return StepOutcome.success(TextNode.valueOf(meta.getStepId()));
        }), 3, 0);

        BatchResult result = dispatcher.dispatch(
                List.of(invocation("a", "slow"), invocation("b", "fast"), invocation("c", "boom")), CancellationToken.create());

        assertFalse(result.isCancelled());
        Map<String, StepCompletion> completions = byStep(result);
        assertEquals(3, completions.size());
        assertTrue(completions.get("a").getOutcome().isSuccess());
        assertEquals("b", completions.get("b").getOutcome().getOutput().asText());
        assertEquals("bad config", completions.get("c").getOutcome().getError());
    }

    @Test
    void dispatch_stepTimeout_failsOnlyTheSlowStep() {
        dispatcher = new ExecutorBatchDispatcher(new StepInvoker((kind, config, snapshot, meta) -> {
            if ("hang".equals(kind)) Thread.sleep(10_000);
            return StepOutcome.success(TextNode.valueOf("ok"));
        }), 2, 100);

        BatchResult result = dispatcher.dispatch(List.of(invocation("a", "hang"), invocation("b", "quick")),
                CancellationToken.create());

        Map<String, StepCompletion> completions = byStep(result);
        assertEquals("Step timed out after 100ms", completions.get("a").getOutcome().getError());
        assertTrue(completions.get("b").getOutcome().isSuccess());
    }

    @Test
    void dispatch_stepTimeout_startsWhenThePoolRunsTheStep() {
        dispatcher = new ExecutorBatchDispatcher(new StepInvoker((kind, config, snapshot, meta) -> {
            Thread.sleep(300);
            return StepOutcome.success(TextNode.valueOf(meta.getStepId()));
        }), 1, 500);

        BatchResult result = dispatcher.dispatch(List.of(invocation("a", "work"), invocation("b", "work")),
                CancellationToken.create());

        Map<String, StepCompletion> completions = byStep(result);
        assertTrue(completions.get("a").getOutcome().isSuccess());
        assertTrue(completions.get("b").getOutcome().isSuccess(), completions.get("b").getOutcome().getError());
    }

    @Test
    void dispatch_cancelled_returnsWithoutWaiting() {
        CancellationToken token = CancellationToken.create();
        dispatcher = new ExecutorBatchDispatcher(new StepInvoker((kind, config, snapshot, meta) -> {
            token.cancel("stop");
            Thread.sleep(10_000);
            return StepOutcome.success(TextNode.valueOf("late"));
        }), 1, 0);

        long start = System.currentTimeMillis();
        BatchResult result = dispatcher.dispatch(List.of(invocation("a", "hang")), token);

        assertTrue(result.isCancelled());
        assertTrue(result.getCompletions().isEmpty());
        assertTrue(System.currentTimeMillis() - start < 5_000);
    }
}
