package com.flowmaestro.worker.engine;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowmaestro.executioncontext.ExecutionContext;
import com.flowmaestro.graph.GraphCompiler;
import com.flowmaestro.graph.compiled.CompiledGraph;
import com.flowmaestro.graph.definition.EdgeDefinition;
import com.flowmaestro.graph.definition.WorkflowDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReadinessSchedulerTest {

    private final GraphCompiler compiler = new GraphCompiler(10);

    private ReadinessScheduler scheduler(WorkflowDefinition def) {
        CompiledGraph graph = compiler.compile(def);
        return new ReadinessScheduler(graph, ExecutionContext.create(JsonNodeFactory.instance.objectNode()));
    }

    private static TextNode text(String value) {
        return TextNode.valueOf(value);
    }

    @Test
    void linear_eachStepIsHandedOutOnce() {
        ReadinessScheduler s = scheduler(WorkflowDefinition.builder("linear")
                .step("input", "input")
                .step("llm", "llm")
                .step("output", "output")
                .edge("input", "llm")
                .edge("llm", "output")
                .build());

        assertEquals(List.of("input"), s.getReadyBatch(10).getStepIds());
        assertTrue(s.getReadyBatch(10).isEmpty(), "executing step must not be handed out again");
        assertEquals(StepStatus.EXECUTING, s.statusOf("input"));

        s.markSettled("input", text("x"));
        assertEquals(StepStatus.READY, s.statusOf("llm"));
        assertEquals(StepStatus.PENDING, s.statusOf("output"));
        assertEquals(List.of("llm"), s.getReadyBatch(10).getStepIds());
        assertTrue(s.getReadyBatch(10).isEmpty());

        s.markSettled("llm", text("y"));
        ReadyBatch last = s.getReadyBatch(10);
        assertEquals(List.of("output"), last.getStepIds());
        assertEquals(List.of("llm"), last.getSteps().get(0).getSourceStepIds());
        assertEquals("y", last.getSteps().get(0).getSnapshot().getOutput("llm").orElseThrow().asText());

        s.markSettled("output", text("done"));
        assertTrue(s.isComplete());
        assertEquals(List.of("output"), s.settledTerminals());
        assertTrue(s.unreachedTerminals().isEmpty());
    }

    @Test
    void join_waitsForEveryPredecessor() {
        ReadinessScheduler s = scheduler(WorkflowDefinition.builder("diamond")
                .step("start", "input")
                .step("a", "transform")
                .step("b", "transform")
                .step("join", "output")
                .edge("start", "a")
                .edge("start", "b")
                .edge("a", "join")
                .edge("b", "join")
                .build());

        s.getReadyBatch(10);
        s.markSettled("start", text("s"));
        assertEquals(Set.of("a", "b"), Set.copyOf(s.getReadyBatch(10).getStepIds()));

        s.markSettled("a", text("A"));
        assertEquals(StepStatus.PENDING, s.statusOf("join"));
        assertEquals(1, s.getState().unresolvedDependencyCount("join"));
        assertFalse(s.isComplete());

        s.markSettled("b", text("B"));
        assertEquals(StepStatus.READY, s.statusOf("join"));
        ReadyStep join = s.getReadyBatch(10).getSteps().get(0);
        assertEquals(Set.of("a", "b"), Set.copyOf(join.getSourceStepIds()));
    }

    @Test
    void getReadyBatch_respectsMaxConcurrent() {
        ReadinessScheduler s = scheduler(WorkflowDefinition.builder("fan-out")
                .step("start", "input")
                .step("a", "transform")
                .step("b", "transform")
                .step("c", "transform")
                .edge("start", "a")
                .edge("start", "b")
                .edge("start", "c")
                .build());
        s.getReadyBatch(10);
        s.markSettled("start", text("s"));

        ReadyBatch first = s.getReadyBatch(2);
        assertEquals(2, first.size());
        assertEquals(2, s.getState().executing().size());
        ReadyBatch second = s.getReadyBatch(2);
        assertEquals(1, second.size());
        assertFalse(first.getStepIds().contains(second.getStepIds().get(0)));
        assertThrows(IllegalArgumentException.class, () -> s.getReadyBatch(0));
    }

    @Test
    void selectedHandle_prunesOtherBranch_andJoinStillRuns() {
        ReadinessScheduler s = scheduler(WorkflowDefinition.builder("branch")
                .step("cond", "conditional")
                .step("yes", "transform")
                .step("no", "transform")
                .step("out", "output")
                .edge(EdgeDefinition.onHandle("cond-true", "cond", "true", "yes"))
                .edge(EdgeDefinition.onHandle("cond-false", "cond", "false", "no"))
                .edge("yes", "out")
                .edge("no", "out")
                .build());

        s.getReadyBatch(10);
        s.markSettled("cond", JsonNodeFactory.instance.objectNode().put("result", true), List.of("true"));

        assertEquals(StepStatus.READY, s.statusOf("yes"));
        assertEquals(StepStatus.PRUNED, s.statusOf("no"));
        assertEquals(EdgeState.PRUNED, s.getState().edgeState("no->out"));

        s.getReadyBatch(10);
        s.markSettled("yes", text("Y"));
        assertEquals(StepStatus.READY, s.statusOf("out"));
        assertEquals(List.of("yes"), s.getReadyBatch(10).getSteps().get(0).getSourceStepIds());
    }

    @Test
    void allPredecessorsPruned_prunesTerminal() {
        ReadinessScheduler s = scheduler(WorkflowDefinition.builder("dead-branch")
                .step("cond", "conditional")
                .step("yes", "output")
                .step("no", "transform")
                .step("noOut", "output")
                .edge(EdgeDefinition.onHandle("cond-true", "cond", "true", "yes"))
                .edge(EdgeDefinition.onHandle("cond-false", "cond", "false", "no"))
                .edge("no", "noOut")
                .build());

        s.getReadyBatch(10);
        s.markSettled("cond", text("c"), List.of("true"));

        assertEquals(StepStatus.PRUNED, s.statusOf("no"));
        assertEquals(StepStatus.PRUNED, s.statusOf("noOut"));
        s.getReadyBatch(10);
        s.markSettled("yes", text("Y"));
        assertTrue(s.isComplete());
        assertEquals(List.of("yes"), s.settledTerminals());
        assertTrue(s.unreachedTerminals().isEmpty());
    }

    @Test
    void failureWithErrorEdge_takesOnlyTheErrorBranch() {
        ReadinessScheduler s = scheduler(WorkflowDefinition.builder("fallback")
                .step("input", "input")
                .step("process", "llm")
                .step("fallback", "llm")
                .step("output", "output")
                .edge("input", "process")
                .edge("process", "output")
                .errorEdge("process", "fallback")
                .edge("fallback", "output")
                .build());

        s.getReadyBatch(10);
        s.markSettled("input", text("in"));
        s.getReadyBatch(10);
        RoutingDecision decision = s.markFailed("process", "model unavailable");

        assertTrue(decision.isRouted());
        assertEquals(StepStatus.SETTLED, s.statusOf("process"));
        assertEquals(EdgeState.PRUNED, s.getState().edgeState("process->output"));
        assertEquals(EdgeState.SATISFIED, s.getState().edgeState("process-error->fallback"));
        assertEquals(StepStatus.READY, s.statusOf("fallback"));
        assertEquals(StepStatus.PENDING, s.statusOf("output"));
        assertEquals("model unavailable", s.getState().getErrors().get("process"));
        assertTrue(ExecutionContext.isErrorOutput(s.getContext().getOutput("process").orElseThrow()));

        s.getReadyBatch(10);
        s.markSettled("fallback", text("recovered"));
        ReadyStep output = s.getReadyBatch(10).getSteps().get(0);
        assertEquals("output", output.getStepId());
        assertEquals(List.of("fallback"), output.getSourceStepIds());
    }

    @Test
    void successWithErrorEdge_prunesErrorBranch() {
        ReadinessScheduler s = scheduler(WorkflowDefinition.builder("fallback-unused")
                .step("process", "llm")
                .step("fallback", "llm")
                .step("output", "output")
                .edge("process", "output")
                .errorEdge("process", "fallback")
                .edge("fallback", "output")
                .build());

        s.getReadyBatch(10);
        s.markSettled("process", text("ok"));

        assertEquals(StepStatus.PRUNED, s.statusOf("fallback"));
        assertEquals(StepStatus.READY, s.statusOf("output"));
    }

    @Test
    void failureWithoutErrorEdge_blocksDownstreamEagerly() {
        ReadinessScheduler s = scheduler(WorkflowDefinition.builder("fatal")
                .step("start", "input")
                .step("a", "llm")
                .step("slow", "llm")
                .step("join", "transform")
                .step("out", "output")
                .edge("start", "a")
                .edge("start", "slow")
                .edge("a", "join")
                .edge("slow", "join")
                .edge("join", "out")
                .build());

        s.getReadyBatch(10);
        s.markSettled("start", text("s"));
        s.getReadyBatch(10);
        RoutingDecision decision = s.markFailed("a", "boom");

        assertFalse(decision.isRouted());
        assertEquals(StepStatus.FAILED, s.statusOf("a"));
        assertEquals(StepStatus.UNREACHABLE, s.statusOf("join"), "join is closed while slow is still executing");
        assertEquals(StepStatus.UNREACHABLE, s.statusOf("out"));
        assertEquals(StepStatus.EXECUTING, s.statusOf("slow"));
        assertFalse(s.isComplete());

        s.markSettled("slow", text("late"));
        assertTrue(s.isComplete());
        assertEquals(List.of("out"), s.unreachedTerminals());
        assertTrue(s.settledTerminals().isEmpty());
    }

    @Test
    void completingANonExecutingStep_isRejected() {
        ReadinessScheduler s = scheduler(WorkflowDefinition.builder("linear")
                .step("a", "input")
                .step("b", "output")
                .edge("a", "b")
                .build());

        assertThrows(IllegalStateException.class, () -> s.markSettled("b", text("x")));
        assertThrows(IllegalStateException.class, () -> s.markFailed("a", "not started"));
    }

    @Test
    void secondCompletion_isIgnored() {
        ReadinessScheduler s = scheduler(WorkflowDefinition.builder("single")
                .step("a", "input")
                .step("b", "output")
                .edge("a", "b")
                .build());
        s.getReadyBatch(10);
        s.markSettled("a", text("first"));
        QueueState before = s.getState();

        s.markSettled("a", text("second"));
        assertNull(s.markFailed("a", "late failure"));

        assertEquals(before.getSteps(), s.getState().getSteps());
        assertEquals("first", s.getContext().getOutput("a").orElseThrow().asText());
    }

    @Test
    void cancelExecuting_marksStepsCancelled_andIgnoresLateCompletions() {
        ReadinessScheduler s = scheduler(WorkflowDefinition.builder("cancel")
                .step("a", "input")
                .step("b", "output")
                .edge("a", "b")
                .build());
        s.getReadyBatch(10);

        assertEquals(List.of("a"), s.cancelExecuting());
        assertEquals(StepStatus.CANCELLED, s.statusOf("a"));
        assertTrue(s.isComplete());

        s.markSettled("a", text("late"));
        assertEquals(StepStatus.CANCELLED, s.statusOf("a"));
        assertEquals(StepStatus.PENDING, s.statusOf("b"));
        assertFalse(s.getContext().hasOutput("a"));
    }

    @Test
    void progress_countsResolvedSteps() {
        ReadinessScheduler s = scheduler(WorkflowDefinition.builder("progress")
                .step("a", "input")
                .step("b", "transform")
                .step("c", "output")
                .edge("a", "b")
                .edge("b", "c")
                .build());
        s.getReadyBatch(10);
        s.markSettled("a", text("a"));

        ExecutionProgress progress = s.progress();
        assertEquals(3, progress.getTotal());
        assertEquals(1, progress.getCompleted());
        assertEquals(1, progress.getReady());
        assertEquals(33, progress.getPercentage());
    }
}
