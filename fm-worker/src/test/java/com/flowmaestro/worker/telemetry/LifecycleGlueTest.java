package com.flowmaestro.worker.telemetry;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowmaestro.graph.GraphCompiler;
import com.flowmaestro.graph.compiled.CompiledGraph;
import com.flowmaestro.graph.definition.WorkflowDefinition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LifecycleGlueTest {

    private static final class RecordingSink implements TelemetrySink {
        final List<String> started = new ArrayList<>();
        final List<String> ended = new ArrayList<>();

        @Override
        public SpanHandle startSpan(String name, SpanKind kind) {
            started.add(kind + ":" + name);
            return new SpanHandle(name, kind, 0L, null);
        }

        @Override
        public void endSpan(SpanHandle handle) {
            ended.add(handle.getKind() + ":" + handle.getName());
        }
    }

    private final CompiledGraph graph = new GraphCompiler(4).compile(WorkflowDefinition.builder("glue")
            .step("input", "input")
            .step("llm", "llm")
            .edge("input", "llm")
            .build());

    @Test
    void spansOpenAndCloseWithSteps_andRunDurationUsesClock() {
        RecordingSink sink = new RecordingSink();
        List<ExecutionEvent> events = new ArrayList<>();
        AtomicLong clock = new AtomicLong(1_000L);
        LifecycleGlue glue = new LifecycleGlue(sink, events::add, clock::get);

        glue.runStarted("r1", graph);
        glue.stepStarted("r1", graph.getStep("llm"));
        clock.addAndGet(250L);
        glue.stepCompleted("r1", graph.getStep("llm"), TextNode.valueOf("ok"), 250L);
        glue.runCompleted("r1", JsonNodeFactory.instance.objectNode());

        assertEquals(List.of("RUN:run:glue", "STEP:step:llm"), sink.started);
        assertEquals(List.of("STEP:step:llm", "RUN:run:glue"), sink.ended);
        ExecutionEvent completed = events.get(events.size() - 1);
        assertEquals(ExecutionEventType.EXECUTION_COMPLETED, completed.getType());
        assertEquals(Long.valueOf(250L), completed.getDuration());
        assertEquals(Integer.valueOf(2), events.get(0).getTotalNodes());
    }

    @Test
    void abandonedStep_closesSpanWithoutEvent() {
        RecordingSink sink = new RecordingSink();
        List<ExecutionEvent> events = new ArrayList<>();
        LifecycleGlue glue = new LifecycleGlue(sink, events::add, () -> 0L);

        glue.stepStarted("r1", graph.getStep("llm"));
        glue.stepAbandoned("r1", graph.getStep("llm"));
        glue.stepAbandoned("r1", graph.getStep("llm"));

        assertEquals(1, sink.ended.size());
        assertEquals(1, events.size());
        assertEquals(ExecutionEventType.NODE_STARTED, events.get(0).getType());
    }

    @Test
    void collaboratorFailures_areSwallowed() {
        TelemetrySink failingSink = new TelemetrySink() {
            @Override
            public SpanHandle startSpan(String name, SpanKind kind) {
                throw new IllegalStateException("sink down");
            }

            @Override
            public void endSpan(SpanHandle handle) {
                throw new IllegalStateException("sink down");
            }
        };
        LifecycleGlue glue = new LifecycleGlue(failingSink, event -> {
            throw new IllegalStateException("bus down");
        }, () -> 0L);

        assertDoesNotThrow(() -> {
            glue.runStarted("r1", graph);
            glue.stepStarted("r1", graph.getStep("input"));
            glue.stepFailed("r1", graph.getStep("input"), "boom");
            glue.runFailed("r1", "StepExecutionFailure");
        });
    }

    @Test
    void failedStepEvent_carriesError() {
        List<ExecutionEvent> events = new ArrayList<>();
        LifecycleGlue glue = new LifecycleGlue(null, events::add, () -> 5L);

        glue.stepFailed("r1", graph.getStep("llm"), "quota exceeded");

        ExecutionEvent failed = events.get(0);
        assertEquals(ExecutionEventType.NODE_FAILED, failed.getType());
        assertEquals("llm", failed.getNodeId());
        assertEquals("llm", failed.getNodeType());
        assertEquals("quota exceeded", failed.getError());
        assertEquals(5L, failed.getTimestamp());
    }
}
