package com.flowmaestro.worker.telemetry;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowmaestro.graph.compiled.CompiledGraph;
import com.flowmaestro.graph.compiled.Step;
import com.flowmaestro.worker.engine.ExecutionProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Observes run and step transitions for the telemetry sink and event publisher. Fail-safe: every
 * collaborator call is wrapped, and a failure is logged as {@value #COLLABORATOR_FAILURE} and
 * never reaches the caller. Nothing here influences scheduling.
 */
public final class LifecycleGlue {

    private static final Logger log = LoggerFactory.getLogger(LifecycleGlue.class);

    public static final String COLLABORATOR_FAILURE = "CollaboratorFailure";

    private final TelemetrySink telemetry;
    private final EventPublisher events;
    private final LongSupplier clock;
    private final Map<String, SpanHandle> openSpans = new ConcurrentHashMap<>();
    private final Map<String, Long> runStartedAt = new ConcurrentHashMap<>();

    public LifecycleGlue(TelemetrySink telemetry, EventPublisher events, LongSupplier clock) {
        this.telemetry = telemetry != null ? telemetry : NoOpTelemetrySink.INSTANCE;
        this.events = events != null ? events : new LoggingEventPublisher();
        this.clock = clock != null ? clock : System::currentTimeMillis;
    }

    /** No spans, events logged at debug. */
    public static LifecycleGlue noop() {
        return new LifecycleGlue(NoOpTelemetrySink.INSTANCE, new LoggingEventPublisher(), System::currentTimeMillis);
    }

    public void runStarted(String runId, CompiledGraph graph) {
        runStartedAt.put(runId, clock.getAsLong());
        guard("runStarted", runId, () -> openSpans.put(runKey(runId), telemetry.startSpan("run:" + graph.getName(), SpanKind.RUN)));
        guard("runStarted", runId, () -> events.publish(ExecutionEvent.executionStarted(runId, graph.getSteps().size(), clock.getAsLong())));
    }

    public void stepStarted(String runId, Step step) {
        guard("stepStarted", runId, () -> openSpans.put(stepKey(runId, step.getId()), telemetry.startSpan("step:" + step.getKind(), SpanKind.STEP)));
        guard("stepStarted", runId, () -> events.publish(ExecutionEvent.nodeStarted(runId, step, clock.getAsLong())));
    }

    public void stepCompleted(String runId, Step step, JsonNode output, long durationMs) {
        endSpan(stepKey(runId, step.getId()), runId);
        guard("stepCompleted", runId, () -> events.publish(ExecutionEvent.nodeCompleted(runId, step, output, durationMs, clock.getAsLong())));
    }

    public void stepFailed(String runId, Step step, String error) {
        endSpan(stepKey(runId, step.getId()), runId);
        guard("stepFailed", runId, () -> events.publish(ExecutionEvent.nodeFailed(runId, step, error, clock.getAsLong())));
    }

    /** Ends the spans of steps that will never report back (cancelled). */
    public void stepAbandoned(String runId, Step step) {
        endSpan(stepKey(runId, step.getId()), runId);
    }

    public void progress(String runId, ExecutionProgress progress) {
        guard("progress", runId, () -> events.publish(ExecutionEvent.executionProgress(runId, progress, clock.getAsLong())));
    }

    public void runCompleted(String runId, JsonNode outputs) {
        Long started = runStartedAt.remove(runId);
        long duration = started != null ? clock.getAsLong() - started : 0L;
        endSpan(runKey(runId), runId);
        guard("runCompleted", runId, () -> events.publish(ExecutionEvent.executionCompleted(runId, outputs, duration, clock.getAsLong())));
    }

    public void runFailed(String runId, String error) {
        runStartedAt.remove(runId);
        endSpan(runKey(runId), runId);
        guard("runFailed", runId, () -> events.publish(ExecutionEvent.executionFailed(runId, error, clock.getAsLong())));
    }

    private void endSpan(String key, String runId) {
        SpanHandle handle = openSpans.remove(key);
        if (handle != null) {
            guard("endSpan", runId, () -> telemetry.endSpan(handle));
        }
    }

    private static void guard(String operation, String runId, Runnable call) {
        try {
            call.run();
        } catch (Throwable t) {
            log.warn("{} | operation={} | runId={} | error={}", COLLABORATOR_FAILURE, operation, runId, t.getMessage(), t);
        }
    }

    private static String runKey(String runId) {
        return runId;
    }

    private static String stepKey(String runId, String stepId) {
        return runId + "/" + stepId;
    }
}
