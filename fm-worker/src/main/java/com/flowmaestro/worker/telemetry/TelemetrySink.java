package com.flowmaestro.worker.telemetry;

/**
 * Span backend collaborator. Implementations may throw; callers go through {@link LifecycleGlue}.
 */
public interface TelemetrySink {

    SpanHandle startSpan(String name, SpanKind kind);

    void endSpan(SpanHandle handle);
}
