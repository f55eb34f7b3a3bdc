package com.flowmaestro.worker.telemetry;

/** Sink used when spans are not recorded (e.g. inside a workflow, where replay would double count). */
public final class NoOpTelemetrySink implements TelemetrySink {

    public static final NoOpTelemetrySink INSTANCE = new NoOpTelemetrySink();

    @Override
    public SpanHandle startSpan(String name, SpanKind kind) {
        return new SpanHandle(name, kind, 0L, null);
    }

    @Override
    public void endSpan(SpanHandle handle) {
    }
}
