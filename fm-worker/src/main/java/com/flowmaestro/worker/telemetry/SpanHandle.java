package com.flowmaestro.worker.telemetry;

import java.util.Objects;

/**
 * Opaque handle returned by {@link TelemetrySink#startSpan}; sinks may attach their own state.
 */
public final class SpanHandle {

    private final String name;
    private final SpanKind kind;
    private final long startNanos;
    private final Object state;

    public SpanHandle(String name, SpanKind kind, long startNanos, Object state) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.startNanos = startNanos;
        this.state = state;
    }

    public String getName() {
        return name;
    }

    public SpanKind getKind() {
        return kind;
    }

    public long getStartNanos() {
        return startNanos;
    }

    /** Sink-specific state, e.g. a timer sample. */
    public Object getState() {
        return state;
    }
}
