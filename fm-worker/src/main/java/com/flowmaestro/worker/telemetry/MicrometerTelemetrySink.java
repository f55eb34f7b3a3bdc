package com.flowmaestro.worker.telemetry;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Objects;

/**
 * Records each span as a Micrometer timer sample: {@value #SPAN_TIMER} tagged with span kind and name.
 */
public final class MicrometerTelemetrySink implements TelemetrySink {

    static final String SPAN_TIMER = "flowmaestro.span";

    private final MeterRegistry registry;

    public MicrometerTelemetrySink(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public SpanHandle startSpan(String name, SpanKind kind) {
        return new SpanHandle(name, kind, System.nanoTime(), Timer.start(registry));
    }

    @Override
    public void endSpan(SpanHandle handle) {
        if (!(handle.getState() instanceof Timer.Sample sample)) return;
        sample.stop(Timer.builder(SPAN_TIMER)
                .tag("kind", handle.getKind().name().toLowerCase())
                .tag("name", handle.getName())
                .register(registry));
    }
}
