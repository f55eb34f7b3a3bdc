package com.flowmaestro.worker.telemetry;

public enum SpanKind {
    RUN,
    STEP
}
