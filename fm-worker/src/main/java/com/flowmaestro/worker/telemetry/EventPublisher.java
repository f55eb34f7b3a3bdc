package com.flowmaestro.worker.telemetry;

/**
 * Event transport collaborator. Fire-and-forget; implementations may throw, callers go through
 * {@link LifecycleGlue}.
 */
public interface EventPublisher {

    void publish(ExecutionEvent event);
}
