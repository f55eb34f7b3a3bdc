package com.flowmaestro.worker.workflow;

import com.flowmaestro.worker.activity.FlowActivities;
import com.flowmaestro.worker.telemetry.EventPublisher;
import com.flowmaestro.worker.telemetry.ExecutionEvent;
import com.flowmaestro.worker.telemetry.LifecycleGlue;
import io.temporal.workflow.Async;
import io.temporal.workflow.Promise;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Publishes events as asynchronous activities. {@link #flush()} waits for them before the workflow
 * completes, otherwise late activity completions would report against a closed run.
 */
final class ActivityEventPublisher implements EventPublisher {

    private static final Logger log = Workflow.getLogger(ActivityEventPublisher.class);

    private final FlowActivities activities;
    private final List<Promise<Void>> pending = new ArrayList<>();

    ActivityEventPublisher(FlowActivities activities) {
        this.activities = Objects.requireNonNull(activities, "activities");
    }

    @Override
    public void publish(ExecutionEvent event) {
        pending.add(Async.procedure(activities::publishEvent, event));
    }

    void flush() {
        for (Promise<Void> p : pending) {
            try {
                p.get();
            } catch (RuntimeException e) {
                log.warn("{} | operation=publishEvent | error={}", LifecycleGlue.COLLABORATOR_FAILURE, e.getMessage());
            }
        }
        pending.clear();
    }
}
