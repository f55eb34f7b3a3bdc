package com.flowmaestro.worker.workflow;

import com.flowmaestro.worker.activity.FlowActivities;
import com.flowmaestro.worker.dispatch.BatchDispatcher;
import com.flowmaestro.worker.dispatch.BatchResult;
import com.flowmaestro.worker.dispatch.CancellationToken;
import com.flowmaestro.worker.dispatch.StepCompletion;
import com.flowmaestro.worker.dispatch.StepInvocation;
import com.flowmaestro.worker.dispatch.StepOutcome;
import io.temporal.workflow.Async;
import io.temporal.workflow.CancellationScope;
import io.temporal.workflow.Promise;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs each batch member as an {@code executeStep} activity and waits until all have reported or
 * the run is cancelled. On cancellation the remaining activities are cancelled through their scope.
 */
public final class TemporalBatchDispatcher implements BatchDispatcher {

    private static final Logger log = Workflow.getLogger(TemporalBatchDispatcher.class);

    private final FlowActivities activities;

    public TemporalBatchDispatcher(FlowActivities activities) {
        this.activities = Objects.requireNonNull(activities, "activities");
    }

    @Override
    public BatchResult dispatch(List<StepInvocation> batch, CancellationToken cancellation) {
        List<Promise<StepCompletion>> promises = new ArrayList<>(batch.size());
        CancellationScope scope = Workflow.newCancellationScope(() -> {
            for (StepInvocation invocation : batch) {
                promises.add(Async.function(activities::executeStep, invocation));
            }
        });
        scope.run();

        long remaining = cancellation.remainingMillis();
        if (remaining == Long.MAX_VALUE) {
            Workflow.await(() -> allCompleted(promises) || cancellation.isCancelled());
        } else {
            Workflow.await(Duration.ofMillis(remaining), () -> allCompleted(promises) || cancellation.isCancelled());
        }
        boolean cancelled = !allCompleted(promises);
        if (cancelled) {
            log.info("Batch cancelled | reason={}", cancellation.getReason());
            scope.cancel(cancellation.getReason());
        }

        List<StepCompletion> completions = new ArrayList<>(batch.size());
        for (int i = 0; i < promises.size(); i++) {
            Promise<StepCompletion> p = promises.get(i);
            if (!p.isCompleted()) continue;
            RuntimeException failure = p.getFailure();
            if (failure == null) {
                completions.add(p.get());
            } else {
                String stepId = batch.get(i).stepId();
                log.warn("Step activity failed | stepId={} | error={}", stepId, failure.getMessage());
                completions.add(new StepCompletion(stepId, StepOutcome.failure(rootMessage(failure)), 0L));
            }
        }
        return new BatchResult(completions, cancelled);
    }

    private static boolean allCompleted(List<Promise<StepCompletion>> promises) {
        for (Promise<StepCompletion> p : promises) {
            if (!p.isCompleted()) return false;
        }
        return true;
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : t.getMessage();
    }
}
