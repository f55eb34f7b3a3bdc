package com.flowmaestro.worker.workflow;

import com.flowmaestro.graph.GraphCompiler;
import com.flowmaestro.worker.activity.FlowActivities;
import com.flowmaestro.worker.dispatch.CancellationToken;
import com.flowmaestro.worker.run.CostEstimator;
import com.flowmaestro.worker.run.RunOptions;
import com.flowmaestro.worker.run.RunResult;
import com.flowmaestro.worker.run.WorkflowRunner;
import com.flowmaestro.worker.telemetry.LifecycleGlue;
import com.flowmaestro.worker.telemetry.NoOpTelemetrySink;
import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.time.Duration;

/**
 * Runs {@link WorkflowRunner} inside the workflow with Temporal-backed collaborators: steps,
 * ledger and events are activities, time is {@link Workflow#currentTimeMillis()}, the run id is
 * the workflow id. Spans are not recorded here; step metrics come from the activity side.
 */
public class FlowWorkflowImpl implements FlowWorkflow {

    private static final Logger log = Workflow.getLogger(FlowWorkflowImpl.class);
    private static final Duration LEDGER_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration EVENT_TIMEOUT = Duration.ofSeconds(10);

    private CancellationToken cancellation;
    private String pendingCancelReason;

    @Override
    public RunResult run(RunWorkflowRequest request) {
        String runId = Workflow.getInfo().getWorkflowId();
        FlowActivities stepActivities = Workflow.newActivityStub(FlowActivities.class,
                ActivityOptions.newBuilder()
                        .setStartToCloseTimeout(Duration.ofSeconds(request.getStepTimeoutSeconds()))
                        .build());
        FlowActivities ledgerActivities = Workflow.newActivityStub(FlowActivities.class,
                ActivityOptions.newBuilder()
                        .setStartToCloseTimeout(LEDGER_TIMEOUT)
                        .setRetryOptions(RetryOptions.newBuilder()
                                .setDoNotRetry(IllegalStateException.class.getName())
                                .build())
                        .build());
        FlowActivities eventActivities = Workflow.newActivityStub(FlowActivities.class,
                ActivityOptions.newBuilder()
                        .setStartToCloseTimeout(EVENT_TIMEOUT)
                        .setRetryOptions(RetryOptions.newBuilder().setMaximumAttempts(3).build())
                        .build());

        cancellation = CancellationToken.withTimeout(Workflow::currentTimeMillis, request.getRunTimeoutSeconds() * 1000L);
        if (pendingCancelReason != null) {
            cancellation.cancel(pendingCancelReason);
        }
        ActivityEventPublisher events = new ActivityEventPublisher(eventActivities);
        WorkflowRunner runner = WorkflowRunner.builder()
                .dispatcher(new TemporalBatchDispatcher(stepActivities))
                .creditLedger(new ActivityBackedCreditLedger(ledgerActivities))
                .glue(new LifecycleGlue(NoOpTelemetrySink.INSTANCE, events, Workflow::currentTimeMillis))
                .compiler(new GraphCompiler(request.getDefaultMaxConcurrent()))
                .costEstimator(CostEstimator.perStep(request.getDefaultStepCost()))
                .maxOutputBytes(request.getMaxOutputBytes())
                .clock(Workflow::currentTimeMillis)
                .runIdSupplier(() -> runId)
                .build();

        log.info("Flow workflow started | runId={} | workflow={} | subject={}",
                runId, request.getDefinition().getName(), request.getBudgetSubject());
        try {
            return runner.runDefinition(request.getDefinition(), request.getInputs(), request.getBudgetSubject(),
                    RunOptions.of(runId, cancellation));
        } finally {
            events.flush();
        }
    }

    @Override
    public void cancel(String reason) {
        log.info("Cancel signal received | reason={}", reason);
        if (cancellation != null) {
            cancellation.cancel(reason);
        } else {
            pendingCancelReason = reason != null ? reason : "Cancelled";
        }
    }
}
