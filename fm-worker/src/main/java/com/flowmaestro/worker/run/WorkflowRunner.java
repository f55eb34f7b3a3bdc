package com.flowmaestro.worker.run;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowmaestro.config.FlowConfig;
import com.flowmaestro.executioncontext.ExecutionContext;
import com.flowmaestro.graph.GraphCompileException;
import com.flowmaestro.graph.GraphCompiler;
import com.flowmaestro.graph.compiled.CompiledGraph;
import com.flowmaestro.graph.compiled.Step;
import com.flowmaestro.graph.definition.WorkflowDefinition;
import com.flowmaestro.ledger.AdmissionDecision;
import com.flowmaestro.ledger.AdmissionGate;
import com.flowmaestro.ledger.CreditLedger;
import com.flowmaestro.ledger.InsufficientBudgetException;
import com.flowmaestro.ledger.Reservation;
import com.flowmaestro.worker.dispatch.BatchDispatcher;
import com.flowmaestro.worker.dispatch.BatchResult;
import com.flowmaestro.worker.dispatch.CancellationToken;
import com.flowmaestro.worker.dispatch.StepCompletion;
import com.flowmaestro.worker.dispatch.StepInvocation;
import com.flowmaestro.worker.dispatch.StepOutcome;
import com.flowmaestro.worker.engine.QueueState;
import com.flowmaestro.worker.engine.ReadinessScheduler;
import com.flowmaestro.worker.engine.ReadyBatch;
import com.flowmaestro.worker.engine.ReadyStep;
import com.flowmaestro.worker.telemetry.LifecycleGlue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Coordinates one run: admission, then a "dispatch ready batch, wait, re-evaluate" loop over the
 * {@link ReadinessScheduler}, then settlement. Always returns a {@link RunResult}; step failures,
 * budget denial, compile errors and cancellation are reported in it, never thrown.
 * <p>
 * The reservation is finished in a {@code finally} block: settled on the recorded cost if any
 * step was dispatched, released otherwise. All time and ids come from the injected clock and id
 * supplier, so the loop can run inside a deterministic workflow host.
 */
public final class WorkflowRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final BatchDispatcher dispatcher;
    private final AdmissionGate admission;
    private final LifecycleGlue glue;
    private final CostEstimator costEstimator;
    private final GraphCompiler compiler;
    private final int maxOutputBytes;
    private final LongSupplier clock;
    private final long runTimeoutMillis;
    private final Supplier<String> runIdSupplier;

    private WorkflowRunner(Builder b) {
        this.dispatcher = Objects.requireNonNull(b.dispatcher, "dispatcher");
        this.admission = Objects.requireNonNull(b.admission, "admission");
        this.glue = b.glue != null ? b.glue : LifecycleGlue.noop();
        this.costEstimator = b.costEstimator != null ? b.costEstimator : CostEstimator.perStep(1L);
        this.compiler = b.compiler != null ? b.compiler : new GraphCompiler(FlowConfig.DEFAULT_MAX_CONCURRENT_STEPS);
        this.maxOutputBytes = b.maxOutputBytes > 0 ? b.maxOutputBytes : ExecutionContext.DEFAULT_MAX_OUTPUT_BYTES;
        this.clock = b.clock != null ? b.clock : System::currentTimeMillis;
        this.runTimeoutMillis = b.runTimeoutMillis;
        this.runIdSupplier = b.runIdSupplier != null ? b.runIdSupplier : () -> UUID.randomUUID().toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder with compiler, cost estimate, output limit and run timeout taken from configuration. */
    public static Builder builder(FlowConfig config) {
        return new Builder()
                .compiler(new GraphCompiler(config.getMaxConcurrentSteps()))
                .costEstimator(CostEstimator.perStep(config.getDefaultStepCost()))
                .maxOutputBytes(config.getMaxOutputBytes())
                .runTimeoutMillis(config.getRunTimeoutSeconds() * 1000L);
    }

    public RunResult runWorkflow(CompiledGraph graph, ObjectNode inputs, String budgetSubject) {
        return runWorkflow(graph, inputs, budgetSubject, RunOptions.defaults());
    }

    /** Compiles the definition first; a compile error is returned before any admission check. */
    public RunResult runDefinition(WorkflowDefinition definition, ObjectNode inputs, String budgetSubject) {
        return runDefinition(definition, inputs, budgetSubject, RunOptions.defaults());
    }

    public RunResult runDefinition(WorkflowDefinition definition, ObjectNode inputs, String budgetSubject, RunOptions options) {
        String runId = options.getRunId() != null ? options.getRunId() : runIdSupplier.get();
        CompiledGraph graph;
        try {
            graph = compiler.compile(definition);
        } catch (GraphCompileException e) {
            log.warn("Run rejected at compile | runId={} | code={} | error={}", runId, e.getErrorCode(), e.getMessage());
            return RunResult.rejected(runId, RunErrorCode.fromCode(e.getErrorCode()), e.getMessage());
        }
        return runWorkflow(graph, inputs, budgetSubject, RunOptions.of(runId, options.getCancellation()));
    }

    public RunResult runWorkflow(CompiledGraph graph, ObjectNode inputs, String budgetSubject, RunOptions options) {
        Objects.requireNonNull(graph, "graph");
        RunOptions opts = options != null ? options : RunOptions.defaults();
        String runId = opts.getRunId() != null ? opts.getRunId() : runIdSupplier.get();
        CancellationToken cancellation = opts.getCancellation() != null
                ? opts.getCancellation()
                : CancellationToken.withTimeout(clock, runTimeoutMillis);

        if (log.isInfoEnabled()) {
            log.info("Run started | runId={} | subject={} | graph={}", runId, budgetSubject, graph.summary());
        }
        glue.runStarted(runId, graph);

        long estimate = costEstimator.estimate(graph);
        AdmissionDecision decision = admission.preflight(budgetSubject, estimate);
        if (!decision.isAllowed()) {
            return reject(runId, decision.getReason());
        }
        Reservation reservation;
        try {
            reservation = admission.reserve(runId, budgetSubject, estimate);
        } catch (InsufficientBudgetException e) {
            return reject(runId, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Reservation failed | runId={} | subject={} | error={}", runId, budgetSubject, e.getMessage(), e);
            return reject(runId, "Credit hold failed: " + e.getMessage());
        }

        ReadinessScheduler scheduler = new ReadinessScheduler(graph, ExecutionContext.create(inputs, maxOutputBytes));
        int dispatched = 0;
        try {
            String cancelReason = null;
            while (!scheduler.isComplete()) {
                if (cancellation.isCancelled()) {
                    cancelReason = cancellation.getReason();
                    break;
                }
                ReadyBatch batch = scheduler.getReadyBatch(graph.getMaxConcurrent());
                List<StepInvocation> invocations = new ArrayList<>(batch.size());
                for (ReadyStep ready : batch.getSteps()) {
                    glue.stepStarted(runId, ready.getStep());
                    invocations.add(StepInvocation.of(runId, ready));
                }
                dispatched += batch.size();
                BatchResult result = dispatcher.dispatch(invocations, cancellation);
                for (StepCompletion completion : result.getCompletions()) {
                    apply(runId, graph, scheduler, reservation, completion);
                }
                glue.progress(runId, scheduler.progress());
                if (result.isCancelled()) {
                    cancelReason = cancellation.getReason() != null ? cancellation.getReason() : "Dispatch interrupted";
                    break;
                }
            }
            if (cancelReason != null) {
                for (String stepId : scheduler.cancelExecuting()) {
                    glue.stepAbandoned(runId, graph.getStep(stepId));
                }
            }
            RunResult result = buildResult(runId, scheduler, cancelReason, dispatched, reservation.getActualCost());
            if (result.isSuccess()) {
                glue.runCompleted(runId, result.getOutputs());
            } else {
                glue.runFailed(runId, result.getError() + ": " + result.getMessage());
            }
            if (log.isInfoEnabled()) {
                log.info("Run finished | runId={} | success={} | error={} | dispatched={} | cost={}",
                        runId, result.isSuccess(), result.getError(), dispatched, result.getActualCost());
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Run aborted | runId={} | dispatched={}", runId, dispatched, e);
            glue.runFailed(runId, e.getMessage());
            throw e;
        } finally {
            admission.finish(reservation, dispatched > 0);
        }
    }

    private void apply(String runId, CompiledGraph graph, ReadinessScheduler scheduler, Reservation reservation,
                       StepCompletion completion) {
        Step step = graph.getStep(completion.getStepId());
        StepOutcome outcome = completion.getOutcome();
        if (outcome.getCost() != null) {
            admission.recordCost(reservation, step.getId(), outcome.getCost());
        }
        if (outcome.isSuccess()) {
            scheduler.markSettled(step.getId(), outcome.getOutput(), outcome.getSelectedHandles());
            glue.stepCompleted(runId, step, outcome.getOutput(), completion.getDurationMs());
        } else {
            scheduler.markFailed(step.getId(), outcome.getError());
            glue.stepFailed(runId, step, outcome.getError());
        }
    }

    private RunResult buildResult(String runId, ReadinessScheduler scheduler, String cancelReason,
                                  int dispatched, long actualCost) {
        QueueState state = scheduler.getState();
        List<String> settledTerminals = scheduler.settledTerminals();
        List<String> unreached = scheduler.unreachedTerminals();
        ObjectNode outputs = scheduler.getContext().aggregateOutputs(settledTerminals);
        Map<String, String> failedSteps = state.getErrors();

        if (cancelReason != null) {
            return RunResult.failed(runId, RunErrorCode.CANCELLED, cancelReason, outputs, unreached, failedSteps,
                    dispatched, actualCost);
        }
        if (unreached.isEmpty() && !settledTerminals.isEmpty()) {
            return RunResult.succeeded(runId, outputs, failedSteps, dispatched, actualCost);
        }
        if (unreached.isEmpty()) {
            return RunResult.failed(runId, RunErrorCode.UNREACHABLE_TERMINAL, "Every terminal step was pruned",
                    outputs, unreached, failedSteps, dispatched, actualCost);
        }
        if (state.failed().isEmpty()) {
            return RunResult.failed(runId, RunErrorCode.UNREACHABLE_TERMINAL, "Terminal steps not reached: " + unreached,
                    outputs, unreached, failedSteps, dispatched, actualCost);
        }
        return RunResult.failed(runId, RunErrorCode.STEP_EXECUTION_FAILURE,
                "Steps failed " + state.failed() + "; terminal steps not reached: " + unreached,
                outputs, unreached, failedSteps, dispatched, actualCost);
    }

    private RunResult reject(String runId, String reason) {
        log.info("Run rejected | runId={} | code={} | reason={}", runId, RunErrorCode.INSUFFICIENT_BUDGET.getCode(), reason);
        glue.runFailed(runId, RunErrorCode.INSUFFICIENT_BUDGET.getCode());
        return RunResult.rejected(runId, RunErrorCode.INSUFFICIENT_BUDGET, reason);
    }

    public static final class Builder {
        private BatchDispatcher dispatcher;
        private AdmissionGate admission;
        private LifecycleGlue glue;
        private CostEstimator costEstimator;
        private GraphCompiler compiler;
        private int maxOutputBytes;
        private LongSupplier clock;
        private long runTimeoutMillis;
        private Supplier<String> runIdSupplier;

        private Builder() {
        }

        public Builder dispatcher(BatchDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder admission(AdmissionGate admission) {
            this.admission = admission;
            return this;
        }

        public Builder creditLedger(CreditLedger ledger) {
            this.admission = new AdmissionGate(ledger);
            return this;
        }

        public Builder glue(LifecycleGlue glue) {
            this.glue = glue;
            return this;
        }

        public Builder costEstimator(CostEstimator costEstimator) {
            this.costEstimator = costEstimator;
            return this;
        }

        public Builder compiler(GraphCompiler compiler) {
            this.compiler = compiler;
            return this;
        }

        public Builder maxOutputBytes(int maxOutputBytes) {
            this.maxOutputBytes = maxOutputBytes;
            return this;
        }

        public Builder clock(LongSupplier clock) {
            this.clock = clock;
            return this;
        }

        /** Non-positive means no run-level timeout. */
        public Builder runTimeoutMillis(long runTimeoutMillis) {
            this.runTimeoutMillis = runTimeoutMillis;
            return this;
        }

        public Builder runIdSupplier(Supplier<String> runIdSupplier) {
            this.runIdSupplier = runIdSupplier;
            return this;
        }

        public WorkflowRunner build() {
            return new WorkflowRunner(this);
        }
    }
}
