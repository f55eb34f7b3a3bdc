package com.flowmaestro.worker.activity;

import com.flowmaestro.ledger.CreditLedger;
import com.flowmaestro.ledger.InsufficientBudgetException;
import com.flowmaestro.ledger.ReservationHandle;
import com.flowmaestro.worker.dispatch.StepCompletion;
import com.flowmaestro.worker.dispatch.StepInvocation;
import com.flowmaestro.worker.dispatch.StepInvoker;
import com.flowmaestro.worker.telemetry.EventPublisher;
import com.flowmaestro.worker.telemetry.ExecutionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Activity implementation backed by the worker's step invoker, credit ledger and event publisher.
 */
public class FlowActivitiesImpl implements FlowActivities {

    private static final Logger log = LoggerFactory.getLogger(FlowActivitiesImpl.class);

    private final StepInvoker invoker;
    private final CreditLedger ledger;
    private final EventPublisher events;

    public FlowActivitiesImpl(StepInvoker invoker, CreditLedger ledger, EventPublisher events) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.events = Objects.requireNonNull(events, "events");
    }

    @Override
    public StepCompletion executeStep(StepInvocation invocation) {
        if (log.isInfoEnabled()) {
            log.info("ExecuteStep | runId={} | stepId={} | kind={}",
                    invocation.getMeta().getRunId(), invocation.stepId(), invocation.getKind());
        }
        return invoker.invoke(invocation);
    }

    @Override
    public boolean checkAllowance(String subjectId, long amount) {
        return ledger.checkAllowance(subjectId, amount);
    }

    @Override
    public ReservationHandle holdCredits(String subjectId, long amount) {
        try {
            return ledger.hold(subjectId, amount);
        } catch (InsufficientBudgetException e) {
            log.info("Hold refused | subject={} | amount={} | reason={}", subjectId, amount, e.getMessage());
            return null;
        }
    }

    @Override
    public void settleCredits(ReservationHandle handle, long actualAmount) {
        ledger.settle(handle, actualAmount);
    }

    @Override
    public void releaseCredits(ReservationHandle handle) {
        ledger.release(handle);
    }

    @Override
    public void publishEvent(ExecutionEvent event) {
        events.publish(event);
    }
}
