package com.flowmaestro.worker.activity;

import com.flowmaestro.ledger.ReservationHandle;
import com.flowmaestro.worker.dispatch.StepCompletion;
import com.flowmaestro.worker.dispatch.StepInvocation;
import com.flowmaestro.worker.telemetry.ExecutionEvent;
import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

/**
 * Side-effecting work of a run, executed outside the workflow: steps, ledger calls and event
 * publishing.
 */
@ActivityInterface
public interface FlowActivities {

    /**
     * Executes one step. Never fails for a step error: the outcome carries it.
     *
     * @param invocation kind, resolved-at-dispatch context snapshot, config and step identity
     * @return outcome and duration
     */
    @ActivityMethod
    StepCompletion executeStep(StepInvocation invocation);

    @ActivityMethod
    boolean checkAllowance(String subjectId, long amount);

    /**
     * Places a credit hold.
     *
     * @return the handle, or null when the subject cannot afford {@code amount}
     */
    @ActivityMethod
    ReservationHandle holdCredits(String subjectId, long amount);

    @ActivityMethod
    void settleCredits(ReservationHandle handle, long actualAmount);

    @ActivityMethod
    void releaseCredits(ReservationHandle handle);

    @ActivityMethod
    void publishEvent(ExecutionEvent event);
}
