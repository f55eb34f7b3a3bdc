package com.flowmaestro.worker.workflow;

import com.flowmaestro.worker.run.RunResult;
import io.temporal.workflow.SignalMethod;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

/**
 * Durable host for one workflow run. The coordinating loop runs in the workflow; every step,
 * ledger call and event is an activity.
 */
@WorkflowInterface
public interface FlowWorkflow {

    /**
     * Compiles and runs the definition.
     *
     * @return the run result; step failures, budget denial and compile errors are reported in it
     */
    @WorkflowMethod
    RunResult run(RunWorkflowRequest request);

    /** Stops issuing batches; executing steps are cancelled and the reservation is finished. */
    @SignalMethod
    void cancel(String reason);
}
