package com.flowmaestro.worker.workflow;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowmaestro.executioncontext.ContextSnapshot;
import com.flowmaestro.graph.definition.StepDefinition;
import com.flowmaestro.graph.definition.WorkflowDefinition;
import com.flowmaestro.ledger.InMemoryCreditLedger;
import com.flowmaestro.worker.activity.FlowActivitiesImpl;
import com.flowmaestro.worker.dispatch.StepInvoker;
import com.flowmaestro.worker.dispatch.StepMeta;
import com.flowmaestro.worker.dispatch.StepOutcome;
import com.flowmaestro.worker.run.RunErrorCode;
import com.flowmaestro.worker.run.RunResult;
import com.flowmaestro.worker.steps.StepHandler;
import com.flowmaestro.worker.steps.StepHandlerRegistry;
import com.flowmaestro.worker.telemetry.ExecutionEvent;
import com.flowmaestro.worker.telemetry.ExecutionEventType;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowOptions;
import io.temporal.testing.TestWorkflowEnvironment;
import io.temporal.worker.Worker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowWorkflowImplTest {

    private static final String TASK_QUEUE = "flowmaestro-test";

    /** {@code shout}: upper-cases {@code config.text} and reports a cost of 2. */
    private static final class ShoutHandler implements StepHandler {
        @Override
        public String kind() {
            return "shout";
        }

        @Override
        public StepOutcome handle(ObjectNode config, ContextSnapshot snapshot, StepMeta meta) {
            return StepOutcome.success(TextNode.valueOf(config.path("text").asText().toUpperCase()), 2L);
        }
    }

    private TestWorkflowEnvironment env;
    private WorkflowClient client;
    private InMemoryCreditLedger ledger;
    private final List<ExecutionEvent> events = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        env = TestWorkflowEnvironment.newInstance();
        Worker worker = env.newWorker(TASK_QUEUE);
        worker.registerWorkflowImplementationTypes(FlowWorkflowImpl.class);
        ledger = new InMemoryCreditLedger().setBalance("acct", 50);
        StepInvoker invoker = new StepInvoker(StepHandlerRegistry.withBuiltIns().register(new ShoutHandler()));
        worker.registerActivitiesImplementations(new FlowActivitiesImpl(invoker, ledger, events::add));
        env.start();
        client = env.getWorkflowClient();
    }

    @AfterEach
    void tearDown() {
        env.close();
    }

    private FlowWorkflow stub(String workflowId) {
        return client.newWorkflowStub(FlowWorkflow.class,
                WorkflowOptions.newBuilder().setTaskQueue(TASK_QUEUE).setWorkflowId(workflowId).build());
    }

    private static WorkflowDefinition shoutDefinition() {
        return WorkflowDefinition.builder("shout")
                .step(new StepDefinition("input", "input", null, JsonNodeFactory.instance.objectNode().put("inputName", "topic")))
                .step(new StepDefinition("loud", "shout", null, JsonNodeFactory.instance.objectNode().put("text", "{{input}}")))
                .step("output", "output")
                .edge("input", "loud")
                .edge("loud", "output")
                .build();
    }

    @Test
    void run_executesStepsAsActivities_andSettlesCredits() {
        RunWorkflowRequest request = new RunWorkflowRequest(shoutDefinition(),
                JsonNodeFactory.instance.objectNode().put("topic", "weather"), "acct", 4, 0, 30, 0, 1L);

        RunResult result = stub("run-42").run(request);

        assertTrue(result.isSuccess(), result.toString());
        assertEquals("run-42", result.getRunId());
        assertEquals("WEATHER", result.getOutputs().get("output").asText());
        assertEquals(48L, ledger.getBalance("acct"));
        assertEquals(0, ledger.openHoldCount());
        assertTrue(events.stream().anyMatch(e -> e.getType() == ExecutionEventType.EXECUTION_COMPLETED));
    }

    @Test
    void run_withInsufficientCredits_isRejectedWithoutHold() {
        ledger.setBalance("acct", 1);
        RunWorkflowRequest request = new RunWorkflowRequest(shoutDefinition(),
                JsonNodeFactory.instance.objectNode().put("topic", "weather"), "acct", 4, 0, 30, 0, 1L);

        RunResult result = stub("run-poor").run(request);

        assertFalse(result.isSuccess());
        assertEquals(RunErrorCode.INSUFFICIENT_BUDGET.getCode(), result.getError());
        assertEquals(0, result.getDispatchedSteps());
        assertEquals(1L, ledger.getBalance("acct"));
        assertEquals(0, ledger.openHoldCount());
    }
}
