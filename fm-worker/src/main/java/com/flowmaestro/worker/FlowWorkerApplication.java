package com.flowmaestro.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowmaestro.annotations.ResourceCleanup;
import com.flowmaestro.config.FlowConfig;
import com.flowmaestro.config.RedisChannelWriter;
import com.flowmaestro.features.FeatureRegistry;
import com.flowmaestro.features.StepFeatureRunner;
import com.flowmaestro.features.metrics.MetricsFeature;
import com.flowmaestro.graph.WorkflowDefinitions;
import com.flowmaestro.graph.definition.WorkflowDefinition;
import com.flowmaestro.ledger.InMemoryCreditLedger;
import com.flowmaestro.worker.activity.FlowActivitiesImpl;
import com.flowmaestro.worker.dispatch.ExecutorBatchDispatcher;
import com.flowmaestro.worker.dispatch.StepInvoker;
import com.flowmaestro.worker.run.RunResult;
import com.flowmaestro.worker.run.WorkflowRunner;
import com.flowmaestro.worker.steps.StepHandlerRegistry;
import com.flowmaestro.worker.telemetry.EventPublisher;
import com.flowmaestro.worker.telemetry.LifecycleGlue;
import com.flowmaestro.worker.telemetry.LoggingEventPublisher;
import com.flowmaestro.worker.telemetry.MicrometerTelemetrySink;
import com.flowmaestro.worker.telemetry.RedisEventPublisher;
import com.flowmaestro.worker.workflow.FlowWorkflowImpl;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import io.temporal.worker.WorkerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * FlowMaestro worker entry point.
 * <p>
 * Without arguments it connects to Temporal and serves {@code FlowWorkflow} on FM_TASK_QUEUE.
 * WorkerFactory.start() returns immediately; the main thread is blocked so the JVM stays alive.
 * <p>
 * {@code run <definition.json> <subject> [inputs.json]} executes one definition in-process
 * against the ledger seeded from FM_SUBJECT_CREDITS and prints the run result as JSON.
 */
public final class FlowWorkerApplication {

    private static final Logger log = LoggerFactory.getLogger(FlowWorkerApplication.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FlowWorkerApplication() {
    }

    public static void main(String[] args) throws IOException {
        FlowConfig config = FlowConfig.fromEnvironment();
        MetricsFeature metrics = new MetricsFeature();
        FeatureRegistry.getInstance().registerInternal(metrics);

        StepInvoker invoker = new StepInvoker(StepHandlerRegistry.withBuiltIns(),
                new StepFeatureRunner(FeatureRegistry.getInstance()));
        InMemoryCreditLedger ledger = new InMemoryCreditLedger();
        config.getSubjectCredits().forEach(ledger::setBalance);
        EventPublisher events = createEventPublisher(config);

        List<ResourceCleanup> cleanups = new ArrayList<>();
        if (events instanceof ResourceCleanup) {
            cleanups.add((ResourceCleanup) events);
        }

        if (args.length > 0 && "run".equals(args[0])) {
            if (args.length < 3) {
                System.err.println("usage: run <definition.json> <subject> [inputs.json]");
                System.exit(2);
            }
            RunResult result = runLocal(config, invoker, ledger, events, metrics, cleanups, args);
            System.out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            invokeResourceCleanup(cleanups);
            System.exit(result.isSuccess() ? 0 : 1);
            return;
        }
        startWorker(config, new FlowActivitiesImpl(invoker, ledger, events), cleanups);
    }

    static RunResult runLocal(FlowConfig config, StepInvoker invoker, InMemoryCreditLedger ledger, EventPublisher events,
                              MetricsFeature metrics, List<ResourceCleanup> cleanups, String[] args) throws IOException {
        WorkflowDefinition definition = WorkflowDefinitions.fromJson(Files.readString(Path.of(args[1])));
        String subject = args[2];
        ObjectNode inputs = args.length > 3
                ? (ObjectNode) MAPPER.readTree(Files.readString(Path.of(args[3])))
                : MAPPER.createObjectNode();

        ExecutorBatchDispatcher dispatcher = new ExecutorBatchDispatcher(invoker, config.getMaxConcurrentSteps(),
                config.getStepTimeoutSeconds() * 1000L);
        cleanups.add(dispatcher);
        WorkflowRunner runner = WorkflowRunner.builder(config)
                .dispatcher(dispatcher)
                .creditLedger(ledger)
                .glue(new LifecycleGlue(new MicrometerTelemetrySink(metrics.getRegistry()), events, System::currentTimeMillis))
                .build();
        log.info("Local run | workflow={} | subject={} | available={}",
                definition.getName(), subject, ledger.getAvailable(subject));
        return runner.runDefinition(definition, inputs, subject);
    }

    private static EventPublisher createEventPublisher(FlowConfig config) {
        if (!config.isEventsEnabled()) {
            return new LoggingEventPublisher();
        }
        try {
            return new RedisEventPublisher(new RedisChannelWriter(config), config.getEventChannelPrefix());
        } catch (RuntimeException e) {
            log.warn("Event publishing falls back to log: could not connect to {}:{} ({})",
                    config.getCacheHost(), config.getCachePort(), e.getMessage());
            return new LoggingEventPublisher();
        }
    }

    private static void startWorker(FlowConfig config, FlowActivitiesImpl activities, List<ResourceCleanup> cleanups) {
        WorkflowServiceStubs service = WorkflowServiceStubs.newServiceStubs(
                WorkflowServiceStubsOptions.newBuilder()
                        .setTarget(config.getTemporalTarget())
                        .build()
        );
        WorkflowClient client = WorkflowClient.newInstance(
                service,
                WorkflowClientOptions.newBuilder()
                        .setNamespace(config.getTemporalNamespace())
                        .build()
        );
        WorkerFactory factory = WorkerFactory.newInstance(client);

        WorkerOptions workerOptions = WorkerOptions.newBuilder()
                .setMaxConcurrentActivityExecutionSize(config.getMaxConcurrentSteps())
                .setMaxConcurrentWorkflowTaskExecutionSize(10)
                .build();

        Worker worker = factory.newWorker(config.getTaskQueue(), workerOptions);
        worker.registerWorkflowImplementationTypes(FlowWorkflowImpl.class);
        worker.registerActivitiesImplementations(activities);

        log.info("Starting worker | Temporal: {} | namespace: {} | taskQueue: {} | events: {}",
                config.getTemporalTarget(), config.getTemporalNamespace(), config.getTaskQueue(),
                config.isEventsEnabled() ? config.getCacheHost() + ":" + config.getCachePort() : "log");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down worker...");
            invokeResourceCleanup(cleanups);
            factory.shutdown();
            try {
                factory.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (Exception e) {
                log.error("Error during worker shutdown: {}", e.getMessage());
            }
        }));

        factory.start();

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down worker...");
            invokeResourceCleanup(cleanups);
            factory.shutdown();
        }
    }

    /**
     * Invokes {@link ResourceCleanup#onExit()} on worker-owned components and on every registered
     * feature that implements it.
     */
    private static void invokeResourceCleanup(List<ResourceCleanup> cleanups) {
        for (ResourceCleanup c : cleanups) {
            try {
                c.onExit();
            } catch (Exception ex) {
                log.warn("Component {} onExit failed: {}", c.getClass().getSimpleName(), ex.getMessage());
            }
        }
        for (FeatureRegistry.FeatureEntry e : FeatureRegistry.getInstance().getAll()) {
            Object inst = e.getInstance();
            if (inst instanceof ResourceCleanup) {
                try {
                    ((ResourceCleanup) inst).onExit();
                } catch (Exception ex) {
                    log.warn("Feature {} onExit failed: {}", e.getName(), ex.getMessage());
                }
            }
        }
    }
}
