package com.flowmaestro.worker.steps;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowmaestro.executioncontext.ContextSnapshot;
import com.flowmaestro.executioncontext.TemplateResolver;
import com.flowmaestro.worker.dispatch.StepExecutor;
import com.flowmaestro.worker.dispatch.StepMeta;
import com.flowmaestro.worker.dispatch.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Step executor that dispatches by kind to registered {@link StepHandler}s. Resolves
 * {@code {{...}}} placeholders in the config before calling the handler. An unregistered kind
 * fails the step.
 */
public final class StepHandlerRegistry implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepHandlerRegistry.class);

    private final Map<String, StepHandler> handlers = new ConcurrentHashMap<>();

    /** Registry with the input, output, conditional and router kinds. */
    public static StepHandlerRegistry withBuiltIns() {
        return new StepHandlerRegistry()
                .register(new InputStepHandler())
                .register(new OutputStepHandler())
                .register(new ConditionalStepHandler())
                .register(new RouterStepHandler());
    }

    public StepHandlerRegistry register(StepHandler handler) {
        Objects.requireNonNull(handler, "handler");
        StepHandler existing = handlers.putIfAbsent(handler.kind(), handler);
        if (existing != null) {
            throw new IllegalArgumentException("Step kind already registered: " + handler.kind());
        }
        log.info("Registered step handler | kind={} | class={}", handler.kind(), handler.getClass().getSimpleName());
        return this;
    }

    public Optional<StepHandler> get(String kind) {
        return Optional.ofNullable(kind != null ? handlers.get(kind) : null);
    }

    public Set<String> kinds() {
        return new TreeSet<>(handlers.keySet());
    }

    @Override
    public StepOutcome execute(String kind, ObjectNode config, ContextSnapshot snapshot, StepMeta meta) throws Exception {
        StepHandler handler = kind != null ? handlers.get(kind) : null;
        if (handler == null) {
            throw new IllegalArgumentException("No handler registered for step kind: " + kind);
        }
        JsonNode resolved = TemplateResolver.resolveConfig(snapshot, config);
        ObjectNode resolvedConfig = resolved instanceof ObjectNode o ? o : JsonNodeFactory.instance.objectNode();
        return handler.handle(resolvedConfig, snapshot, meta);
    }
}
