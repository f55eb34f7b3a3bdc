package com.flowmaestro.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the FlowMaestro Temporal worker.
 * <p>
 * Temporal: FM_TEMPORAL_TARGET, FM_TEMPORAL_NAMESPACE, FM_TASK_QUEUE.
 * Scheduling: FM_MAX_CONCURRENT_STEPS, FM_RUN_TIMEOUT_SECONDS, FM_STEP_TIMEOUT_SECONDS.
 * Context: FM_MAX_OUTPUT_BYTES. Credits: FM_DEFAULT_STEP_COST, FM_SUBJECT_CREDITS.
 * Events: FM_EVENTS_ENABLED, FM_CACHE_HOST, FM_CACHE_PORT, FM_EVENT_CHANNEL_PREFIX.
 */
public final class FlowConfig {

    private static final String ENV_TEMPORAL_TARGET = "FM_TEMPORAL_TARGET";
    private static final String ENV_TEMPORAL_NAMESPACE = "FM_TEMPORAL_NAMESPACE";
    private static final String ENV_TASK_QUEUE = "FM_TASK_QUEUE";
    private static final String ENV_MAX_CONCURRENT_STEPS = "FM_MAX_CONCURRENT_STEPS";
    private static final String ENV_RUN_TIMEOUT_SECONDS = "FM_RUN_TIMEOUT_SECONDS";
    private static final String ENV_STEP_TIMEOUT_SECONDS = "FM_STEP_TIMEOUT_SECONDS";
    private static final String ENV_MAX_OUTPUT_BYTES = "FM_MAX_OUTPUT_BYTES";
    private static final String ENV_DEFAULT_STEP_COST = "FM_DEFAULT_STEP_COST";
    private static final String ENV_SUBJECT_CREDITS = "FM_SUBJECT_CREDITS";
    private static final String ENV_EVENTS_ENABLED = "FM_EVENTS_ENABLED";
    private static final String ENV_CACHE_HOST = "FM_CACHE_HOST";
    private static final String ENV_CACHE_PORT = "FM_CACHE_PORT";
    private static final String ENV_EVENT_CHANNEL_PREFIX = "FM_EVENT_CHANNEL_PREFIX";

    public static final int DEFAULT_MAX_CONCURRENT_STEPS = 10;
    public static final int DEFAULT_MAX_OUTPUT_BYTES = 1024 * 1024;
    private static final String DEFAULT_TEMPORAL_TARGET = "localhost:7233";
    private static final String DEFAULT_TEMPORAL_NAMESPACE = "default";
    private static final String DEFAULT_TASK_QUEUE = "flowmaestro-workflows";
    /** 0 = no run-level timeout. */
    private static final int DEFAULT_RUN_TIMEOUT_SECONDS = 0;
    private static final int DEFAULT_STEP_TIMEOUT_SECONDS = 300;
    private static final long DEFAULT_STEP_COST = 1L;
    private static final String DEFAULT_CACHE_HOST = "localhost";
    private static final int DEFAULT_CACHE_PORT = 6379;
    private static final String DEFAULT_EVENT_CHANNEL_PREFIX = "workflow:events";

    private final String temporalTarget;
    private final String temporalNamespace;
    private final String taskQueue;
    private final int maxConcurrentSteps;
    private final int runTimeoutSeconds;
    private final int stepTimeoutSeconds;
    private final int maxOutputBytes;
    private final long defaultStepCost;
    private final Map<String, Long> subjectCredits;
    private final boolean eventsEnabled;
    private final String cacheHost;
    private final int cachePort;
    private final String eventChannelPrefix;

    private FlowConfig(Builder b) {
        this.temporalTarget = b.temporalTarget;
        this.temporalNamespace = b.temporalNamespace;
        this.taskQueue = b.taskQueue;
        this.maxConcurrentSteps = b.maxConcurrentSteps > 0 ? b.maxConcurrentSteps : DEFAULT_MAX_CONCURRENT_STEPS;
        this.runTimeoutSeconds = Math.max(0, b.runTimeoutSeconds);
        this.stepTimeoutSeconds = b.stepTimeoutSeconds > 0 ? b.stepTimeoutSeconds : DEFAULT_STEP_TIMEOUT_SECONDS;
        this.maxOutputBytes = b.maxOutputBytes > 0 ? b.maxOutputBytes : DEFAULT_MAX_OUTPUT_BYTES;
        this.defaultStepCost = Math.max(0L, b.defaultStepCost);
        this.subjectCredits = Collections.unmodifiableMap(new LinkedHashMap<>(b.subjectCredits));
        this.eventsEnabled = b.eventsEnabled;
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
        this.eventChannelPrefix = b.eventChannelPrefix;
    }

    public String getTemporalTarget() {
        return temporalTarget;
    }

    public String getTemporalNamespace() {
        return temporalNamespace;
    }

    public String getTaskQueue() {
        return taskQueue;
    }

    /** Default cap on concurrently executing steps when a workflow does not set its own. Default 10. */
    public int getMaxConcurrentSteps() {
        return maxConcurrentSteps;
    }

    /** Run-level timeout in seconds; 0 means the run is bounded only by explicit cancellation. */
    public int getRunTimeoutSeconds() {
        return runTimeoutSeconds;
    }

    /** Start-to-close timeout for a single step activity. Default 300. */
    public int getStepTimeoutSeconds() {
        return stepTimeoutSeconds;
    }

    /** Outputs larger than this (estimated bytes) are stored truncated. Default 1 MiB. */
    public int getMaxOutputBytes() {
        return maxOutputBytes;
    }

    /** Cost assumed for a step that declares no {@code estimatedCost} in its config. Default 1. */
    public long getDefaultStepCost() {
        return defaultStepCost;
    }

    /**
     * Opening balances for the worker's in-process ledger, from FM_SUBJECT_CREDITS
     * ({@code subject=amount,subject=amount}). Empty when unset.
     */
    public Map<String, Long> getSubjectCredits() {
        return subjectCredits;
    }

    /** Whether run/step events are published to Redis (FM_EVENTS_ENABLED). Default false: events are logged only. */
    public boolean isEventsEnabled() {
        return eventsEnabled;
    }

    public String getCacheHost() {
        return cacheHost;
    }

    public int getCachePort() {
        return cachePort;
    }

    /** Channel prefix for published events, e.g. {@code workflow:events} → {@code workflow:events:node:started}. */
    public String getEventChannelPrefix() {
        return eventChannelPrefix;
    }

    public static FlowConfig fromEnvironment() {
        return builder()
                .temporalTarget(getEnv(ENV_TEMPORAL_TARGET, DEFAULT_TEMPORAL_TARGET))
                .temporalNamespace(getEnv(ENV_TEMPORAL_NAMESPACE, DEFAULT_TEMPORAL_NAMESPACE))
                .taskQueue(getEnv(ENV_TASK_QUEUE, DEFAULT_TASK_QUEUE))
                .maxConcurrentSteps(parseInt(System.getenv(ENV_MAX_CONCURRENT_STEPS), DEFAULT_MAX_CONCURRENT_STEPS))
                .runTimeoutSeconds(parseInt(System.getenv(ENV_RUN_TIMEOUT_SECONDS), DEFAULT_RUN_TIMEOUT_SECONDS))
                .stepTimeoutSeconds(parseInt(System.getenv(ENV_STEP_TIMEOUT_SECONDS), DEFAULT_STEP_TIMEOUT_SECONDS))
                .maxOutputBytes(parseInt(System.getenv(ENV_MAX_OUTPUT_BYTES), DEFAULT_MAX_OUTPUT_BYTES))
                .defaultStepCost(parseLong(System.getenv(ENV_DEFAULT_STEP_COST), DEFAULT_STEP_COST))
                .subjectCredits(parseCredits(System.getenv(ENV_SUBJECT_CREDITS)))
                .eventsEnabled(parseBoolean(System.getenv(ENV_EVENTS_ENABLED), false))
                .cacheHost(getEnv(ENV_CACHE_HOST, DEFAULT_CACHE_HOST))
                .cachePort(parseInt(System.getenv(ENV_CACHE_PORT), DEFAULT_CACHE_PORT))
                .eventChannelPrefix(getEnv(ENV_EVENT_CHANNEL_PREFIX, DEFAULT_EVENT_CHANNEL_PREFIX))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /** Parses {@code a=100,b=20}; malformed entries are skipped. */
    static Map<String, Long> parseCredits(String value) {
        Map<String, Long> credits = new LinkedHashMap<>();
        if (value == null || value.isBlank()) {
            return credits;
        }
        for (String entry : value.split(",")) {
            int eq = entry.indexOf('=');
            if (eq <= 0) continue;
            String subject = entry.substring(0, eq).trim();
            long amount = parseLong(entry.substring(eq + 1), -1L);
            if (!subject.isEmpty() && amount >= 0) {
                credits.put(subject, amount);
            }
        }
        return credits;
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String temporalTarget = DEFAULT_TEMPORAL_TARGET;
        private String temporalNamespace = DEFAULT_TEMPORAL_NAMESPACE;
        private String taskQueue = DEFAULT_TASK_QUEUE;
        private int maxConcurrentSteps = DEFAULT_MAX_CONCURRENT_STEPS;
        private int runTimeoutSeconds = DEFAULT_RUN_TIMEOUT_SECONDS;
        private int stepTimeoutSeconds = DEFAULT_STEP_TIMEOUT_SECONDS;
        private int maxOutputBytes = DEFAULT_MAX_OUTPUT_BYTES;
        private long defaultStepCost = DEFAULT_STEP_COST;
        private Map<String, Long> subjectCredits = Map.of();
        private boolean eventsEnabled;
        private String cacheHost = DEFAULT_CACHE_HOST;
        private int cachePort = DEFAULT_CACHE_PORT;
        private String eventChannelPrefix = DEFAULT_EVENT_CHANNEL_PREFIX;

        public Builder temporalTarget(String temporalTarget) {
            this.temporalTarget = temporalTarget != null ? temporalTarget : DEFAULT_TEMPORAL_TARGET;
            return this;
        }

        public Builder temporalNamespace(String temporalNamespace) {
            this.temporalNamespace = temporalNamespace != null ? temporalNamespace : DEFAULT_TEMPORAL_NAMESPACE;
            return this;
        }

        public Builder taskQueue(String taskQueue) {
            this.taskQueue = Objects.requireNonNull(taskQueue, "taskQueue");
            return this;
        }

        public Builder maxConcurrentSteps(int maxConcurrentSteps) {
            this.maxConcurrentSteps = maxConcurrentSteps;
            return this;
        }

        public Builder runTimeoutSeconds(int runTimeoutSeconds) {
            this.runTimeoutSeconds = runTimeoutSeconds;
            return this;
        }

        public Builder stepTimeoutSeconds(int stepTimeoutSeconds) {
            this.stepTimeoutSeconds = stepTimeoutSeconds;
            return this;
        }

        public Builder maxOutputBytes(int maxOutputBytes) {
            this.maxOutputBytes = maxOutputBytes;
            return this;
        }

        public Builder defaultStepCost(long defaultStepCost) {
            this.defaultStepCost = defaultStepCost;
            return this;
        }

        public Builder subjectCredits(Map<String, Long> subjectCredits) {
            this.subjectCredits = subjectCredits != null ? subjectCredits : Map.of();
            return this;
        }

        public Builder eventsEnabled(boolean eventsEnabled) {
            this.eventsEnabled = eventsEnabled;
            return this;
        }

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = cacheHost != null ? cacheHost : DEFAULT_CACHE_HOST;
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public Builder eventChannelPrefix(String eventChannelPrefix) {
            this.eventChannelPrefix = eventChannelPrefix != null ? eventChannelPrefix : DEFAULT_EVENT_CHANNEL_PREFIX;
            return this;
        }

        public FlowConfig build() {
            return new FlowConfig(this);
        }
    }
}
