package com.flowmaestro.features;

import com.flowmaestro.annotations.FeaturePhase;
import com.flowmaestro.annotations.FlowFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Step features keyed by their {@link FlowFeature#name()}. Hooks for a step run in registration
 * order, so the worker registers INTERNAL features before COMMUNITY observers.
 */
public final class FeatureRegistry {

    private static final Logger log = LoggerFactory.getLogger(FeatureRegistry.class);
    private static final FeatureRegistry INSTANCE = new FeatureRegistry();

    private final Map<String, FeatureEntry> features = new LinkedHashMap<>();

    public static FeatureRegistry getInstance() {
        return INSTANCE;
    }

    public void registerInternal(Object feature) {
        register(feature, FeaturePrivilege.INTERNAL);
    }

    /** Observer-only registration: hook failures are logged by the runner and never fail a step. */
    public void registerCommunity(Object feature) {
        register(feature, FeaturePrivilege.COMMUNITY);
    }

    /**
     * @throws IllegalArgumentException if the class lacks {@code @FlowFeature}, its name is blank,
     *                                  or a feature with that name is already registered
     */
    public synchronized void register(Object feature, FeaturePrivilege privilege) {
        Objects.requireNonNull(feature, "feature");
        Objects.requireNonNull(privilege, "privilege");
        FlowFeature meta = feature.getClass().getAnnotation(FlowFeature.class);
        if (meta == null) {
            throw new IllegalArgumentException("Missing @FlowFeature on " + feature.getClass().getName());
        }
        if (meta.name().isBlank()) {
            throw new IllegalArgumentException("Blank @FlowFeature name on " + feature.getClass().getName());
        }
        if (features.containsKey(meta.name())) {
            throw new IllegalArgumentException("Duplicate step feature: " + meta.name());
        }
        features.put(meta.name(), new FeatureEntry(meta, privilege, feature));
        log.info("Step feature registered | name={} | phase={} | privilege={}", meta.name(), meta.phase(), privilege);
    }

    /** Features whose kinds include {@code stepKind}, in registration order. */
    public synchronized List<FeatureEntry> getFeaturesForStep(String stepKind) {
        List<FeatureEntry> applicable = new ArrayList<>();
        for (FeatureEntry entry : features.values()) {
            if (entry.appliesTo(stepKind)) applicable.add(entry);
        }
        return List.copyOf(applicable);
    }

    public synchronized List<FeatureEntry> getAll() {
        return List.copyOf(features.values());
    }

    /** A registered feature with the hook phases it takes part in. */
    public static final class FeatureEntry {
        private final String name;
        private final FeaturePhase phase;
        private final Set<String> stepKinds;
        private final List<String> kindPrefixes;
        private final FeaturePrivilege privilege;
        private final Object instance;

        FeatureEntry(FlowFeature meta, FeaturePrivilege privilege, Object instance) {
            this.name = meta.name();
            this.phase = meta.phase();
            Set<String> kinds = new HashSet<>();
            List<String> prefixes = new ArrayList<>();
            for (String kind : meta.applicableStepKinds()) {
                if (kind == null || kind.isBlank()) continue;
                String k = kind.trim().toLowerCase(Locale.ROOT);
                if (k.length() > 2 && k.endsWith(".*")) {
                    prefixes.add(k.substring(0, k.length() - 1));
                } else {
                    kinds.add(k);
                }
            }
            this.stepKinds = Set.copyOf(kinds);
            this.kindPrefixes = List.copyOf(prefixes);
            this.privilege = privilege;
            this.instance = instance;
        }

        public String getName() {
            return name;
        }

        public FeaturePhase getPhase() {
            return phase;
        }

        public FeaturePrivilege getPrivilege() {
            return privilege;
        }

        public Object getInstance() {
            return instance;
        }

        public boolean isCommunity() {
            return privilege == FeaturePrivilege.COMMUNITY;
        }

        public boolean isPre() {
            return phase == FeaturePhase.PRE || phase == FeaturePhase.PRE_FINALLY;
        }

        public boolean isPostSuccess() {
            return phase != FeaturePhase.PRE && phase != FeaturePhase.POST_ERROR;
        }

        public boolean isPostError() {
            return phase != FeaturePhase.PRE && phase != FeaturePhase.POST_SUCCESS;
        }

        /**
         * No declared kinds, or {@code "*"}, means every step; {@code "llm.*"} matches kinds under
         * {@code "llm."}. Matching ignores case.
         */
        boolean appliesTo(String stepKind) {
            if ((stepKinds.isEmpty() && kindPrefixes.isEmpty()) || stepKinds.contains("*")) return true;
            if (stepKind == null) return false;
            String k = stepKind.toLowerCase(Locale.ROOT);
            if (stepKinds.contains(k)) return true;
            for (String prefix : kindPrefixes) {
                if (k.startsWith(prefix)) return true;
            }
            return false;
        }
    }
}
