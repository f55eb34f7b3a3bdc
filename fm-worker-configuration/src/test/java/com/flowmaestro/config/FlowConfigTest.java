package com.flowmaestro.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowConfigTest {

    @Test
    void builder_defaults() {
        FlowConfig config = FlowConfig.builder().build();

        assertEquals("localhost:7233", config.getTemporalTarget());
        assertEquals("default", config.getTemporalNamespace());
        assertEquals("flowmaestro-workflows", config.getTaskQueue());
        assertEquals(10, config.getMaxConcurrentSteps());
        assertEquals(0, config.getRunTimeoutSeconds());
        assertEquals(1024 * 1024, config.getMaxOutputBytes());
        assertEquals(1L, config.getDefaultStepCost());
        assertFalse(config.isEventsEnabled());
        assertEquals("workflow:events", config.getEventChannelPrefix());
    }

    @Test
    void builder_nonPositiveValuesFallBackToDefaults() {
        FlowConfig config = FlowConfig.builder()
                .maxConcurrentSteps(0)
                .runTimeoutSeconds(-5)
                .stepTimeoutSeconds(0)
                .maxOutputBytes(-1)
                .defaultStepCost(-3)
                .build();

        assertEquals(FlowConfig.DEFAULT_MAX_CONCURRENT_STEPS, config.getMaxConcurrentSteps());
        assertEquals(0, config.getRunTimeoutSeconds());
        assertEquals(300, config.getStepTimeoutSeconds());
        assertEquals(FlowConfig.DEFAULT_MAX_OUTPUT_BYTES, config.getMaxOutputBytes());
        assertEquals(0L, config.getDefaultStepCost());
    }

    @Test
    void parseHelpers_tolerateBadInput() {
        assertEquals(7, FlowConfig.parseInt(" 7 ", 1));
        assertEquals(1, FlowConfig.parseInt("seven", 1));
        assertEquals(1L, FlowConfig.parseLong(null, 1L));
        assertTrue(FlowConfig.parseBoolean("1", false));
        assertTrue(FlowConfig.parseBoolean("TRUE", false));
        assertFalse(FlowConfig.parseBoolean("no", true));
        assertTrue(FlowConfig.parseBoolean("", true));
    }

    @Test
    void parseCredits_keepsWellFormedEntries() {
        Map<String, Long> credits = FlowConfig.parseCredits("acme=100, beta = 20,broken,=5,neg=-1,bad=x");

        assertEquals(Map.of("acme", 100L, "beta", 20L), credits);
        assertTrue(FlowConfig.parseCredits(null).isEmpty());
        assertTrue(FlowConfig.builder().build().getSubjectCredits().isEmpty());
    }
}
