package com.flowmaestro.executioncontext;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionContextTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static ObjectNode json(String text) throws Exception {
        return (ObjectNode) MAPPER.readTree(text);
    }

    @Test
    void recordOutput_returnsNewContext_andLeavesOriginalUntouched() throws Exception {
        ExecutionContext empty = ExecutionContext.create(json("{\"topic\":\"cats\"}"));
        ExecutionContext next = empty.recordOutput("llm", json("{\"content\":\"hi\"}"));

        assertFalse(empty.hasOutput("llm"));
        assertTrue(next.hasOutput("llm"));
        assertEquals("hi", next.getOutput("llm").orElseThrow().get("content").asText());
    }

    @Test
    void snapshot_isFrozenAtCaptureTime() throws Exception {
        ExecutionContext ctx = ExecutionContext.create(null).recordOutput("a", json("{\"v\":1}"));
        ContextSnapshot snapshot = ctx.snapshot();

        ExecutionContext later = ctx.recordOutput("b", json("{\"v\":2}"));

        assertFalse(snapshot.hasOutput("b"));
        assertTrue(later.snapshot().hasOutput("b"));
    }

    @Test
    void snapshot_accessorsReturnCopies() throws Exception {
        ObjectNode value = json("{\"v\":1}");
        ExecutionContext ctx = ExecutionContext.create(null).recordOutput("a", value);
        value.put("v", 99);

        ObjectNode leaked = (ObjectNode) ctx.snapshot().getOutput("a").orElseThrow();
        leaked.put("v", 42);

        assertEquals(1, ctx.getOutput("a").orElseThrow().get("v").asInt());
    }

    @Test
    void recordOutput_twiceForSameStep_isRejected() throws Exception {
        ExecutionContext ctx = ExecutionContext.create(null).recordOutput("a", json("{}"));
        assertThrows(IllegalStateException.class, () -> ctx.recordOutput("a", json("{}")));
    }

    @Test
    void aggregateOutputs_includesOnlyRecordedTerminals() throws Exception {
        ExecutionContext ctx = ExecutionContext.create(null)
                .recordOutput("output", json("{\"content\":\"hi\"}"))
                .recordOutput("other", json("{\"x\":1}"));

        ObjectNode result = ctx.aggregateOutputs(List.of("output", "neverRan"));

        assertEquals(json("{\"output\":{\"content\":\"hi\"}}"), result);
    }

    @Test
    void recordOutput_oversized_isTruncatedWithPreview() throws Exception {
        ExecutionContext ctx = ExecutionContext.create(null, 100);
        ObjectNode big = json("{}");
        big.put("text", "x".repeat(2000));

        JsonNode stored = ctx.recordOutput("big", big).getOutput("big").orElseThrow();

        assertTrue(OutputTruncator.isTruncated(stored));
        assertEquals(1000, stored.get(OutputTruncator.PREVIEW_KEY).asText().length());
        assertEquals(OutputTruncator.estimateSize(big), stored.get(OutputTruncator.ORIGINAL_SIZE_KEY).asLong());
    }

    @Test
    void errorOutput_hasErrorFlagAndMessage() {
        ObjectNode error = ExecutionContext.errorOutput("boom");

        assertTrue(ExecutionContext.isErrorOutput(error));
        assertEquals("boom", error.get("message").asText());
    }

    @Test
    void withVariable_shadowsOutputsInTemplates() throws Exception {
        ExecutionContext ctx = ExecutionContext.create(json("{\"name\":\"input\"}"))
                .recordOutput("name", MAPPER.readTree("\"output\""))
                .withVariable("name", MAPPER.readTree("\"variable\""));

        assertEquals("hello variable", ctx.resolveTemplate("hello {{name}}"));
    }
}
