package com.flowmaestro.executioncontext;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemplateResolverTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ContextSnapshot snapshot;

    @BeforeEach
    void setUp() throws Exception {
        ObjectNode inputs = (ObjectNode) MAPPER.readTree("""
                { "userQuery": "weather in Paris", "limit": 3 }
                """);
        snapshot = ExecutionContext.create(inputs)
                .recordOutput("llm", MAPPER.readTree("""
                        { "content": "Sunny", "usage": { "tokens": 12 } }
                        """))
                .recordOutput("search", MAPPER.readTree("""
                        { "items": [ { "title": "First" }, { "title": "Second" } ] }
                        """))
                .snapshot();
    }

    @Test
    void resolve_stepOutputPaths() {
        assertEquals("Answer: Sunny (12 tokens)",
                TemplateResolver.resolve(snapshot, "Answer: {{llm.content}} ({{ llm.usage.tokens }} tokens)"));
    }

    @Test
    void resolve_arrayIndices() {
        assertEquals("Second", TemplateResolver.resolve(snapshot, "{{search.items[1].title}}"));
        assertEquals("First", TemplateResolver.resolve(snapshot, "{{search.items.0.title}}"));
    }

    @Test
    void resolve_inputsAndObjectsAsJson() {
        assertEquals("q=weather in Paris", TemplateResolver.resolve(snapshot, "q={{userQuery}}"));
        assertEquals("{\"tokens\":12}", TemplateResolver.resolve(snapshot, "{{llm.usage}}"));
    }

    @Test
    void resolve_missingReference_yieldsUnresolvedMarker() {
        assertEquals("x=<unresolved:ghost.value>", TemplateResolver.resolve(snapshot, "x={{ghost.value}}"));
        assertEquals("<unresolved:search.items[9].title>", TemplateResolver.resolve(snapshot, "{{search.items[9].title}}"));
    }

    @Test
    void resolve_indexBeyondIntRange_yieldsUnresolvedMarker() {
        assertEquals("x <unresolved:search.items[99999999999]>",
                TemplateResolver.resolve(snapshot, "x {{search.items[99999999999]}}"));
        assertEquals("<unresolved:search.items.99999999999.title>",
                TemplateResolver.resolve(snapshot, "{{search.items.99999999999.title}}"));
    }

    @Test
    void resolveConfig_missingWholePlaceholder_yieldsMarkerText() throws Exception {
        JsonNode config = MAPPER.readTree("""
                { "usage": "{{llm.usage}}", "missing": "{{ghost}}" }
                """);
        JsonNode resolved = TemplateResolver.resolveConfig(snapshot, config);
        assertEquals(12, resolved.get("usage").get("tokens").asInt());
        assertEquals("<unresolved:ghost>", resolved.get("missing").asText());
    }

    @Test
    void resolve_withoutPlaceholders_returnsSameString() {
        assertEquals("plain", TemplateResolver.resolve(snapshot, "plain"));
    }

    @Test
    void resolveConfig_wholePlaceholderKeepsJsonType() throws Exception {
        JsonNode config = MAPPER.readTree("""
                { "count": "{{limit}}", "prompt": "Say {{llm.content}}", "list": ["{{llm.usage}}", 5] }
                """);

        JsonNode resolved = TemplateResolver.resolveConfig(snapshot, config);

        assertTrue(resolved.get("count").isInt());
        assertEquals("Say Sunny", resolved.get("prompt").asText());
        assertEquals(12, resolved.get("list").get(0).get("tokens").asInt());
        assertEquals("{{limit}}", config.get("count").asText());
    }

    @Test
    void extractReferences_inOrder() {
        assertEquals(Set.of("a.b", "c"), TemplateResolver.extractReferences("{{a.b}} and {{ c }} and {{a.b}}"));
        assertEquals(List.of("a.b", "c"), List.copyOf(TemplateResolver.extractReferences("{{a.b}} {{c}}")));
    }

    @Test
    void parsePath_mixesNamesAndIndices() {
        assertEquals(List.of("items", 0, "name"), TemplateResolver.parsePath("items[0].name"));
    }
}
