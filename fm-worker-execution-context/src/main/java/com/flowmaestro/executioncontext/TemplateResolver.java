package com.flowmaestro.executioncontext;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure placeholder interpolation over a {@link ContextSnapshot}.
 * <p>
 * Placeholders look like {@code {{root.path[0].field}}}. The root name is looked up in workflow
 * variables, then step outputs, then run inputs. A reference that cannot be resolved is replaced by
 * {@code <unresolved:PATH>} instead of failing, so partially executed graphs still produce
 * diagnosable text.
 */
public final class TemplateResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([^}]+)\\}\\}");
    private static final Pattern WHOLE_PLACEHOLDER = Pattern.compile("^\\s*\\{\\{([^}]+)\\}\\}\\s*$");
    private static final Pattern PATH_TOKEN = Pattern.compile("([^.\\[\\]]+)|\\[(\\d+)\\]");

    private TemplateResolver() {
    }

    public static String unresolvedMarker(String path) {
        return "<unresolved:" + path + ">";
    }

    /** Interpolates every placeholder in the template. Objects and arrays render as JSON text. */
    public static String resolve(ContextSnapshot snapshot, String template) {
        if (template == null || template.indexOf("{{") < 0) {
            return template;
        }
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String path = m.group(1).trim();
            String replacement = lookup(snapshot, path).map(TemplateResolver::render).orElse(unresolvedMarker(path));
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Resolves placeholders in every string of a config tree. A string that is exactly one
     * placeholder is replaced by the referenced JSON value itself (not its text form).
     * The input node is not modified.
     */
    public static JsonNode resolveConfig(ContextSnapshot snapshot, JsonNode config) {
        if (config == null) return null;
        if (config.isTextual()) {
            String text = config.asText();
            Matcher whole = WHOLE_PLACEHOLDER.matcher(text);
            if (whole.matches()) {
                String path = whole.group(1).trim();
                return lookup(snapshot, path)
                        .map(n -> (JsonNode) n.deepCopy())
                        .orElse(JsonNodeFactory.instance.textNode(unresolvedMarker(path)));
            }
            return JsonNodeFactory.instance.textNode(resolve(snapshot, text));
        }
        if (config.isObject()) {
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = config.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                out.set(e.getKey(), resolveConfig(snapshot, e.getValue()));
            }
            return out;
        }
        if (config.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            for (JsonNode item : config) {
                out.add(resolveConfig(snapshot, item));
            }
            return out;
        }
        return config.deepCopy();
    }

    /** Referenced paths in order of first appearance (e.g. {@code llm.content}). */
    public static Set<String> extractReferences(String template) {
        Set<String> refs = new LinkedHashSet<>();
        if (template == null) return refs;
        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            refs.add(m.group(1).trim());
        }
        return refs;
    }

    /** Resolves a dotted path with optional array indices; empty when any segment is missing. */
    public static Optional<JsonNode> lookup(ContextSnapshot snapshot, String path) {
        List<Object> tokens = parsePath(path);
        if (tokens.isEmpty() || !(tokens.get(0) instanceof String)) {
            return Optional.empty();
        }
        JsonNode current = snapshot.lookupRoot((String) tokens.get(0));
        for (int i = 1; i < tokens.size() && current != null; i++) {
            Object token = tokens.get(i);
            if (token instanceof Integer) {
                int index = (Integer) token;
                current = current.isArray() && index >= 0 ? current.get(index) : null;
            } else {
                String key = (String) token;
                if (current.isObject()) {
                    current = current.get(key);
                } else if (current.isArray() && key.chars().allMatch(Character::isDigit)) {
                    int index = parseIndex(key);
                    current = index >= 0 ? current.get(index) : null;
                } else {
                    current = null;
                }
            }
        }
        if (current == null || current.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    static List<Object> parsePath(String path) {
        List<Object> tokens = new ArrayList<>();
        if (path == null) return tokens;
        Matcher m = PATH_TOKEN.matcher(path.trim());
        while (m.find()) {
            if (m.group(1) != null) {
                String name = m.group(1).trim();
                if (!name.isEmpty()) tokens.add(name);
            } else {
                tokens.add(parseIndex(m.group(2)));
            }
        }
        return tokens;
    }

    /** Digits to an array index; -1 when it does not fit an int, which no array can hold. */
    private static int parseIndex(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String render(JsonNode node) {
        if (node.isTextual()) return node.asText();
        if (node.isValueNode()) return node.asText();
        return node.toString();
    }
}
