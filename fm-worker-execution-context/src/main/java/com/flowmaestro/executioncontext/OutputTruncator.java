package com.flowmaestro.executioncontext;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Replaces oversized step outputs by a small marker object with a preview.
 * Size is estimated as two bytes per character of the JSON text.
 */
public final class OutputTruncator {

    public static final String TRUNCATED_KEY = "__truncated";
    public static final String ORIGINAL_SIZE_KEY = "__originalSize";
    public static final String PREVIEW_KEY = "__preview";
    static final int PREVIEW_CHARS = 1000;

    private OutputTruncator() {
    }

    public static long estimateSize(JsonNode value) {
        return value == null ? 0L : value.toString().length() * 2L;
    }

    /** Returns {@code value} unchanged when within {@code maxBytes}, else the truncation marker. */
    public static JsonNode truncateIfNeeded(JsonNode value, int maxBytes) {
        if (value == null) return null;
        String text = value.toString();
        long size = text.length() * 2L;
        if (size <= maxBytes) {
            return value;
        }
        ObjectNode marker = JsonNodeFactory.instance.objectNode();
        marker.put(TRUNCATED_KEY, true);
        marker.put(ORIGINAL_SIZE_KEY, size);
        marker.put(PREVIEW_KEY, text.substring(0, Math.min(PREVIEW_CHARS, text.length())));
        return marker;
    }

    public static boolean isTruncated(JsonNode node) {
        return node != null && node.isObject() && node.path(TRUNCATED_KEY).asBoolean(false);
    }
}
