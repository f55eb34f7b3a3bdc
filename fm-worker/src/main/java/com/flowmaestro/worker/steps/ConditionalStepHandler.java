package com.flowmaestro.worker.steps;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowmaestro.executioncontext.ContextSnapshot;
import com.flowmaestro.worker.dispatch.StepMeta;
import com.flowmaestro.worker.dispatch.StepOutcome;

import java.math.BigDecimal;

/**
 * {@code conditional}: compares {@code leftValue} with {@code rightValue} using {@code operator}
 * and takes handle {@code true} or {@code false}. Operators: {@code == != > < >= <= contains is_empty}.
 * Values that both read as numbers compare numerically, others as text.
 */
final class ConditionalStepHandler implements StepHandler {

    static final String KIND = "conditional";
    static final String TRUE_HANDLE = "true";
    static final String FALSE_HANDLE = "false";

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public StepOutcome handle(ObjectNode config, ContextSnapshot snapshot, StepMeta meta) {
        String operator = config.path("operator").asText("==").trim();
        JsonNode left = valueOf(config, "leftValue");
        JsonNode right = valueOf(config, "rightValue");
        boolean result = evaluate(operator, left, right);

        ObjectNode output = JsonNodeFactory.instance.objectNode();
        output.put("result", result);
        output.put("operator", operator);
        output.set("leftValue", left);
        output.set("rightValue", right);
        return StepOutcome.success(output).selecting(result ? TRUE_HANDLE : FALSE_HANDLE);
    }

    static boolean evaluate(String operator, JsonNode left, JsonNode right) {
        return switch (operator) {
            case "==" -> compare(left, right) == 0;
            case "!=" -> compare(left, right) != 0;
            case ">" -> compare(left, right) > 0;
            case "<" -> compare(left, right) < 0;
            case ">=" -> compare(left, right) >= 0;
            case "<=" -> compare(left, right) <= 0;
            case "contains" -> contains(left, right);
            case "is_empty" -> isEmpty(left);
            default -> throw new IllegalArgumentException("Unsupported conditional operator: " + operator);
        };
    }

    private static JsonNode valueOf(ObjectNode config, String field) {
        JsonNode node = config.get(field);
        return node != null ? node.deepCopy() : NullNode.getInstance();
    }

    private static int compare(JsonNode left, JsonNode right) {
        BigDecimal l = number(left);
        BigDecimal r = number(right);
        if (l != null && r != null) {
            return l.compareTo(r);
        }
        return text(left).compareTo(text(right));
    }

    private static boolean contains(JsonNode left, JsonNode right) {
        if (left.isArray()) {
            for (JsonNode item : left) {
                if (item.equals(right) || text(item).equals(text(right))) return true;
            }
            return false;
        }
        return text(left).contains(text(right));
    }

    private static boolean isEmpty(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return true;
        if (node.isTextual()) return node.asText().isEmpty();
        if (node.isContainerNode()) return node.size() == 0;
        return false;
    }

    private static BigDecimal number(JsonNode node) {
        if (node.isNumber()) return node.decimalValue();
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return "";
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
