package com.docgate.storage.query;

import com.docgate.model.error.InvalidRequestException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Iterator;
import java.util.Map;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates Mango-style selectors against JSON documents.
 * <p>
 * Supported: field conditions on dotted paths, implicit equality, nested sub-selectors,
 * {@code $eq $ne $gt $gte $lt $lte $in $nin $exists $elemMatch $all $size $regex} and the
 * combinators {@code $and $or $nor $not}. A missing field fails every operator except
 * {@code $exists}. Numbers compare by value, strings lexicographically; values of different
 * types never compare.
 */
public final class SelectorMatcher {

    private SelectorMatcher() {
        // utility class
    }

    /**
     * Returns true when {@code document} satisfies {@code selector}. An empty selector matches
     * everything.
     *
     * @throws InvalidRequestException for unknown operators or malformed operands
     */
    public static boolean matches(JsonNode document, JsonNode selector) {
        if (selector == null || selector.isNull() || selector.isMissingNode()) {
            return true;
        }
        if (!selector.isObject()) {
            throw new InvalidRequestException("selector must be a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = selector.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = entry.getKey();
            boolean ok = key.startsWith("$")
                    ? combinator(document, key, entry.getValue())
                    : condition(resolve(document, key), entry.getValue());
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    /** Resolves a dotted field path; absent segments yield a missing node. */
    static JsonNode resolve(JsonNode document, String path) {
        JsonNode current = document;
        for (String part : path.split("\\.")) {
            if (current == null || !current.isObject()) {
                return MissingNode.getInstance();
            }
            current = current.get(part);
        }
        return current == null ? MissingNode.getInstance() : current;
    }

    private static boolean combinator(JsonNode document, String operator, JsonNode operand) {
        switch (operator) {
            case "$and" -> {
                for (JsonNode sub : requireArray(operator, operand)) {
                    if (!matches(document, sub)) {
                        return false;
                    }
                }
                return true;
            }
            case "$or" -> {
                for (JsonNode sub : requireArray(operator, operand)) {
                    if (matches(document, sub)) {
                        return true;
                    }
                }
                return false;
            }
            case "$nor" -> {
                for (JsonNode sub : requireArray(operator, operand)) {
                    if (matches(document, sub)) {
                        return false;
                    }
                }
                return true;
            }
            case "$not" -> {
                return !matches(document, operand);
            }
            default -> throw new InvalidRequestException("Unknown combination operator: " + operator);
        }
    }

    private static boolean condition(JsonNode value, JsonNode condition) {
        if (!condition.isObject()) {
            return !value.isMissingNode() && valuesEqual(value, condition);
        }
        if (!isOperatorObject(condition)) {
            return !value.isMissingNode() && matches(value, condition);
        }
        Iterator<Map.Entry<String, JsonNode>> operators = condition.fields();
        while (operators.hasNext()) {
            Map.Entry<String, JsonNode> op = operators.next();
            if (!operator(value, op.getKey(), op.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean operator(JsonNode value, String operator, JsonNode operand) {
        if ("$exists".equals(operator)) {
            if (!operand.isBoolean()) {
                throw new InvalidRequestException("$exists expects a boolean");
            }
            return operand.booleanValue() != value.isMissingNode();
        }
        if (value.isMissingNode()) {
            return false;
        }
        return switch (operator) {
            case "$eq" -> valuesEqual(value, operand);
            case "$ne" -> !valuesEqual(value, operand);
            case "$gt" -> ordered(value, operand, c -> c > 0);
            case "$gte" -> ordered(value, operand, c -> c >= 0);
            case "$lt" -> ordered(value, operand, c -> c < 0);
            case "$lte" -> ordered(value, operand, c -> c <= 0);
            case "$in" -> contains(requireArray(operator, operand), value);
            case "$nin" -> !contains(requireArray(operator, operand), value);
            case "$all" -> value.isArray() && containsAll(value, requireArray(operator, operand));
            case "$size" -> value.isArray() && operand.canConvertToInt() && value.size() == operand.intValue();
            case "$elemMatch" -> elemMatch(value, operand);
            case "$regex" -> value.isTextual() && regex(operand).matcher(value.textValue()).find();
            case "$not" -> !condition(value, operand);
            default -> throw new InvalidRequestException("Unknown operator: " + operator);
        };
    }

    private static boolean ordered(JsonNode a, JsonNode b, IntPredicate test) {
        if (a.isNumber() && b.isNumber()) {
            return test.test(a.decimalValue().compareTo(b.decimalValue()));
        }
        if (a.isTextual() && b.isTextual()) {
            return test.test(a.textValue().compareTo(b.textValue()));
        }
        return false;
    }

    private static boolean valuesEqual(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        return a.equals(b);
    }

    private static boolean contains(JsonNode array, JsonNode value) {
        for (JsonNode candidate : array) {
            if (valuesEqual(candidate, value)) {
                return true;
            }
        }
        // an array field matches $in when any of its elements does
        if (value.isArray()) {
            for (JsonNode element : value) {
                if (contains(array, element)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean containsAll(JsonNode array, JsonNode required) {
        for (JsonNode needed : required) {
            boolean found = false;
            for (JsonNode element : array) {
                if (valuesEqual(element, needed)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    private static boolean elemMatch(JsonNode value, JsonNode sub) {
        if (!value.isArray()) {
            return false;
        }
        for (JsonNode element : value) {
            boolean ok = isOperatorObject(sub) ? condition(element, sub) : matches(element, sub);
            if (ok) {
                return true;
            }
        }
        return false;
    }

    private static boolean isOperatorObject(JsonNode node) {
        Iterator<String> names = node.fieldNames();
        return names.hasNext() && names.next().startsWith("$");
    }

    private static JsonNode requireArray(String operator, JsonNode operand) {
        if (!operand.isArray()) {
            throw new InvalidRequestException(operator + " expects an array");
        }
        return operand;
    }

    private static Pattern regex(JsonNode operand) {
        if (!operand.isTextual()) {
            throw new InvalidRequestException("$regex expects a string");
        }
        try {
            return Pattern.compile(operand.textValue());
        } catch (PatternSyntaxException e) {
            throw new InvalidRequestException("Invalid $regex: " + e.getDescription());
        }
    }
}
