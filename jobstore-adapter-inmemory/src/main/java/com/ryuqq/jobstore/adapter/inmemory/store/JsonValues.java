package com.ryuqq.jobstore.adapter.inmemory.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * Ordering of JSON scalar values the way the document store sorts and compares them.
 *
 * <p>Numbers compare numerically, booleans as false &lt; true, and text lexically except
 * that two ISO-8601 instants compare chronologically (their textual forms may differ in
 * fractional-second precision). Missing and null values sort first. Values of different
 * JSON types are not comparable.</p>
 */
final class JsonValues {

    private static final Pattern ISO_INSTANT = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?Z$");

    static final Comparator<JsonNode> SORT_ORDER = (a, b) -> {
        boolean aMissing = isAbsent(a);
        boolean bMissing = isAbsent(b);
        if (aMissing || bMissing) {
            return Boolean.compare(!aMissing, !bMissing);
        }
        Integer result = compare(a, b);
        if (result != null) {
            return result;
        }
        return a.getNodeType().compareTo(b.getNodeType());
    };

    private JsonValues() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    /**
     * Compares two present scalar values.
     *
     * @return comparison result, or null when the values are not comparable
     */
    static Integer compare(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        if (a.isBoolean() && b.isBoolean()) {
            return Boolean.compare(a.booleanValue(), b.booleanValue());
        }
        if (a.isTextual() && b.isTextual()) {
            String left = a.textValue();
            String right = b.textValue();
            if (isInstant(left) && isInstant(right)) {
                return Instant.parse(left).compareTo(Instant.parse(right));
            }
            return left.compareTo(right);
        }
        return null;
    }

    private static boolean isInstant(String text) {
        return ISO_INSTANT.matcher(text).matches();
    }
}
