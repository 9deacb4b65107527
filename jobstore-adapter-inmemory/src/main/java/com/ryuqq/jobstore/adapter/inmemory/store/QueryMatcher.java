package com.ryuqq.jobstore.adapter.inmemory.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.jobstore.core.spi.DocumentQuery;

/**
 * Evaluates {@link DocumentQuery} conditions against a stored JSON document.
 *
 * <p>A condition on a missing field is false, except {@code IS_NULL} which is true.</p>
 */
final class QueryMatcher {

    private QueryMatcher() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static boolean matches(JsonNode document, DocumentQuery query, ObjectMapper objectMapper) {
        for (DocumentQuery.Condition condition : query.getConditions()) {
            if (!matches(document.get(condition.field()), condition, objectMapper)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matches(JsonNode actual, DocumentQuery.Condition condition, ObjectMapper objectMapper) {
        if (condition.operator() == DocumentQuery.Operator.IS_NULL) {
            return JsonValues.isAbsent(actual);
        }
        if (JsonValues.isAbsent(actual)) {
            return false;
        }
        JsonNode expected = objectMapper.valueToTree(condition.value());
        Integer comparison = JsonValues.compare(actual, expected);
        if (comparison == null) {
            return condition.operator() == DocumentQuery.Operator.NE;
        }
        return switch (condition.operator()) {
            case EQ -> comparison == 0;
            case NE -> comparison != 0;
            case LT -> comparison < 0;
            case LE -> comparison <= 0;
            case GT -> comparison > 0;
            case GE -> comparison >= 0;
            case IS_NULL -> false;
        };
    }
}
