package com.ryuqq.jobstore.core.spi;

import com.ryuqq.jobstore.core.document.DocumentKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Store-neutral query: a conjunction of field conditions, an optional single-field sort and
 * an optional offset/limit window.
 *
 * <p>{@link #toString()} renders the query as document-store SQL for logging.</p>
 *
 * <pre>{@code
 * DocumentQuery query = DocumentQuery.forKind(DocumentKind.JOB)
 *     .whereEquals("state", "enqueued")
 *     .orderBy("createdAt")
 *     .build();
 * }</pre>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class DocumentQuery {

    /**
     * Comparison operators.
     */
    public enum Operator {
        EQ("="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        IS_NULL("IS NULL");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    /**
     * A single field condition. {@code value} is ignored for {@link Operator#IS_NULL}.
     *
     * @param field    top-level JSON field name
     * @param operator comparison
     * @param value    String, Number, Boolean or Instant
     */
    public record Condition(String field, Operator operator, Object value) {

        public Condition {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("field cannot be null or blank");
            }
            if (operator == null) {
                throw new IllegalArgumentException("operator cannot be null");
            }
            if (operator != Operator.IS_NULL && value == null) {
                throw new IllegalArgumentException("value cannot be null for operator " + operator);
            }
        }
    }

    private final List<Condition> conditions;
    private final String orderBy;
    private final boolean descending;
    private final int offset;
    private final Integer limit;

    private DocumentQuery(Builder builder) {
        this.conditions = List.copyOf(builder.conditions);
        this.orderBy = builder.orderBy;
        this.descending = builder.descending;
        this.offset = builder.offset;
        this.limit = builder.limit;
    }

    /**
     * Starts a query restricted to one document kind.
     *
     * @param kind document kind
     * @return builder
     */
    public static Builder forKind(DocumentKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return new Builder().whereEquals("documentType", kind.getValue());
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public String getOrderBy() {
        return orderBy;
    }

    public boolean isDescending() {
        return descending;
    }

    public int getOffset() {
        return offset;
    }

    public Integer getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        StringBuilder sql = new StringBuilder("SELECT * FROM c");
        for (int i = 0; i < conditions.size(); i++) {
            Condition condition = conditions.get(i);
            sql.append(i == 0 ? " WHERE " : " AND ")
                .append("c.").append(condition.field()).append(' ')
                .append(condition.operator().getSymbol());
            if (condition.operator() != Operator.IS_NULL) {
                sql.append(' ').append(literal(condition.value()));
            }
        }
        if (orderBy != null) {
            sql.append(" ORDER BY c.").append(orderBy).append(descending ? " DESC" : "");
        }
        if (offset > 0 || limit != null) {
            sql.append(" OFFSET ").append(offset).append(" LIMIT ").append(limit == null ? "ALL" : limit);
        }
        return sql.toString();
    }

    private static String literal(Object value) {
        if (value instanceof String || value instanceof Instant) {
            return "'" + value + "'";
        }
        return String.valueOf(value);
    }

    /**
     * Builder for {@link DocumentQuery}.
     */
    public static final class Builder {

        private final List<Condition> conditions = new ArrayList<>();
        private String orderBy;
        private boolean descending;
        private int offset;
        private Integer limit;

        private Builder() {
        }

        public Builder where(String field, Operator operator, Object value) {
            conditions.add(new Condition(field, operator, value));
            return this;
        }

        public Builder whereEquals(String field, Object value) {
            return where(field, Operator.EQ, value);
        }

        public Builder whereNull(String field) {
            return where(field, Operator.IS_NULL, null);
        }

        public Builder orderBy(String field) {
            this.orderBy = field;
            this.descending = false;
            return this;
        }

        public Builder orderByDescending(String field) {
            this.orderBy = field;
            this.descending = true;
            return this;
        }

        public Builder offset(int offset) {
            if (offset < 0) {
                throw new IllegalArgumentException("offset cannot be negative");
            }
            this.offset = offset;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit cannot be negative");
            }
            this.limit = limit;
            return this;
        }

        public DocumentQuery build() {
            return new DocumentQuery(this);
        }
    }
}
