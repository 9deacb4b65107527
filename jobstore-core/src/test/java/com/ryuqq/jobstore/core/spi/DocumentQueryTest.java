package com.ryuqq.jobstore.core.spi;

import com.ryuqq.jobstore.core.document.DocumentKind;
import com.ryuqq.jobstore.core.spi.DocumentQuery.Operator;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DocumentQuery unit tests.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class DocumentQueryTest {

    @Test
    void forKind_filtersByDocumentType() {
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.JOB).build();

        assertThat(query.getConditions()).singleElement()
            .satisfies(condition -> {
                assertThat(condition.field()).isEqualTo("documentType");
                assertThat(condition.value()).isEqualTo("job");
            });
        assertThat(query.getLimit()).isNull();
    }

    @Test
    void toString_rendersSql() {
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.JOB)
            .whereEquals("state", "enqueued")
            .where("updatedAt", Operator.LT, Instant.parse("2024-01-01T00:00:00Z"))
            .whereNull("expireAt")
            .orderByDescending("createdAt")
            .offset(10)
            .limit(5)
            .build();

        assertThat(query.toString()).isEqualTo(
            "SELECT * FROM c WHERE c.documentType = 'job' AND c.state = 'enqueued'"
                + " AND c.updatedAt < '2024-01-01T00:00:00Z' AND c.expireAt IS NULL"
                + " ORDER BY c.createdAt DESC OFFSET 10 LIMIT 5");
    }

    @Test
    void orderBy_lastCallWins() {
        DocumentQuery query = DocumentQuery.forKind(DocumentKind.SET)
            .orderByDescending("score")
            .orderBy("value")
            .build();

        assertThat(query.getOrderBy()).isEqualTo("value");
        assertThat(query.isDescending()).isFalse();
    }

    @Test
    void invalidConditions_rejected() {
        assertThatThrownBy(() -> DocumentQuery.forKind(DocumentKind.SET).where("score", Operator.GT, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DocumentQuery.forKind(DocumentKind.SET).offset(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DocumentQuery.forKind(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
