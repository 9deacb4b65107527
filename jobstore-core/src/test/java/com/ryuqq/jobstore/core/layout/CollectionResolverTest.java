package com.ryuqq.jobstore.core.layout;

import com.ryuqq.jobstore.core.document.DocumentKind;
import com.ryuqq.jobstore.core.document.JobDocument;
import com.ryuqq.jobstore.core.document.SetDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CollectionResolver 유닛 테스트.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class CollectionResolverTest {

    private final CollectionResolver dedicated =
        new CollectionResolver(CollectionLayout.DEDICATED, new CollectionNames());
    private final CollectionResolver consolidated =
        new CollectionResolver(CollectionLayout.CONSOLIDATED, new CollectionNames());

    @Test
    void DEDICATED_배치는_종류별_컬렉션을_사용함() {
        assertThat(dedicated.collectionFor(DocumentKind.JOB)).isEqualTo("jobs");
        assertThat(dedicated.collectionFor(DocumentKind.JOB_INDEX)).isEqualTo("jobs");
        assertThat(dedicated.collectionFor(DocumentKind.LOCK)).isEqualTo("locks");
        assertThat(dedicated.collectionFor(DocumentKind.COUNTER)).isEqualTo("counters");
        assertThat(dedicated.collectionFor("hash")).isEqualTo("hashes");
        assertThat(dedicated.requiredCollections())
            .containsExactly("jobs", "servers", "locks", "queues", "sets", "hashes", "lists", "counters");
    }

    @Test
    void CONSOLIDATED_배치는_세_컬렉션으로_묶음() {
        assertThat(consolidated.collectionFor(DocumentKind.JOB)).isEqualTo("jobs");
        assertThat(consolidated.collectionFor(DocumentKind.SERVER)).isEqualTo("metadata");
        assertThat(consolidated.collectionFor(DocumentKind.QUEUE)).isEqualTo("metadata");
        assertThat(consolidated.collectionFor(DocumentKind.LIST)).isEqualTo("collections");
        assertThat(consolidated.requiredCollections()).containsExactly("jobs", "metadata", "collections");
    }

    @Test
    void 파티션_키는_종류와_키로_결정됨() {
        assertThat(dedicated.partitionKeyFor(DocumentKind.JOB, "critical")).isEqualTo("job:critical");
        assertThat(dedicated.partitionKeyFor(DocumentKind.SET, "retries")).isEqualTo("set:retries");
        assertThat(dedicated.partitionKeyFor(DocumentKind.COUNTER, null)).isEqualTo("counters");
        assertThat(dedicated.partitionKeyFor(DocumentKind.JOB_INDEX, "ignored")).isEqualTo("job-index");
    }

    @Test
    void 범위가_필요한_종류에_범위가_없으면_예외() {
        assertThatThrownBy(() -> dedicated.partitionKeyFor(DocumentKind.HASH, " "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("hash");
    }

    @Test
    void assignPartitionKey는_문서에_키를_기록하고_컬렉션을_반환함() {
        // given
        JobDocument job = new JobDocument("job-1", "emails");
        SetDocument element = new SetDocument("schedule", "job-1", 10);

        // when
        String jobCollection = consolidated.assignPartitionKey(job);
        String setCollection = consolidated.assignPartitionKey(element);

        // then
        assertThat(jobCollection).isEqualTo("jobs");
        assertThat(job.getPartitionKey()).isEqualTo("job:emails");
        assertThat(setCollection).isEqualTo("collections");
        assertThat(element.getPartitionKey()).isEqualTo("set:schedule");
    }

    @Test
    void 배치에_필요한_이름이_비어있으면_생성_실패() {
        CollectionNames names = new CollectionNames().withMetadata("");

        assertThatThrownBy(() -> new CollectionResolver(CollectionLayout.CONSOLIDATED, names))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("metadata");
        assertThat(new CollectionResolver(CollectionLayout.DEDICATED, names).collectionFor(DocumentKind.JOB))
            .isEqualTo("jobs");
    }

    @Test
    void 알_수_없는_문서_종류는_예외() {
        assertThatThrownBy(() -> dedicated.collectionFor("widget"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("widget");
        assertThat(List.of(DocumentKind.values())).hasSize(9);
    }
}
