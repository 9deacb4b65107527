package com.ryuqq.jobstore.application.collections;

import com.ryuqq.jobstore.adapter.inmemory.store.InMemoryDocumentStore;
import com.ryuqq.jobstore.application.storage.StorageContext;
import com.ryuqq.jobstore.application.support.TestClock;
import com.ryuqq.jobstore.core.config.JobStoreOptions;
import com.ryuqq.jobstore.core.document.CounterDocument;
import com.ryuqq.jobstore.core.document.DocumentKind;
import com.ryuqq.jobstore.core.protection.BackoffCalculator;
import com.ryuqq.jobstore.core.spi.DocumentPreconditionFailedException;
import com.ryuqq.jobstore.core.spi.DocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

/**
 * KeyedCollections 유닛 테스트.
 *
 * <p>트랜잭션을 거치지 않는 직접 호출 경로를 검증합니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class KeyedCollectionsTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private TestClock clock;
    private KeyedCollections collections;

    @BeforeEach
    void setUp() {
        clock = new TestClock(T0);
        JobStoreOptions options = new JobStoreOptions();
        StorageContext context = new StorageContext(InMemoryDocumentStore.forOptions(options, clock), options, clock);
        collections = new KeyedCollections(context);
    }

    // ===== 카운터 =====

    @Test
    void 카운터는_없으면_생성하고_누적함() {
        assertThat(collections.getCounter("stats:succeeded")).isZero();

        assertThat(collections.adjustCounter("stats:succeeded", 1, null)).isEqualTo(1);
        assertThat(collections.adjustCounter("stats:succeeded", 4, null)).isEqualTo(5);
        assertThat(collections.adjustCounter("stats:succeeded", -2, null)).isEqualTo(3);
        assertThat(collections.getCounter("stats:succeeded")).isEqualTo(3);
    }

    @Test
    void 만료가_지정된_카운터는_만료_후_0() {
        // given
        collections.adjustCounter("stats:succeeded:2024-01-01-00", 1, Duration.ofHours(1));

        // when
        clock.advance(Duration.ofHours(1).plusSeconds(1));

        // then
        assertThat(collections.getCounter("stats:succeeded:2024-01-01-00")).isZero();
    }

    @Test
    void 카운터_경합은_concurrencyRetryAttempts를_넘어서도_재시도해_수렴함() {
        // given: 기본 재시도 횟수(5)보다 많은 8번 연속 etag 충돌
        JobStoreOptions options = new JobStoreOptions();
        DocumentStore store = spy(InMemoryDocumentStore.forOptions(options, clock));
        AtomicInteger conflicts = new AtomicInteger();
        doAnswer(invocation -> {
            if (conflicts.incrementAndGet() <= 8) {
                throw new DocumentPreconditionFailedException("counters", "counter:stats:succeeded", "counter");
            }
            return invocation.callRealMethod();
        }).when(store).replace(anyString(), any(CounterDocument.class));
        KeyedCollections contended = new KeyedCollections(new StorageContext(store, options, clock),
            new BackoffCalculator(1, 1, 0.0));
        contended.adjustCounter("stats:succeeded", 1, null);

        // when
        long value = contended.adjustCounter("stats:succeeded", 1, null);

        // then
        assertThat(options.concurrencyRetryAttempts()).isLessThan(8);
        assertThat(value).isEqualTo(2);
        assertThat(contended.getCounter("stats:succeeded")).isEqualTo(2);
    }

    @Test
    void 경합_한도를_넘기면_마지막_충돌을_던짐() {
        // given
        JobStoreOptions options = new JobStoreOptions();
        DocumentStore store = spy(InMemoryDocumentStore.forOptions(options, clock));
        doAnswer(invocation -> {
            throw new DocumentPreconditionFailedException("counters", "counter:stats:failed", "counter");
        }).when(store).replace(anyString(), any(CounterDocument.class));
        KeyedCollections contended = new KeyedCollections(new StorageContext(store, options, clock),
            new BackoffCalculator(1, 1, 0.0));
        contended.adjustCounter("stats:failed", 1, null);

        // then
        assertThatThrownBy(() -> contended.adjustCounter("stats:failed", 1, null))
            .isInstanceOf(DocumentPreconditionFailedException.class);
        assertThat(contended.getCounter("stats:failed")).isEqualTo(1);
    }

    // ===== 집합 =====

    @Test
    void 점수_범위에서_가장_낮은_값을_고름() {
        // given
        collections.addToSet("schedule", "job-late", 300);
        collections.addToSet("schedule", "job-early", 100);
        collections.addToSet("schedule", "job-mid", 200);

        // then
        assertThat(collections.getFirstByLowestScoreFromSet("schedule", 150, 400)).isEqualTo("job-mid");
        assertThat(collections.getFirstByLowestScoreFromSet("schedule", 0, 250, 5))
            .containsExactly("job-early", "job-mid");
        assertThat(collections.getFirstByLowestScoreFromSet("schedule", 500, 600)).isNull();
    }

    @Test
    void 같은_값을_다시_넣으면_점수만_바뀜() {
        // given
        collections.addToSet("schedule", "job-1", 100);

        // when
        collections.addToSet("schedule", "job-1", 50);

        // then
        assertThat(collections.getSetCount("schedule")).isEqualTo(1);
        assertThat(collections.getFirstByLowestScoreFromSet("schedule", 0, 60)).isEqualTo("job-1");
    }

    @Test
    void 없는_값의_삭제는_무시됨() {
        collections.addToSet("retries", "job-1", 0);

        collections.removeFromSet("retries", "job-2");

        assertThat(collections.getAllItemsFromSet("retries")).containsExactly("job-1");
    }

    @Test
    void 잘못된_범위와_개수는_거부됨() {
        assertThatThrownBy(() -> collections.getFirstByLowestScoreFromSet("s", 10, 5, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("toScore");
        assertThatThrownBy(() -> collections.getFirstByLowestScoreFromSet("s", 0, 5, 0))
            .hasMessageContaining("count");
        assertThatThrownBy(() -> collections.getRangeFromSet("s", 3, 1))
            .hasMessageContaining("endingAt");
        assertThatThrownBy(() -> collections.getRangeFromList("l", -1, 1))
            .hasMessageContaining("startingFrom");
    }

    // ===== 해시 / 만료 =====

    @Test
    void 해시_필드를_개별로_조회함() {
        // given
        collections.setRangeInHash("recurring-job:nightly", Map.of("Cron", "0 0 * * *", "Queue", "default"));

        // then
        assertThat(collections.getValueFromHash("recurring-job:nightly", "Cron")).isEqualTo("0 0 * * *");
        assertThat(collections.getValueFromHash("recurring-job:nightly", "Missing")).isNull();
        assertThat(collections.getHashCount("recurring-job:nightly")).isEqualTo(2);
    }

    @Test
    void setExpiration은_모든_요소에_적용되고_TTL로_보임() {
        // given
        collections.insertToList("log", "a");
        collections.insertToList("log", "b");

        // when
        int updated = collections.setExpiration(DocumentKind.LIST, "log", T0.plus(Duration.ofMinutes(10)));

        // then
        assertThat(updated).isEqualTo(2);
        assertThat(collections.getListTtl("log")).isEqualTo(Duration.ofMinutes(10));
        assertThat(collections.setExpiration(DocumentKind.LIST, "log", T0.plus(Duration.ofMinutes(10)))).isZero();
        assertThatThrownBy(() -> collections.setExpiration(DocumentKind.COUNTER, "log", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Not a keyed collection");
    }
}
