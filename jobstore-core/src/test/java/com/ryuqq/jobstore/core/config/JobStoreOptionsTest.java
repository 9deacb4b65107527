package com.ryuqq.jobstore.core.config;

import com.ryuqq.jobstore.core.document.DocumentKind;
import com.ryuqq.jobstore.core.layout.CollectionLayout;
import com.ryuqq.jobstore.core.layout.CollectionNames;
import com.ryuqq.jobstore.core.protection.CircuitBreakerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JobStoreOptions 유닛 테스트.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
@DisplayName("JobStoreOptions 테스트")
class JobStoreOptionsTest {

    @Test
    @DisplayName("기본 설정값")
    void 기본값() {
        // when
        JobStoreOptions options = new JobStoreOptions();

        // then
        assertThat(options.collectionLayout()).isEqualTo(CollectionLayout.DEDICATED);
        assertThat(options.defaultJobExpiration()).isEqualTo(Duration.ofDays(7));
        assertThat(options.serverTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(options.lockTimeout()).isEqualTo(Duration.ofMinutes(1));
        assertThat(options.maxRetryAttempts()).isEqualTo(5);
        assertThat(options.queryPageSize()).isEqualTo(100);
        assertThat(options.concurrencyRetryAttempts()).isEqualTo(5);
        assertThat(options.lockRenewalEnabled()).isFalse();
        assertThat(options.jobIndexEnabled()).isTrue();
        assertThat(options.instanceName()).isNotBlank();
    }

    @Test
    @DisplayName("withX는 한 필드만 바꾼 새 인스턴스를 반환한다")
    void withX_불변() {
        // given
        JobStoreOptions base = new JobStoreOptions();

        // when
        JobStoreOptions changed = base.withLockRenewalInterval(Duration.ofSeconds(20))
            .withCollectionLayout(CollectionLayout.CONSOLIDATED);

        // then
        assertThat(changed.lockRenewalEnabled()).isTrue();
        assertThat(changed.createResolver().collectionFor(DocumentKind.LOCK)).isEqualTo("metadata");
        assertThat(base.lockRenewalEnabled()).isFalse();
        assertThat(base.createResolver().collectionFor(DocumentKind.LOCK)).isEqualTo("locks");
    }

    @Test
    @DisplayName("잘못된 값은 필드 이름과 함께 거부된다")
    void 검증_실패() {
        JobStoreOptions options = new JobStoreOptions();

        assertThatThrownBy(() -> options.withServerTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("serverTimeout");
        assertThatThrownBy(() -> options.withMaxRetryAttempts(-1))
            .hasMessageContaining("maxRetryAttempts");
        assertThatThrownBy(() -> options.withConcurrencyRetryAttempts(0))
            .hasMessageContaining("concurrencyRetryAttempts");
        assertThatThrownBy(() -> options.withInstanceName(" "))
            .hasMessageContaining("instanceName");
        assertThatThrownBy(() -> options.withLockRenewalInterval(Duration.ofSeconds(-1)))
            .hasMessageContaining("lockRenewalInterval");
    }

    @Test
    @DisplayName("CONSOLIDATED 배치는 metadata, collections 이름이 필요하다")
    void 배치별_이름_검증() {
        JobStoreOptions options = new JobStoreOptions()
            .withCollectionNames(new CollectionNames().withCollections(null));

        assertThatThrownBy(() -> options.withCollectionLayout(CollectionLayout.CONSOLIDATED))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("collections");
    }

    @Test
    @DisplayName("문서 종류별 기본 TTL")
    void 문서_TTL() {
        DocumentTtl ttl = new DocumentTtl().withServer(Duration.ofMinutes(2));

        assertThat(ttl.forKind(DocumentKind.SERVER)).contains(Duration.ofMinutes(2));
        assertThat(ttl.forKind(DocumentKind.JOB_INDEX)).contains(Duration.ofDays(30));
        assertThat(ttl.forKind(DocumentKind.SET)).isEmpty();
        assertThatThrownBy(() -> ttl.withLock(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Circuit Breaker 설정 검증")
    void circuitBreaker_설정() {
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        assertThat(config.failureThreshold()).isEqualTo(5);
        assertThat(config.withFailureThreshold(2).failureThreshold()).isEqualTo(2);
        assertThatThrownBy(() -> config.withOpenTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("openTimeout");
    }
}
