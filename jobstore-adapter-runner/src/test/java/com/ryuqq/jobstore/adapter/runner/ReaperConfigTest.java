package com.ryuqq.jobstore.adapter.runner;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ReaperConfig 유닛 테스트.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class ReaperConfigTest {

    @Test
    void 기본값() {
        ReaperConfig config = new ReaperConfig();

        assertThat(config.scanIntervalMs()).isEqualTo(300000);
        assertThat(config.timeoutThreshold()).isEqualTo(Duration.ofMinutes(30));
        assertThat(config.batchSize()).isEqualTo(50);
        assertThat(config.defaultStrategy()).isEqualTo(ReconcileStrategy.RETRY);
        assertThat(config.serverTimeout()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void with_메서드는_한_필드만_바꾼_새_인스턴스를_반환함() {
        ReaperConfig base = new ReaperConfig();

        ReaperConfig changed = base.withBatchSize(10).withServerTimeoutMs(60000);

        assertThat(changed.batchSize()).isEqualTo(10);
        assertThat(changed.serverTimeoutMs()).isEqualTo(60000);
        assertThat(changed.scanIntervalMs()).isEqualTo(base.scanIntervalMs());
        assertThat(base.batchSize()).isEqualTo(50);
    }

    @Test
    void 잘못된_값은_거부됨() {
        ReaperConfig config = new ReaperConfig();

        assertThatThrownBy(() -> config.withScanIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("scanIntervalMs");
        assertThatThrownBy(() -> config.withTimeoutThresholdMs(-1))
            .hasMessageContaining("timeoutThresholdMs");
        assertThatThrownBy(() -> config.withBatchSize(0))
            .hasMessageContaining("batchSize");
        assertThatThrownBy(() -> config.withDefaultStrategy(null))
            .hasMessageContaining("defaultStrategy");
        assertThatThrownBy(() -> config.withServerTimeoutMs(0))
            .hasMessageContaining("serverTimeoutMs");
    }
}
