package com.ryuqq.jobstore.core.protection;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void 재시도마다_지연이_두배로_늘어남() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(100, 10_000, 0.0);

        // then
        assertThat(calculator.calculate(1)).isEqualTo(100);
        assertThat(calculator.calculate(2)).isEqualTo(200);
        assertThat(calculator.calculate(3)).isEqualTo(400);
    }

    @Test
    void jitter는_지수_지연의_비율_이내() {
        BackoffCalculator calculator = new BackoffCalculator(100, 10_000, 0.1);

        for (int i = 0; i < 100; i++) {
            assertThat(calculator.calculate(2)).isBetween(200L, 220L);
        }
    }

    @Test
    void 최대_지연을_넘지_않고_큰_횟수에서도_overflow_없음() {
        BackoffCalculator calculator = new BackoffCalculator(100, 5_000, 1.0);

        assertThat(calculator.calculate(10)).isEqualTo(5_000);
        assertThat(calculator.calculate(Integer.MAX_VALUE)).isEqualTo(5_000);
    }

    @Test
    void retryDelay_기준_상한은_32배() {
        BackoffCalculator calculator = BackoffCalculator.forRetryDelay(Duration.ofMillis(50));

        assertThat(calculator.getBaseDelayMs()).isEqualTo(50);
        assertThat(calculator.getMaxDelayMs()).isEqualTo(1_600);
        assertThat(calculator.calculate(20)).isEqualTo(1_600);
        assertThat(BackoffCalculator.forRetryDelay(Duration.ZERO).getBaseDelayMs()).isEqualTo(1);
    }

    @Test
    void 잘못된_설정은_거부됨() {
        assertThatThrownBy(() -> new BackoffCalculator(0, 100, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseDelayMs");
        assertThatThrownBy(() -> new BackoffCalculator(100, 50, 0.1))
            .hasMessageContaining("maxDelayMs");
        assertThatThrownBy(() -> new BackoffCalculator(100, 200, 1.5))
            .hasMessageContaining("jitterFactor");
        assertThatThrownBy(() -> new BackoffCalculator().calculate(0))
            .hasMessageContaining("attemptCount");
    }
}
