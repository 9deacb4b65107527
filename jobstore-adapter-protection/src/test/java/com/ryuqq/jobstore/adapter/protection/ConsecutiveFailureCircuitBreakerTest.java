package com.ryuqq.jobstore.adapter.protection;

import com.ryuqq.jobstore.core.protection.CircuitBreakerConfig;
import com.ryuqq.jobstore.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * ConsecutiveFailureCircuitBreaker 유닛 테스트.
 *
 * <ul>
 *   <li>CLOSED → OPEN: 연속 실패 임계값 도달</li>
 *   <li>OPEN → HALF_OPEN: 대기 시간 경과 후 첫 호출</li>
 *   <li>HALF_OPEN → CLOSED / OPEN</li>
 * </ul>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ConsecutiveFailureCircuitBreakerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final String OPERATION = "get-JobDocument";

    @Mock
    private Clock clock;

    private ConsecutiveFailureCircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        CircuitBreakerConfig config = new CircuitBreakerConfig()
            .withFailureThreshold(3)
            .withSuccessThreshold(2)
            .withOpenTimeout(Duration.ofSeconds(30));
        circuitBreaker = new ConsecutiveFailureCircuitBreaker(config, clock);
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            circuitBreaker.recordFailure(OPERATION, new RuntimeException("boom"));
        }
    }

    // ===== 1. CLOSED =====

    @Test
    void 임계값_미만의_실패는_CLOSED_유지() {
        // given
        when(clock.instant()).thenReturn(T0);

        // when
        failTimes(2);

        // then
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(circuitBreaker.tryAcquire(OPERATION)).isTrue();
    }

    @Test
    void 성공은_연속_실패_횟수를_초기화함() {
        // given
        when(clock.instant()).thenReturn(T0);

        // when
        failTimes(2);
        circuitBreaker.recordSuccess(OPERATION);
        failTimes(2);

        // then
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    // ===== 2. OPEN =====

    @Test
    void 연속_실패_임계값_도달_시_OPEN으로_전이하고_차단함() {
        // given
        when(clock.instant()).thenReturn(T0, T0, T0, T0.plusSeconds(10));

        // when
        failTimes(3);

        // then
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(circuitBreaker.retryAfter()).isEqualTo(T0.plusSeconds(30));
        assertThat(circuitBreaker.tryAcquire(OPERATION)).isFalse();
    }

    // ===== 3. HALF_OPEN =====

    @Test
    void 대기_시간_경과_후_HALF_OPEN에서_연속_성공하면_CLOSED() {
        // given
        when(clock.instant()).thenReturn(T0, T0, T0, T0.plusSeconds(30));
        failTimes(3);

        // when
        boolean allowed = circuitBreaker.tryAcquire(OPERATION);
        circuitBreaker.recordSuccess(OPERATION);

        // then
        assertThat(allowed).isTrue();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        circuitBreaker.recordSuccess(OPERATION);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(circuitBreaker.retryAfter()).isNull();
    }

    @Test
    void HALF_OPEN에서_한번_실패하면_즉시_OPEN() {
        // given
        when(clock.instant()).thenReturn(T0, T0, T0, T0.plusSeconds(31), T0.plusSeconds(31));
        failTimes(3);
        circuitBreaker.tryAcquire(OPERATION);

        // when
        circuitBreaker.recordFailure(OPERATION, new RuntimeException("still down"));

        // then
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(circuitBreaker.retryAfter()).isEqualTo(T0.plusSeconds(61));
    }

    @Test
    void reset은_CLOSED로_되돌림() {
        // given
        when(clock.instant()).thenReturn(T0);
        failTimes(3);

        // when
        circuitBreaker.reset();

        // then
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(circuitBreaker.tryAcquire(OPERATION)).isTrue();
    }
}
