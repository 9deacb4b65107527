package com.ryuqq.jobstore.core.protection.noop;

import com.ryuqq.jobstore.core.protection.CircuitBreaker;
import com.ryuqq.jobstore.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 비활성 보호 정책 테스트.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
@DisplayName("NoOp 보호 정책 테스트")
class NoOpCircuitBreakerTest {

    @Test
    @DisplayName("실패가 계속되어도 항상 통과시키고 CLOSED를 유지한다")
    void 실패_후에도_통과() {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker();

        // when
        for (int i = 0; i < 100; i++) {
            cb.recordFailure("get jobs", new RuntimeException("boom"));
        }

        // then
        assertTrue(cb.tryAcquire("get jobs"));
        assertEquals(CircuitBreakerState.CLOSED, cb.getState());
        assertNull(cb.retryAfter());
    }

    @Test
    @DisplayName("타임아웃 정책은 제한 없음(0)을 반환한다")
    void 타임아웃_없음() {
        NoOpTimeoutPolicy policy = new NoOpTimeoutPolicy();

        assertEquals(0L, policy.getPerAttemptTimeoutMs("get jobs"));
        assertDoesNotThrow(() -> policy.recordTimeout("get jobs", 1000));
    }
}
