package com.ryuqq.jobstore.core.protection.noop;

import com.ryuqq.jobstore.core.protection.TimeoutPolicy;

/**
 * 호출당 타임아웃 없음.
 *
 * <p>Circuit Breaker를 끈 설정에서 쓰입니다. 0을 반환하므로 저장소 호출은
 * 별도 스레드 없이 호출 스레드에서 그대로 실행됩니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class NoOpTimeoutPolicy implements TimeoutPolicy {

    @Override
    public long getPerAttemptTimeoutMs(String operationName) {
        return 0;
    }

    @Override
    public void recordTimeout(String operationName, long elapsedMs) {
        // 타임아웃을 걸지 않으므로 호출되지 않음
    }
}
