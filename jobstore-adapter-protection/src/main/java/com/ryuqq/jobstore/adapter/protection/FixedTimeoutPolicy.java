package com.ryuqq.jobstore.adapter.protection;

import com.ryuqq.jobstore.core.protection.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 모든 작업에 같은 타임아웃을 적용하는 Timeout Policy.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class FixedTimeoutPolicy implements TimeoutPolicy {

    private static final Logger log = LoggerFactory.getLogger(FixedTimeoutPolicy.class);

    private final long timeoutMs;
    private final AtomicLong timeoutCount = new AtomicLong();

    public FixedTimeoutPolicy(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeoutMs = timeout.toMillis();
    }

    @Override
    public long getPerAttemptTimeoutMs(String operationName) {
        return timeoutMs;
    }

    @Override
    public void recordTimeout(String operationName, long elapsedMs) {
        timeoutCount.incrementAndGet();
        log.warn("Operation '{}' timed out after {} ms", operationName, elapsedMs);
    }

    /**
     * 누적 타임아웃 횟수.
     *
     * @return 타임아웃 횟수
     */
    public long getTimeoutCount() {
        return timeoutCount.get();
    }
}
