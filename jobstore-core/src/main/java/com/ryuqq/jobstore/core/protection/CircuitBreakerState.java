package com.ryuqq.jobstore.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 failureThreshold회)
 * OPEN (차단)
 *   │
 *   ▼ (openTimeout 경과 후 다음 호출)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 연속 성공 successThreshold회 → CLOSED
 *   └─► 실패 1회 → OPEN
 * </pre>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>저장소에는 어떤 요청도 전달되지 않습니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태.
     *
     * <p>요청을 통과시켜 저장소 복구 여부를 확인합니다.
     * 한 번이라도 실패하면 다시 OPEN으로 전이합니다.</p>
     */
    HALF_OPEN
}
