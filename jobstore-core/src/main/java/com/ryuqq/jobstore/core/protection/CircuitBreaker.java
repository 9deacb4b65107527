package com.ryuqq.jobstore.core.protection;

import java.time.Instant;

/**
 * Circuit Breaker SPI.
 *
 * <p>Document Store 호출의 연속 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 장애가 난 저장소로 더 이상 요청이 가지 않도록 합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 연속 실패 횟수 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패</li>
 *   <li>HALF_OPEN: 요청을 통과시켜 복구 여부 확인</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = ...;
 * String operation = "get-JobDocument";
 *
 * if (!cb.tryAcquire(operation)) {
 *     throw new CircuitBreakerOpenException(operation, cb.retryAfter());
 * }
 *
 * try {
 *     JobDocument job = store.get(...);
 *     cb.recordSuccess(operation);
 *     return job;
 * } catch (RuntimeException e) {
 *     cb.recordFailure(operation, e);
 *     throw e;
 * }
 * }</pre>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <p>OPEN 상태에서 대기 시간이 지났다면 이 호출에서 HALF_OPEN으로 전이한 뒤 통과를 허용합니다.</p>
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: 대기 시간 경과 전에는 false</li>
     *   <li>HALF_OPEN: true (복구 확인용 호출)</li>
     * </ul>
     *
     * @param operationName 작업 이름 (통계 및 로깅용)
     * @return true: 요청 통과 허용, false: 요청 차단
     */
    boolean tryAcquire(String operationName);

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 횟수 초기화</li>
     *   <li>HALF_OPEN: 연속 성공 임계값 도달 시 CLOSED로 전이</li>
     * </ul>
     *
     * @param operationName 작업 이름
     */
    void recordSuccess(String operationName);

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 횟수가 임계값에 도달하면 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN으로 전이</li>
     * </ul>
     *
     * @param operationName 작업 이름
     * @param throwable 발생한 예외
     */
    void recordFailure(String operationName, Throwable throwable);

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 다시 요청을 보내도 되는 시각.
     *
     * @return OPEN 상태이면 마지막 실패 시각 + 대기 시간, 그 외에는 null
     */
    Instant retryAfter();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();
}
