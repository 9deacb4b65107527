/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>Document Store 호출을 장애로부터 격리하기 위한 Circuit Breaker와 Timeout Policy
 * 확장점을 정의합니다.</p>
 *
 * <h2>적용 순서</h2>
 * <pre>
 * 1. CircuitBreaker  → OPEN 상태 시 즉시 실패 (저장소 호출 없음)
 * 2. TimeoutPolicy   → 호출당 타임아웃, 초과 시 실패로 기록
 * 3. DocumentStore   → 실제 저장소 호출
 * </pre>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지는 보호 없이 실행하기 위한 기본 구현을 제공합니다.
 * 실제 구현은 jobstore-adapter-protection 모듈에 있습니다.</p>
 *
 * <pre>{@code
 * CircuitBreaker cb = config.enabled()
 *     ? new ConsecutiveFailureCircuitBreaker(config, clock)
 *     : new NoOpCircuitBreaker();
 * }</pre>
 *
 * @author JobStore Team
 * @since 1.0.0
 * @see com.ryuqq.jobstore.core.protection.CircuitBreaker
 * @see com.ryuqq.jobstore.core.protection.TimeoutPolicy
 * @see com.ryuqq.jobstore.core.protection.noop
 */
package com.ryuqq.jobstore.core.protection;
