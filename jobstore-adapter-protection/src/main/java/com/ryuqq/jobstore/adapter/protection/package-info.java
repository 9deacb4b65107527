/**
 * Protection 어댑터.
 *
 * <p>core의 Protection SPI 구현과 {@link com.ryuqq.jobstore.core.spi.DocumentStore} 데코레이터를 제공합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.jobstore.adapter.protection.ConsecutiveFailureCircuitBreaker} - 연속 실패 기반 Circuit Breaker</li>
 *   <li>{@link com.ryuqq.jobstore.adapter.protection.FixedTimeoutPolicy} - 고정 호출 타임아웃</li>
 *   <li>{@link com.ryuqq.jobstore.adapter.protection.ResilientDocumentStore} - Circuit Breaker + 타임아웃</li>
 *   <li>{@link com.ryuqq.jobstore.adapter.protection.RetryingDocumentStore} - 일시적 오류 재시도</li>
 *   <li>{@link com.ryuqq.jobstore.adapter.protection.DocumentStoreProtection} - 체인 조립</li>
 * </ul>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
package com.ryuqq.jobstore.adapter.protection;
