/**
 * 작업 저장소 연결 API 패키지.
 *
 * <p>외부 작업 처리 프레임워크가 호출하는 진입점을 제공합니다.</p>
 *
 * <h2>주요 흐름</h2>
 * <pre>
 * 1. createExpiredJob        → Job 생성 (created)
 * 2. WriteTransaction        → setJobState + addToQueue (enqueued)
 * 3. fetchNextJob            → processing으로 claim
 * 4. WriteTransaction        → 결과 상태 기록 (succeeded, failed ...)
 * 5. FetchedJob.acknowledge  → 핸들 마무리
 * </pre>
 *
 * @author JobStore Team
 * @since 1.0.0
 * @see com.ryuqq.jobstore.application.connection.JobStorageConnection
 */
package com.ryuqq.jobstore.application.connection;
