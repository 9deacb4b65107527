/**
 * Job 생명주기 패키지.
 *
 * <p>Job 문서의 조회, etag 기반 수정, 큐 이동, 상태 전이 적용을 담당합니다.
 * 모든 수정은 {@link com.ryuqq.jobstore.application.lifecycle.JobRepository}를 거칩니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
package com.ryuqq.jobstore.application.lifecycle;
