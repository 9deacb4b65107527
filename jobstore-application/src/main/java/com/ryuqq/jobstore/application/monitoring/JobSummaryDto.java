package com.ryuqq.jobstore.application.monitoring;

import java.time.Instant;
import java.util.Map;

/**
 * 목록 화면용 Job 요약.
 *
 * @param jobId Job ID
 * @param jobName {@code Type.method} 형태 이름 (호출 정보가 없으면 null)
 * @param queue 큐 이름
 * @param state 현재 상태
 * @param reason 마지막 전이 사유
 * @param createdAt 생성 시각
 * @param stateEnteredAt 현재 상태 진입 시각
 * @param stateData 상태 데이터
 * @author JobStore Team
 * @since 1.0.0
 */
public record JobSummaryDto(
    String jobId,
    String jobName,
    String queue,
    String state,
    String reason,
    Instant createdAt,
    Instant stateEnteredAt,
    Map<String, String> stateData
) {
}
