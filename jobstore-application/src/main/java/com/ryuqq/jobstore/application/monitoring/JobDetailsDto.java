package com.ryuqq.jobstore.application.monitoring;

import com.ryuqq.jobstore.core.document.InvocationData;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Job 상세.
 *
 * @param jobId Job ID
 * @param jobName {@code Type.method} 형태 이름
 * @param queue 큐 이름
 * @param createdAt 생성 시각
 * @param expireAt 만료 시각 (영구이면 null)
 * @param parameters 파라미터
 * @param invocationData 저장된 호출 정보
 * @param history 상태 이력 (최신 순)
 * @author JobStore Team
 * @since 1.0.0
 */
public record JobDetailsDto(
    String jobId,
    String jobName,
    String queue,
    Instant createdAt,
    Instant expireAt,
    Map<String, String> parameters,
    InvocationData invocationData,
    List<StateHistoryDto> history
) {
}
