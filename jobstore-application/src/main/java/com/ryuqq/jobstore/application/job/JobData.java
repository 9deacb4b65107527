package com.ryuqq.jobstore.application.job;

import com.ryuqq.jobstore.core.document.InvocationData;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 조회된 Job 정보.
 *
 * <p>호출 정보를 복원하지 못해도 조회는 성공하며, 이 경우 {@code job}은 null이고
 * {@code loadException}에 원인이 담깁니다.</p>
 *
 * @param jobId Job ID
 * @param job 복원된 Job (복원 실패 시 null)
 * @param invocationData 저장된 호출 정보
 * @param state 현재 상태 이름
 * @param queueName 큐 이름
 * @param createdAt 생성 시각
 * @param parameters Job 파라미터 (읽기 전용)
 * @param loadException 복원 실패 원인 (성공 시 null)
 * @author JobStore Team
 * @since 1.0.0
 */
public record JobData(
    String jobId,
    Job job,
    InvocationData invocationData,
    String state,
    String queueName,
    Instant createdAt,
    Map<String, String> parameters,
    InvocationDataException loadException
) {

    public JobData {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public boolean isLoaded() {
        return job != null;
    }

    /**
     * 복원된 Job 조회.
     *
     * @return Job
     * @throws InvocationDataException 복원에 실패했던 경우
     */
    public Job requireJob() {
        if (job == null) {
            throw loadException != null
                ? loadException
                : new InvocationDataException("Job " + jobId + " has no invocation data");
        }
        return job;
    }
}
