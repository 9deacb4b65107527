package com.ryuqq.jobstore.core.model;

import java.util.UUID;

/**
 * Job ID 생성기.
 *
 * <p>하이픈 없는 32자리 소문자 16진수 UUID를 생성합니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class JobIds {

    private JobIds() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 새 Job ID 생성.
     *
     * @return 32자리 ID
     */
    public static String newJobId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Job ID 검증.
     *
     * @param jobId 검증할 ID
     * @return 검증된 ID
     * @throws IllegalArgumentException null 또는 공백인 경우
     */
    public static String require(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be null or blank");
        }
        return jobId;
    }
}
