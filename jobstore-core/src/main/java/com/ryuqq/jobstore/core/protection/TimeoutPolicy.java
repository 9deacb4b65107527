package com.ryuqq.jobstore.core.protection;

/**
 * Timeout Policy SPI.
 *
 * <p>Document Store 호출 하나하나의 최대 허용 시간을 정합니다.
 * 여러 호출로 이루어진 논리 작업(예: fetch 후 processing 표시)에는
 * 호출마다 독립적인 타임아웃이 적용됩니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public interface TimeoutPolicy {

    /**
     * 호출당 타임아웃 시간 조회.
     *
     * @param operationName 작업 이름
     * @return 타임아웃 시간 (밀리초), 0은 타임아웃 없음을 의미
     */
    long getPerAttemptTimeoutMs(String operationName);

    /**
     * 타임아웃 발생 기록.
     *
     * @param operationName 작업 이름
     * @param elapsedMs 실제 경과 시간 (밀리초)
     */
    void recordTimeout(String operationName, long elapsedMs);
}
