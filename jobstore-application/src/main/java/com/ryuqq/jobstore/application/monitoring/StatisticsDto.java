package com.ryuqq.jobstore.application.monitoring;

/**
 * 대시보드 통계.
 *
 * @param enqueued enqueued Job 수
 * @param scheduled scheduled Job 수
 * @param processing processing Job 수
 * @param succeeded succeeded Job 수 (만료 전)
 * @param failed failed Job 수
 * @param deleted deleted Job 수 (만료 전)
 * @param servers 등록 서버 수
 * @param queues 큐 수
 * @param recurring {@code recurring-jobs} 집합 크기
 * @param retries {@code retries} 집합 크기
 * @author JobStore Team
 * @since 1.0.0
 */
public record StatisticsDto(
    long enqueued,
    long scheduled,
    long processing,
    long succeeded,
    long failed,
    long deleted,
    long servers,
    long queues,
    long recurring,
    long retries
) {
}
