package com.ryuqq.jobstore.application.monitoring;

import java.util.List;

/**
 * 큐 요약.
 *
 * @param name 큐 이름
 * @param length enqueued Job 수
 * @param fetched processing Job 수
 * @param firstJobs 맨 앞 enqueued Job들
 * @author JobStore Team
 * @since 1.0.0
 */
public record QueueSummaryDto(String name, long length, long fetched, List<JobSummaryDto> firstJobs) {
}
