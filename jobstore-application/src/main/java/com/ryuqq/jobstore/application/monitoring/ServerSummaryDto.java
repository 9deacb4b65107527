package com.ryuqq.jobstore.application.monitoring;

import java.time.Instant;
import java.util.List;

/**
 * 서버 요약.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public record ServerSummaryDto(
    String serverId,
    String name,
    int workerCount,
    List<String> queues,
    Instant startedAt,
    Instant lastHeartbeat
) {
}
