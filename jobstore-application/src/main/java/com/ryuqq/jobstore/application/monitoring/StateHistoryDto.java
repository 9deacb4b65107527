package com.ryuqq.jobstore.application.monitoring;

import java.time.Instant;
import java.util.Map;

/**
 * 상태 이력 항목.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public record StateHistoryDto(String stateName, String reason, Instant createdAt, Map<String, String> data) {
}
