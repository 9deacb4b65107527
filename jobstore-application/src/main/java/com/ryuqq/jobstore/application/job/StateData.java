package com.ryuqq.jobstore.application.job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Job의 현재 상태.
 *
 * @param name 상태 이름
 * @param reason 마지막 전이 사유 (nullable)
 * @param data 상태 데이터 (읽기 전용)
 * @author JobStore Team
 * @since 1.0.0
 */
public record StateData(String name, String reason, Map<String, String> data) {

    public StateData {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
