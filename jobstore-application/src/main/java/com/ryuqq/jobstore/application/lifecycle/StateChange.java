package com.ryuqq.jobstore.application.lifecycle;

import com.ryuqq.jobstore.core.statemachine.JobState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Job에 적용할 상태 변경.
 *
 * <p>상태 이름은 소문자로 정규화됩니다. 표준 상태가 아닌 이름도 허용합니다.</p>
 *
 * @param name 상태 이름
 * @param reason 사유 (nullable)
 * @param data 상태 데이터 (읽기 전용)
 * @author JobStore Team
 * @since 1.0.0
 */
public record StateChange(String name, String reason, Map<String, String> data) {

    /** enqueued 상태 데이터의 큐 키. */
    public static final String QUEUE_KEY = "Queue";

    /** enqueued 상태 데이터의 등록 시각 키. */
    public static final String ENQUEUED_AT_KEY = "EnqueuedAt";

    public StateChange {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("State name cannot be null or blank");
        }
        name = JobState.normalize(name);
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static StateChange of(String name, String reason) {
        return new StateChange(name, reason, Map.of());
    }

    public static StateChange of(JobState state, String reason, Map<String, String> data) {
        return new StateChange(state.getValue(), reason, data);
    }

    /**
     * 큐 등록 상태 변경.
     *
     * @param queue 큐 이름
     * @param enqueuedAt 등록 시각
     * @param reason 사유
     * @return enqueued 상태 변경
     */
    public static StateChange enqueued(String queue, Instant enqueuedAt, String reason) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put(QUEUE_KEY, queue);
        data.put(ENQUEUED_AT_KEY, enqueuedAt.toString());
        return new StateChange(JobState.ENQUEUED.getValue(), reason, data);
    }

    public boolean is(JobState state) {
        return state.getValue().equals(name);
    }
}
