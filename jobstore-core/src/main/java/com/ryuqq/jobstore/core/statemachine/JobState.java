package com.ryuqq.jobstore.core.statemachine;

import java.util.Locale;
import java.util.Optional;

/**
 * Job의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED
 *    │
 *    ▼ (큐 등록)
 * ENQUEUED ◄────────────┐
 *    │                  │ (requeue / 재시도)
 *    ▼ (fetch)          │
 * PROCESSING ───────────┤
 *    │                  │
 *    ├─► SUCCEEDED      │
 *    ├─► FAILED ────────┤
 *    └─► SCHEDULED ─────┘
 *
 * 모든 상태 → DELETED
 * </pre>
 *
 * <p>저장되는 값은 {@link #getValue()}의 소문자 이름입니다.
 * 외부 프레임워크가 정의한 사용자 상태 이름도 저장할 수 있으며, 이 경우 enum으로 매핑되지 않습니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public enum JobState {

    /**
     * 생성됨 (아직 큐에 없음).
     */
    CREATED("created"),

    /**
     * 큐에 등록되어 fetch 대기 중.
     */
    ENQUEUED("enqueued"),

    /**
     * 지정 시각 이후 실행 예정.
     */
    SCHEDULED("scheduled"),

    /**
     * 워커가 가져가서 실행 중.
     */
    PROCESSING("processing"),

    /**
     * 성공.
     */
    SUCCEEDED("succeeded"),

    /**
     * 실패.
     */
    FAILED("failed"),

    /**
     * 삭제됨.
     */
    DELETED("deleted");

    private final String value;

    JobState(String value) {
        this.value = value;
    }

    /**
     * 저장 값 조회.
     *
     * @return 소문자 상태 이름
     */
    public String getValue() {
        return value;
    }

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태에 대한 추가 변경을 막지는 않습니다. 호출자가 멈춰야 합니다.</p>
     *
     * @return SUCCEEDED, FAILED, DELETED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == DELETED;
    }

    /**
     * 상태 이름으로 조회 (대소문자 무시).
     *
     * @param name 상태 이름
     * @return 매핑되는 상태, 사용자 상태이면 empty
     */
    public static Optional<JobState> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (JobState state : values()) {
            if (state.value.equalsIgnoreCase(name)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }

    /**
     * 저장용 상태 이름으로 정규화.
     *
     * @param name 상태 이름
     * @return 소문자 상태 이름
     * @throws IllegalArgumentException name이 null 또는 공백인 경우
     */
    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("State name cannot be null or blank");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
