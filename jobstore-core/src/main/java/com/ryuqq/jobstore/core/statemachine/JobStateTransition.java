package com.ryuqq.jobstore.core.statemachine;

/**
 * Job 상태 전이 규칙.
 *
 * <p>전이를 거부하지 않습니다. 저장소는 호출자를 신뢰하므로, 이 클래스는 규칙을 벗어난 전이를
 * 판별만 하고 호출 측에서 경고 로그를 남기는 데 사용됩니다.</p>
 *
 * <p><strong>정상 전이:</strong></p>
 * <ul>
 *   <li>CREATED → ENQUEUED, SCHEDULED</li>
 *   <li>ENQUEUED → PROCESSING, SCHEDULED</li>
 *   <li>SCHEDULED → ENQUEUED</li>
 *   <li>PROCESSING → SUCCEEDED, FAILED, SCHEDULED, ENQUEUED (requeue)</li>
 *   <li>SUCCEEDED, FAILED, DELETED → ENQUEUED (수동 재실행)</li>
 *   <li>FAILED → SCHEDULED (재시도)</li>
 *   <li>모든 상태 → DELETED, 같은 상태로의 전이</li>
 * </ul>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class JobStateTransition {

    // Utility class - prevent instantiation
    private JobStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 정상 전이인지 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 규칙에 맞으면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isExpected(JobState from, JobState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from == to || to == JobState.DELETED) {
            return true;
        }

        return switch (from) {
            case CREATED -> to == JobState.ENQUEUED || to == JobState.SCHEDULED;
            case ENQUEUED -> to == JobState.PROCESSING || to == JobState.SCHEDULED;
            case SCHEDULED -> to == JobState.ENQUEUED;
            case PROCESSING -> to == JobState.SUCCEEDED || to == JobState.FAILED
                || to == JobState.SCHEDULED || to == JobState.ENQUEUED;
            case FAILED -> to == JobState.ENQUEUED || to == JobState.SCHEDULED;
            case SUCCEEDED, DELETED -> to == JobState.ENQUEUED;
        };
    }

    /**
     * 저장된 상태 이름 간 전이가 정상인지 확인.
     *
     * <p>어느 한쪽이 사용자 상태이거나 현재 상태가 없으면 판단하지 않고 true를 반환합니다.</p>
     *
     * @param from 현재 상태 이름 (nullable)
     * @param to 전이할 상태 이름
     * @return 규칙에 맞거나 판단 불가이면 true
     */
    public static boolean isExpected(String from, String to) {
        if (from == null) {
            return true;
        }
        return JobState.find(from)
            .flatMap(f -> JobState.find(to).map(t -> isExpected(f, t)))
            .orElse(true);
    }
}
