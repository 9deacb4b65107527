package com.ryuqq.jobstore.application.lifecycle;

/**
 * 동시 수정 충돌이 재시도 한도를 넘은 경우.
 *
 * <p>일시적인 상황이므로 호출자가 전체 작업을 다시 시도할 수 있습니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class JobUpdateConflictException extends RuntimeException {

    private final String jobId;
    private final int attempts;

    public JobUpdateConflictException(String jobId, int attempts, Throwable cause) {
        super("Job " + jobId + " was modified concurrently " + attempts + " times in a row", cause);
        this.jobId = jobId;
        this.attempts = attempts;
    }

    public String getJobId() {
        return jobId;
    }

    public int getAttempts() {
        return attempts;
    }
}
