package com.ryuqq.jobstore.adapter.runner;

/**
 * Reaper 리컨실 전략.
 *
 * <p>오래 processing 상태로 남은 Job을 어떻게 처리할지 결정합니다.
 * 워커가 비정상 종료해 핸들을 마무리하지 못한 경우가 대표적입니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public enum ReconcileStrategy {

    /**
     * 다시 큐에 넣어 재실행.
     *
     * <p>Job이 멱등하지 않으면 중복 실행될 수 있습니다.</p>
     */
    RETRY,

    /**
     * 실패로 종결.
     *
     * <p>중복 실행 위험은 없지만 복구 가능한 Job도 수동 재시도가 필요합니다.</p>
     */
    FAIL
}
