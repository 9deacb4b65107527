package com.ryuqq.jobstore.application.lifecycle;

import com.ryuqq.jobstore.core.document.JobDocument;
import com.ryuqq.jobstore.core.document.StateHistoryEntry;
import com.ryuqq.jobstore.core.statemachine.JobStateTransition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;

/**
 * Job 문서에 상태 변경을 적용하는 유틸리티.
 *
 * <p>전이 규칙에 어긋나는 변경도 적용하며 WARN 로그만 남깁니다.
 * 상태 전이의 최종 판단은 외부 프레임워크의 몫입니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class JobTransitions {

    private static final Logger log = LoggerFactory.getLogger(JobTransitions.class);

    // Utility class - prevent instantiation
    private JobTransitions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전환: 현재 상태, 상태 데이터, 이력을 모두 갱신.
     *
     * @param job 대상 Job
     * @param change 상태 변경
     * @param now 현재 시각
     */
    public static void apply(JobDocument job, StateChange change, Instant now) {
        warnIfUnexpected(job, change);
        job.setStateData(new LinkedHashMap<>(change.data()));
        job.appendHistory(entry(change, now));
    }

    /**
     * 이력 추가: 이력과 현재 상태만 갱신하고 상태 데이터는 유지.
     *
     * @param job 대상 Job
     * @param change 상태 변경
     * @param now 현재 시각
     */
    public static void record(JobDocument job, StateChange change, Instant now) {
        warnIfUnexpected(job, change);
        job.appendHistory(entry(change, now));
    }

    private static StateHistoryEntry entry(StateChange change, Instant now) {
        return new StateHistoryEntry(change.name(), change.reason(), now, new LinkedHashMap<>(change.data()));
    }

    private static void warnIfUnexpected(JobDocument job, StateChange change) {
        if (!JobStateTransition.isExpected(job.getState(), change.name())) {
            log.warn("Unexpected state transition for job {}: {} -> {} (reason: {})",
                job.getJobId(), job.getState(), change.name(), change.reason());
        }
    }
}
