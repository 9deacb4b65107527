package com.ryuqq.jobstore.application.lifecycle;

import com.ryuqq.jobstore.core.document.JobDocument;
import com.ryuqq.jobstore.core.document.StateHistoryEntry;
import com.ryuqq.jobstore.core.statemachine.JobState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JobTransitions와 StateChange 유닛 테스트.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class JobTransitionsTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private JobDocument enqueuedJob() {
        JobDocument job = new JobDocument("job-1", "default");
        job.appendHistory(new StateHistoryEntry("enqueued", null, NOW, Map.of()));
        job.setStateData(new LinkedHashMap<>(Map.of("Queue", "default")));
        return job;
    }

    @Test
    void apply는_현재_상태와_데이터를_바꾸고_이력을_추가함() {
        // given
        JobDocument job = enqueuedJob();
        StateChange change = StateChange.of(JobState.PROCESSING, "fetched", Map.of("ServerId", "server-1"));

        // when
        JobTransitions.apply(job, change, NOW.plusSeconds(1));

        // then
        assertThat(job.getState()).isEqualTo("processing");
        assertThat(job.getStateData()).containsExactly(Map.entry("ServerId", "server-1"));
        assertThat(job.getStateHistory()).hasSize(2);
        assertThat(job.getLastHistoryEntry().getReason()).isEqualTo("fetched");
        assertThat(job.getLastHistoryEntry().getCreatedAt()).isEqualTo(NOW.plusSeconds(1));
    }

    @Test
    void record는_데이터를_그대로_두고_이력만_추가함() {
        // given
        JobDocument job = enqueuedJob();

        // when
        JobTransitions.record(job, StateChange.of("Processing", "observed"), NOW);

        // then
        assertThat(job.getState()).isEqualTo("processing");
        assertThat(job.getStateData()).containsEntry("Queue", "default");
    }

    @Test
    void 예상하지_않은_전이도_적용됨() {
        // given
        JobDocument job = enqueuedJob();
        JobTransitions.apply(job, StateChange.of("succeeded", null), NOW);

        // when
        JobTransitions.apply(job, StateChange.of("processing", "replayed"), NOW);

        // then
        assertThat(job.getState()).isEqualTo("processing");
    }

    @Test
    void StateChange는_이름을_소문자로_정규화함() {
        StateChange change = StateChange.enqueued("critical", NOW, "requeued");

        assertThat(StateChange.of(" Succeeded ", null).name()).isEqualTo("succeeded");
        assertThat(change.is(JobState.ENQUEUED)).isTrue();
        assertThat(change.data())
            .containsEntry(StateChange.QUEUE_KEY, "critical")
            .containsEntry(StateChange.ENQUEUED_AT_KEY, "2024-01-01T00:00:00Z");
        assertThat(StateChange.of("custom", null).data()).isEmpty();
        assertThatThrownBy(() -> StateChange.of(" ", null)).isInstanceOf(IllegalArgumentException.class);
    }
}
