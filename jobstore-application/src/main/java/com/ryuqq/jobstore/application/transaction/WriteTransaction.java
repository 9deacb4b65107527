package com.ryuqq.jobstore.application.transaction;

import com.ryuqq.jobstore.application.collections.KeyedCollections;
import com.ryuqq.jobstore.application.lifecycle.JobRepository;
import com.ryuqq.jobstore.application.lifecycle.JobTransitions;
import com.ryuqq.jobstore.application.lifecycle.StateChange;
import com.ryuqq.jobstore.application.storage.StorageContext;
import com.ryuqq.jobstore.core.document.DocumentKind;
import com.ryuqq.jobstore.core.document.JobDocument;
import com.ryuqq.jobstore.core.document.QueueDocument;
import com.ryuqq.jobstore.core.model.JobIds;
import com.ryuqq.jobstore.core.statemachine.JobState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 쓰기 작업 묶음.
 *
 * <p>작업을 모아 두었다가 {@link #commit()} 시 등록 순서대로 실행합니다.
 * <strong>원자적이지 않습니다:</strong> 중간 작업이 실패하면 이후 작업은 실행되지 않고
 * 이미 적용된 작업은 되돌리지 않습니다. 실패 예외는 그대로 전파됩니다.</p>
 *
 * <p>commit 또는 close 이후에는 작업 추가와 재commit이 {@link IllegalStateException}으로 거부됩니다.
 * commit 없이 close하면 모아 둔 작업은 버려집니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class WriteTransaction implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WriteTransaction.class);

    private final StorageContext context;
    private final JobRepository jobs;
    private final KeyedCollections collections;
    private final List<QueuedOperation> operations = new ArrayList<>();
    private boolean completed;

    public WriteTransaction(StorageContext context, JobRepository jobs, KeyedCollections collections) {
        this.context = context;
        this.jobs = jobs;
        this.collections = collections;
    }

    // ===== Jobs =====

    public void expireJob(String jobId, Duration expireIn) {
        JobIds.require(jobId);
        requirePositive(expireIn, "expireIn");
        enqueue("expireJob " + jobId, () -> jobs.setExpiration(jobId, context.now().plus(expireIn)));
    }

    public void persistJob(String jobId) {
        JobIds.require(jobId);
        enqueue("persistJob " + jobId, () -> jobs.setExpiration(jobId, null));
    }

    /**
     * 상태 전환 (상태, 상태 데이터, 이력 갱신).
     *
     * @param jobId Job ID
     * @param change 새 상태
     */
    public void setJobState(String jobId, StateChange change) {
        JobIds.require(jobId);
        requireChange(change);
        enqueue("setJobState " + jobId + " -> " + change.name(),
            () -> jobs.mutate(jobId, job -> JobTransitions.apply(job, change, context.now())));
    }

    /**
     * 이력 추가 (상태와 이력만 갱신, 상태 데이터 유지).
     *
     * @param jobId Job ID
     * @param change 추가할 상태
     */
    public void addJobState(String jobId, StateChange change) {
        JobIds.require(jobId);
        requireChange(change);
        enqueue("addJobState " + jobId + " -> " + change.name(),
            () -> jobs.mutate(jobId, job -> JobTransitions.record(job, change, context.now())));
    }

    /**
     * 큐에 등록. 다른 큐에 있던 Job은 대상 큐 파티션으로 옮겨집니다.
     *
     * @param queue 큐 이름
     * @param jobId Job ID
     */
    public void addToQueue(String queue, String jobId) {
        JobIds.require(jobId);
        String targetQueue = queue == null || queue.isBlank() ? JobDocument.DEFAULT_QUEUE : queue;
        enqueue("addToQueue " + targetQueue + " " + jobId, () -> {
            jobs.moveToQueue(jobId, targetQueue, job -> markEnqueued(job, targetQueue));
            refreshQueue(targetQueue);
        });
    }

    // ===== Counters =====

    public void incrementCounter(String key) {
        adjustCounter(key, 1, null);
    }

    public void incrementCounter(String key, Duration expireIn) {
        requirePositive(expireIn, "expireIn");
        adjustCounter(key, 1, expireIn);
    }

    public void decrementCounter(String key) {
        adjustCounter(key, -1, null);
    }

    public void decrementCounter(String key, Duration expireIn) {
        requirePositive(expireIn, "expireIn");
        adjustCounter(key, -1, expireIn);
    }

    // ===== Sets =====

    /**
     * 현재 Unix 초를 점수로 추가.
     */
    public void addToSet(String key, String value) {
        addToSet(key, value, context.now().getEpochSecond());
    }

    public void addToSet(String key, String value, double score) {
        requireKey(key);
        enqueue("addToSet " + key, () -> collections.addToSet(key, value, score));
    }

    public void addRangeToSet(String key, List<String> values) {
        requireKey(key);
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        List<String> copy = List.copyOf(values);
        enqueue("addRangeToSet " + key + " (" + copy.size() + ")", () -> {
            for (String value : copy) {
                collections.addToSet(key, value, 0.0);
            }
        });
    }

    public void removeFromSet(String key, String value) {
        requireKey(key);
        enqueue("removeFromSet " + key, () -> collections.removeFromSet(key, value));
    }

    public void removeSet(String key) {
        requireKey(key);
        enqueue("removeSet " + key, () -> collections.removeSet(key));
    }

    public void expireSet(String key, Duration expireIn) {
        expireCollection(DocumentKind.SET, key, expireIn);
    }

    public void persistSet(String key) {
        persistCollection(DocumentKind.SET, key);
    }

    // ===== Lists =====

    public void insertToList(String key, String value) {
        requireKey(key);
        enqueue("insertToList " + key, () -> collections.insertToList(key, value));
    }

    public void removeFromList(String key, String value) {
        requireKey(key);
        enqueue("removeFromList " + key, () -> collections.removeFromList(key, value));
    }

    public void trimList(String key, int keepStartingFrom, int keepEndingAt) {
        requireKey(key);
        enqueue("trimList " + key + " [" + keepStartingFrom + ".." + keepEndingAt + "]",
            () -> collections.trimList(key, keepStartingFrom, keepEndingAt));
    }

    public void expireList(String key, Duration expireIn) {
        expireCollection(DocumentKind.LIST, key, expireIn);
    }

    public void persistList(String key) {
        persistCollection(DocumentKind.LIST, key);
    }

    // ===== Hashes =====

    public void setRangeInHash(String key, Map<String, String> entries) {
        requireKey(key);
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        Map<String, String> copy = new LinkedHashMap<>(entries);
        enqueue("setRangeInHash " + key + " (" + copy.size() + ")", () -> collections.setRangeInHash(key, copy));
    }

    public void removeHash(String key) {
        requireKey(key);
        enqueue("removeHash " + key, () -> collections.removeHash(key));
    }

    public void expireHash(String key, Duration expireIn) {
        expireCollection(DocumentKind.HASH, key, expireIn);
    }

    public void persistHash(String key) {
        persistCollection(DocumentKind.HASH, key);
    }

    // ===== Lifecycle =====

    public int operationCount() {
        return operations.size();
    }

    /**
     * 등록 순서대로 실행.
     *
     * @throws IllegalStateException 이미 commit 또는 close된 경우
     * @throws RuntimeException 실패한 작업의 예외 (이전 작업은 적용된 상태)
     */
    public void commit() {
        ensureOpen();
        completed = true;
        int total = operations.size();
        log.debug("Committing write transaction with {} operations", total);

        for (int i = 0; i < total; i++) {
            QueuedOperation operation = operations.get(i);
            try {
                operation.action().run();
            } catch (RuntimeException e) {
                log.warn("Write transaction stopped at operation {}/{} ({}), {} operations were applied",
                    i + 1, total, operation.description(), i);
                throw e;
            }
        }
    }

    @Override
    public void close() {
        if (!completed && !operations.isEmpty()) {
            log.debug("Discarding {} uncommitted operations", operations.size());
        }
        completed = true;
        operations.clear();
    }

    private void adjustCounter(String key, long delta, Duration expireIn) {
        requireKey(key);
        enqueue((delta > 0 ? "incrementCounter " : "decrementCounter ") + key,
            () -> collections.adjustCounter(key, delta, expireIn));
    }

    private void expireCollection(DocumentKind kind, String key, Duration expireIn) {
        requireKey(key);
        requirePositive(expireIn, "expireIn");
        enqueue("expire " + kind.getValue() + " " + key,
            () -> collections.setExpiration(kind, key, context.now().plus(expireIn)));
    }

    private void persistCollection(DocumentKind kind, String key) {
        requireKey(key);
        enqueue("persist " + kind.getValue() + " " + key, () -> collections.setExpiration(kind, key, null));
    }

    private void markEnqueued(JobDocument job, String queue) {
        Instant now = context.now();
        StateChange enqueued = StateChange.enqueued(queue, now, "Enqueued");
        if (JobState.ENQUEUED.getValue().equals(job.getState())) {
            // setJobState가 이미 이력을 남긴 경우 상태 데이터만 맞춤
            job.getStateData().put(StateChange.QUEUE_KEY, queue);
            job.getStateData().put(StateChange.ENQUEUED_AT_KEY, now.toString());
        } else {
            JobTransitions.apply(job, enqueued, now);
        }
    }

    private void refreshQueue(String queue) {
        QueueDocument summary = new QueueDocument(queue);
        summary.setLength(jobs.countInQueue(queue, JobState.ENQUEUED));
        summary.setFetched(jobs.countInQueue(queue, JobState.PROCESSING));
        summary.setLastUpdated(context.now());
        context.upsert(summary);
    }

    private void enqueue(String description, Runnable action) {
        ensureOpen();
        operations.add(new QueuedOperation(description, action));
    }

    private void ensureOpen() {
        if (completed) {
            throw new IllegalStateException("Write transaction was already committed or closed");
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }

    private static void requireChange(StateChange change) {
        if (change == null) {
            throw new IllegalArgumentException("state change cannot be null");
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + duration + ")");
        }
    }

    private record QueuedOperation(String description, Runnable action) {
    }
}
