package com.ryuqq.jobstore.core.document;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A background job and its lifecycle.
 *
 * <p>Partitioned by queue ({@code job:{queueName}}), so the oldest enqueued job of a
 * queue is found with a single-partition ordered query. {@code stateHistory} only grows;
 * once it has entries, {@code state} equals the state of the last one.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class JobDocument extends BaseDocument {

    /** Queue used when a job does not name one. */
    public static final String DEFAULT_QUEUE = "default";

    private String jobId;
    private String queueName = DEFAULT_QUEUE;
    private String state;
    private Map<String, String> stateData = new LinkedHashMap<>();
    private List<StateHistoryEntry> stateHistory = new ArrayList<>();
    private InvocationData invocationData;
    private Map<String, String> parameters = new LinkedHashMap<>();
    private Instant createdAt;
    private Instant updatedAt;

    public JobDocument() {
    }

    public JobDocument(String jobId, String queueName) {
        setJobId(jobId);
        this.queueName = queueName == null || queueName.isBlank() ? DEFAULT_QUEUE : queueName;
    }

    /**
     * Document id for a job id.
     *
     * @param jobId job id
     * @return {@code job:{jobId}}
     */
    public static String idFor(String jobId) {
        return "job:" + jobId;
    }

    @Override
    public DocumentKind kind() {
        return DocumentKind.JOB;
    }

    @Override
    public String partitionScope() {
        return queueName;
    }

    /**
     * Appends a history entry and makes its state the current state.
     *
     * @param entry new entry
     */
    public void appendHistory(StateHistoryEntry entry) {
        stateHistory.add(entry);
        this.state = entry.getState();
    }

    /**
     * @return the newest history entry, or null when the history is empty
     */
    @JsonIgnore
    public StateHistoryEntry getLastHistoryEntry() {
        return stateHistory.isEmpty() ? null : stateHistory.get(stateHistory.size() - 1);
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
        setId(jobId == null ? null : idFor(jobId));
    }

    public String getQueueName() {
        return queueName;
    }

    public void setQueueName(String queueName) {
        this.queueName = queueName;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public Map<String, String> getStateData() {
        return stateData;
    }

    public void setStateData(Map<String, String> stateData) {
        this.stateData = stateData == null ? new LinkedHashMap<>() : stateData;
    }

    public List<StateHistoryEntry> getStateHistory() {
        return stateHistory;
    }

    public void setStateHistory(List<StateHistoryEntry> stateHistory) {
        this.stateHistory = stateHistory == null ? new ArrayList<>() : stateHistory;
    }

    public InvocationData getInvocationData() {
        return invocationData;
    }

    public void setInvocationData(InvocationData invocationData) {
        this.invocationData = invocationData;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    public void setParameters(Map<String, String> parameters) {
        this.parameters = parameters == null ? new LinkedHashMap<>() : parameters;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
