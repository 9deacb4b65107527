package com.ryuqq.jobstore.core.document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a job's append-only state history.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class StateHistoryEntry {

    private String state;
    private String reason;
    private Instant createdAt;
    private Map<String, String> data = new LinkedHashMap<>();

    public StateHistoryEntry() {
    }

    public StateHistoryEntry(String state, String reason, Instant createdAt, Map<String, String> data) {
        this.state = state;
        this.reason = reason;
        this.createdAt = createdAt;
        this.data = data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data);
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Map<String, String> getData() {
        return data;
    }

    public void setData(Map<String, String> data) {
        this.data = data == null ? new LinkedHashMap<>() : data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateHistoryEntry that = (StateHistoryEntry) o;
        return Objects.equals(state, that.state)
            && Objects.equals(reason, that.reason)
            && Objects.equals(createdAt, that.createdAt)
            && Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, reason, createdAt, data);
    }

    @Override
    public String toString() {
        return "StateHistoryEntry{state='" + state + "', reason='" + reason + "', createdAt=" + createdAt + '}';
    }
}
