package com.ryuqq.jobstore.core.document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Descriptive data of a worker server.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class ServerData {

    private int workerCount;
    private List<String> queues = new ArrayList<>();
    private Instant startedAt;
    private String name;

    public ServerData() {
    }

    public ServerData(int workerCount, List<String> queues, Instant startedAt, String name) {
        this.workerCount = workerCount;
        this.queues = queues == null ? new ArrayList<>() : new ArrayList<>(queues);
        this.startedAt = startedAt;
        this.name = name;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public List<String> getQueues() {
        return queues;
    }

    public void setQueues(List<String> queues) {
        this.queues = queues == null ? new ArrayList<>() : queues;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
