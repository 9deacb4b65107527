package com.ryuqq.jobstore.core.document;

import java.time.Instant;

/**
 * Denormalized view of a queue. Not authoritative: job documents queried by state are.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class QueueDocument extends BaseDocument {

    private String queueName;
    private long length;
    private long fetched;
    private Instant lastUpdated;

    public QueueDocument() {
    }

    public QueueDocument(String queueName) {
        setQueueName(queueName);
    }

    public static String idFor(String queueName) {
        return "queue:" + queueName;
    }

    @Override
    public DocumentKind kind() {
        return DocumentKind.QUEUE;
    }

    @Override
    public String partitionScope() {
        return null;
    }

    public String getQueueName() {
        return queueName;
    }

    public void setQueueName(String queueName) {
        this.queueName = queueName;
        setId(queueName == null ? null : idFor(queueName));
    }

    public long getLength() {
        return length;
    }

    public void setLength(long length) {
        this.length = length;
    }

    public long getFetched() {
        return fetched;
    }

    public void setFetched(long fetched) {
        this.fetched = fetched;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }
}
