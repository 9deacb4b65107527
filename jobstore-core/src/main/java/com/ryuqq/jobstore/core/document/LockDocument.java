package com.ryuqq.jobstore.core.document;

import java.time.Duration;
import java.time.Instant;

/**
 * Lease on a named resource. Exists only while the lease is held.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class LockDocument extends BaseDocument {

    private String resource;
    private String owner;
    private Instant acquiredAt;
    private Duration timeout;

    public LockDocument() {
    }

    public LockDocument(String resource, String owner) {
        setResource(resource);
        this.owner = owner;
    }

    public static String idFor(String resource) {
        return "lock:" + resource;
    }

    @Override
    public DocumentKind kind() {
        return DocumentKind.LOCK;
    }

    @Override
    public String partitionScope() {
        return null;
    }

    public String getResource() {
        return resource;
    }

    public void setResource(String resource) {
        this.resource = resource;
        setId(resource == null ? null : idFor(resource));
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public void setAcquiredAt(Instant acquiredAt) {
        this.acquiredAt = acquiredAt;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
