package com.ryuqq.jobstore.application.lock;

import java.time.Instant;

/**
 * 다른 소유자가 유효한 락을 보유 중인 경우.
 *
 * <p>자동으로 재시도하지 않습니다. 호출자가 재시도 여부를 결정합니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class LockUnavailableException extends RuntimeException {

    private final String resource;
    private final String owner;
    private final Instant expiresAt;

    public LockUnavailableException(String resource, String owner, Instant expiresAt) {
        super("Lock on '" + resource + "' is held by " + owner + " until " + expiresAt);
        this.resource = resource;
        this.owner = owner;
        this.expiresAt = expiresAt;
    }

    public String getResource() {
        return resource;
    }

    public String getOwner() {
        return owner;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
