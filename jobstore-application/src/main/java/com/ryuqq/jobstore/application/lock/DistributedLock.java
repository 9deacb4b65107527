package com.ryuqq.jobstore.application.lock;

import com.ryuqq.jobstore.application.storage.StorageContext;
import com.ryuqq.jobstore.core.document.DocumentKind;
import com.ryuqq.jobstore.core.document.LockDocument;
import com.ryuqq.jobstore.core.spi.DocumentConflictException;
import com.ryuqq.jobstore.core.spi.DocumentNotFoundException;
import com.ryuqq.jobstore.core.spi.DocumentPreconditionFailedException;
import com.ryuqq.jobstore.core.spi.DocumentStoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 문서 기반 분산 락.
 *
 * <p><strong>획득:</strong> 리소스별 고정 ID({@code lock:{resource}})의 문서 생성이 성공하면 획득입니다.
 * 이미 있으면 만료 여부를 확인해 만료된 락만 제거하고 한 번 더 시도합니다.</p>
 *
 * <p>소유자 값은 획득 시도마다 고유합니다. 생성이 반영된 뒤 응답만 실패해 재시도가 충돌로 끝나면,
 * 저장된 락의 소유자가 이번 시도와 같은지 확인해 획득으로 처리합니다.</p>
 *
 * <p><strong>해제:</strong> 마지막으로 본 etag가 일치할 때만 삭제합니다. etag가 달라졌으면 다시 읽어
 * 소유자가 여전히 자신일 때만 삭제하므로, 만료 후 다른 소유자가 얻은 락을 지우지 않습니다.
 * 해제 실패는 WARN 로그만 남기며 락은 만료로 정리됩니다.</p>
 *
 * <p><strong>갱신:</strong> 갱신 스케줄러가 주어지면 {@code renewalInterval}마다 만료 시각을 연장합니다.
 * 갱신과 해제는 같은 모니터에서 실행되므로 해제 이후에는 갱신이 저장소에 쓰지 않습니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class DistributedLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DistributedLock.class);

    private final StorageContext context;
    private final String resource;
    private final String owner;
    private final Duration timeout;

    private volatile LockDocument held;
    private volatile boolean released;
    private ScheduledFuture<?> renewal;

    private DistributedLock(StorageContext context, String resource, String owner, Duration timeout,
                            LockDocument held) {
        this.context = context;
        this.resource = resource;
        this.owner = owner;
        this.timeout = timeout;
        this.held = held;
    }

    /**
     * 락 획득.
     *
     * @param context 저장소 컨텍스트
     * @param resource 리소스 이름
     * @param timeout 락 유효 시간
     * @param renewalScheduler 갱신 스케줄러 (null이면 갱신 안 함)
     * @param renewalInterval 갱신 주기
     * @return 획득한 락
     * @throws LockUnavailableException 다른 소유자가 유효한 락을 보유 중인 경우
     */
    public static DistributedLock acquire(StorageContext context, String resource, Duration timeout,
                                          ScheduledExecutorService renewalScheduler, Duration renewalInterval) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource cannot be null or blank");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        String owner = context.options().instanceName() + ":" + UUID.randomUUID();

        LockDocument held = tryCreate(context, resource, owner, timeout)
            .orElseGet(() -> takeOverExpired(context, resource, owner, timeout));

        DistributedLock lock = new DistributedLock(context, resource, owner, timeout, held);
        if (renewalScheduler != null && renewalInterval != null && !renewalInterval.isZero()) {
            lock.scheduleRenewal(renewalScheduler, renewalInterval);
        }
        log.debug("Acquired lock on '{}' (owner: {}, timeout: {})", resource, owner, timeout);
        return lock;
    }

    private static Optional<LockDocument> tryCreate(StorageContext context, String resource, String owner,
                                                    Duration timeout) {
        Instant now = context.now();
        LockDocument lock = new LockDocument(resource, owner);
        lock.setAcquiredAt(now);
        lock.setTimeout(timeout);
        lock.setExpireAt(now.plus(timeout));
        try {
            return Optional.of(context.create(lock));
        } catch (DocumentConflictException e) {
            return adoptLanded(context, resource, owner);
        } catch (DocumentStoreException e) {
            if (!e.isTransient()) {
                throw e;
            }
            Optional<LockDocument> owned = adoptLanded(context, resource, owner);
            if (owned.isEmpty()) {
                throw e;
            }
            return owned;
        }
    }

    private static Optional<LockDocument> adoptLanded(StorageContext context, String resource, String owner) {
        Optional<LockDocument> owned = findOwned(context, resource, owner);
        owned.ifPresent(current ->
            log.info("Lock on '{}' was created before its response failed, keeping it (owner: {})", resource, owner));
        return owned;
    }

    private static Optional<LockDocument> findOwned(StorageContext context, String resource, String owner) {
        return context.read(DocumentKind.LOCK, LockDocument.class, LockDocument.idFor(resource), null)
            .filter(current -> owner.equals(current.getOwner()));
    }

    private static LockDocument takeOverExpired(StorageContext context, String resource, String owner,
                                                Duration timeout) {
        Optional<LockDocument> existing = context.read(DocumentKind.LOCK, LockDocument.class,
            LockDocument.idFor(resource), null);

        if (existing.isPresent()) {
            LockDocument current = existing.get();
            if (!current.isExpiredAt(context.now())) {
                throw new LockUnavailableException(resource, current.getOwner(), current.getExpireAt());
            }
            try {
                context.deleteIfMatch(current);
            } catch (DocumentPreconditionFailedException e) {
                throw new LockUnavailableException(resource, "unknown", null);
            }
            log.info("Removed expired lock on '{}' held by {}", resource, current.getOwner());
        }

        return tryCreate(context, resource, owner, timeout).orElseThrow(() -> {
            LockDocument winner = context.read(DocumentKind.LOCK, LockDocument.class,
                LockDocument.idFor(resource), null).orElse(null);
            return new LockUnavailableException(resource,
                winner == null ? "unknown" : winner.getOwner(),
                winner == null ? null : winner.getExpireAt());
        });
    }

    private synchronized void scheduleRenewal(ScheduledExecutorService scheduler, Duration interval) {
        long periodMs = interval.toMillis();
        renewal = scheduler.scheduleAtFixedRate(this::renew, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * 만료 시각 연장.
     *
     * @return 연장에 성공했으면 true, 락을 잃었으면 false
     */
    public synchronized boolean renew() {
        if (released) {
            return false;
        }
        LockDocument current = held;
        Instant now = context.now();
        current.setExpireAt(now.plus(timeout));
        try {
            held = context.replace(current);
            log.debug("Renewed lock on '{}' until {}", resource, held.getExpireAt());
            return true;
        } catch (DocumentPreconditionFailedException | DocumentNotFoundException e) {
            Optional<LockDocument> owned = findOwned(context, resource, owner);
            if (owned.isPresent()) {
                held = owned.get();
                return true;
            }
            log.warn("Lock on '{}' was lost before renewal (owner: {})", resource, owner);
            cancelRenewal();
            return false;
        } catch (DocumentStoreException e) {
            log.warn("Failed to renew lock on '{}', will retry on next interval", resource, e);
            return false;
        }
    }

    public String getResource() {
        return resource;
    }

    public String getOwner() {
        return owner;
    }

    public Instant getExpiresAt() {
        return held.getExpireAt();
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * 락 해제 (멱등).
     */
    public synchronized void release() {
        if (released) {
            return;
        }
        released = true;
        cancelRenewal();
        try {
            context.deleteIfMatch(held);
            log.debug("Released lock on '{}'", resource);
        } catch (DocumentPreconditionFailedException e) {
            releaseIfStillOwned();
        } catch (RuntimeException e) {
            log.warn("Failed to release lock on '{}', it will expire at {}", resource, held.getExpireAt(), e);
        }
    }

    private void releaseIfStillOwned() {
        try {
            Optional<LockDocument> owned = findOwned(context, resource, owner);
            if (owned.isEmpty()) {
                log.warn("Lock on '{}' is now held by another owner, skipping release", resource);
                return;
            }
            context.deleteIfMatch(owned.get());
            log.debug("Released lock on '{}' after refreshing its etag", resource);
        } catch (RuntimeException e) {
            log.warn("Failed to release lock on '{}', it will expire at {}", resource, held.getExpireAt(), e);
        }
    }

    @Override
    public void close() {
        release();
    }

    private synchronized void cancelRenewal() {
        if (renewal != null) {
            renewal.cancel(false);
            renewal = null;
        }
    }
}
