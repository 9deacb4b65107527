package com.ryuqq.jobstore.testkit.contract;

import com.ryuqq.jobstore.core.document.BaseDocument;
import com.ryuqq.jobstore.core.spi.DocumentPage;
import com.ryuqq.jobstore.core.spi.DocumentQuery;
import com.ryuqq.jobstore.core.spi.DocumentStore;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link DocumentStore} decorator that fails or stalls on demand.
 *
 * <p>Counts every call that reaches it, so tests can assert that a protection layer
 * short-circuited without touching the store.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class FaultInjectingDocumentStore implements DocumentStore {

    private final DocumentStore delegate;
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
    private final AtomicInteger remainingFailures = new AtomicInteger();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile long delayMs;
    private final AtomicInteger remainingStalledWrites = new AtomicInteger();
    private volatile long writeStallMs;

    public FaultInjectingDocumentStore(DocumentStore delegate) {
        this.delegate = delegate;
    }

    /**
     * Fails every following call with {@code error} until {@link #heal()}.
     */
    public void failWith(RuntimeException error) {
        failWith(error, Integer.MAX_VALUE);
    }

    /**
     * Fails the next {@code times} calls with {@code error}.
     */
    public void failWith(RuntimeException error, int times) {
        failure.set(error);
        remainingFailures.set(times);
    }

    /**
     * Delays every following call.
     */
    public void delayBy(long millis) {
        this.delayMs = millis;
    }

    /**
     * Applies the next {@code times} writes, then holds their responses for {@code millis}.
     *
     * <p>Models a store that commits a write whose reply is lost to a client timeout.</p>
     */
    public void stallAfterWrites(long millis, int times) {
        writeStallMs = millis;
        remainingStalledWrites.set(times);
    }

    public void heal() {
        failure.set(null);
        remainingFailures.set(0);
        delayMs = 0;
        remainingStalledWrites.set(0);
        writeStallMs = 0;
    }

    public int callCount() {
        return calls.get();
    }

    public void resetCallCount() {
        calls.set(0);
    }

    @Override
    public <T extends BaseDocument> Optional<T> get(String collection, String id, String partitionKey, Class<T> type) {
        beforeCall();
        return delegate.get(collection, id, partitionKey, type);
    }

    @Override
    public <T extends BaseDocument> T create(String collection, T document) {
        beforeCall();
        return afterWrite(delegate.create(collection, document));
    }

    @Override
    public <T extends BaseDocument> T upsert(String collection, T document) {
        beforeCall();
        return afterWrite(delegate.upsert(collection, document));
    }

    @Override
    public <T extends BaseDocument> T replace(String collection, T document) {
        beforeCall();
        return afterWrite(delegate.replace(collection, document));
    }

    @Override
    public void delete(String collection, String id, String partitionKey, String ifMatchEtag) {
        beforeCall();
        delegate.delete(collection, id, partitionKey, ifMatchEtag);
        afterWrite(null);
    }

    @Override
    public <T extends BaseDocument> DocumentPage<T> query(String collection, DocumentQuery query, String partitionKey,
                                                          Class<T> type, String continuationToken, int pageSize) {
        beforeCall();
        return delegate.query(collection, query, partitionKey, type, continuationToken, pageSize);
    }

    private void beforeCall() {
        calls.incrementAndGet();
        long delay = delayMs;
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while injecting delay", e);
            }
        }
        RuntimeException error = failure.get();
        if (error != null && remainingFailures.getAndDecrement() > 0) {
            throw error;
        }
    }

    private <T> T afterWrite(T result) {
        if (remainingStalledWrites.getAndUpdate(left -> left > 0 ? left - 1 : 0) <= 0) {
            return result;
        }
        try {
            Thread.sleep(writeStallMs);
        } catch (InterruptedException e) {
            // the caller already gave up on this reply; the write itself stays applied
            Thread.currentThread().interrupt();
        }
        return result;
    }
}
