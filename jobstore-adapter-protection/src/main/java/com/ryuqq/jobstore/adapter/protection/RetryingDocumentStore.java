package com.ryuqq.jobstore.adapter.protection;

import com.ryuqq.jobstore.core.document.BaseDocument;
import com.ryuqq.jobstore.core.protection.BackoffCalculator;
import com.ryuqq.jobstore.core.spi.DocumentPage;
import com.ryuqq.jobstore.core.spi.DocumentQuery;
import com.ryuqq.jobstore.core.spi.DocumentStore;
import com.ryuqq.jobstore.core.spi.DocumentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * 일시적 저장소 오류를 재시도하는 {@link DocumentStore} 데코레이터.
 *
 * <p>{@link DocumentStoreException#isTransient()}가 true인 예외만 재시도하며,
 * 충돌과 etag 불일치, Circuit OPEN은 그대로 전파합니다. 재시도 간격은
 * {@link BackoffCalculator}가 정합니다.</p>
 *
 * <p>{@link ResilientDocumentStore} 바깥에 두면 각 시도가 Circuit Breaker에 개별 기록되고,
 * Circuit이 열리면 남은 재시도 없이 즉시 실패합니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class RetryingDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(RetryingDocumentStore.class);

    private final DocumentStore delegate;
    private final int maxRetryAttempts;
    private final BackoffCalculator backoffCalculator;

    public RetryingDocumentStore(DocumentStore delegate, int maxRetryAttempts, BackoffCalculator backoffCalculator) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (maxRetryAttempts < 0) {
            throw new IllegalArgumentException("maxRetryAttempts cannot be negative: " + maxRetryAttempts);
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.delegate = delegate;
        this.maxRetryAttempts = maxRetryAttempts;
        this.backoffCalculator = backoffCalculator;
    }

    @Override
    public <T extends BaseDocument> Optional<T> get(String collection, String id, String partitionKey, Class<T> type) {
        return withRetry("get", () -> delegate.get(collection, id, partitionKey, type));
    }

    @Override
    public <T extends BaseDocument> T create(String collection, T document) {
        return withRetry("create", () -> delegate.create(collection, document));
    }

    @Override
    public <T extends BaseDocument> T upsert(String collection, T document) {
        return withRetry("upsert", () -> delegate.upsert(collection, document));
    }

    @Override
    public <T extends BaseDocument> T replace(String collection, T document) {
        return withRetry("replace", () -> delegate.replace(collection, document));
    }

    @Override
    public void delete(String collection, String id, String partitionKey, String ifMatchEtag) {
        withRetry("delete", () -> {
            delegate.delete(collection, id, partitionKey, ifMatchEtag);
            return null;
        });
    }

    @Override
    public <T extends BaseDocument> DocumentPage<T> query(String collection, DocumentQuery query, String partitionKey,
                                                          Class<T> type, String continuationToken, int pageSize) {
        return withRetry("query", () -> delegate.query(collection, query, partitionKey, type, continuationToken, pageSize));
    }

    private <R> R withRetry(String operation, Supplier<R> call) {
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (DocumentStoreException e) {
                if (!e.isTransient() || attempt >= maxRetryAttempts) {
                    throw e;
                }
                attempt++;
                long delayMs = backoffCalculator.calculate(attempt);
                log.debug("Transient failure on {} (attempt {}/{}), retrying in {} ms: {}",
                    operation, attempt, maxRetryAttempts, delayMs, e.getMessage());
                sleep(delayMs, e);
            }
        }
    }

    private static void sleep(long delayMs, DocumentStoreException lastFailure) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while backing off");
            cancelled.initCause(lastFailure);
            throw cancelled;
        }
    }
}
