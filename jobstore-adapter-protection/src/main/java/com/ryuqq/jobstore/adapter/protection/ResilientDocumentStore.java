package com.ryuqq.jobstore.adapter.protection;

import com.ryuqq.jobstore.core.document.BaseDocument;
import com.ryuqq.jobstore.core.protection.CircuitBreaker;
import com.ryuqq.jobstore.core.protection.CircuitBreakerOpenException;
import com.ryuqq.jobstore.core.protection.TimeoutPolicy;
import com.ryuqq.jobstore.core.spi.DocumentPage;
import com.ryuqq.jobstore.core.spi.DocumentQuery;
import com.ryuqq.jobstore.core.spi.DocumentStore;
import com.ryuqq.jobstore.core.spi.DocumentStoreException;
import com.ryuqq.jobstore.core.spi.DocumentStoreTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Circuit Breaker와 호출당 타임아웃을 적용하는 {@link DocumentStore} 데코레이터.
 *
 * <p>호출자에게는 원래 저장소와 같은 입출력을 제공하며, 추가로
 * {@link CircuitBreakerOpenException}과 {@link DocumentStoreTimeoutException}이 발생할 수 있습니다.</p>
 *
 * <p><strong>실패로 기록하는 예외:</strong></p>
 * <ul>
 *   <li>타임아웃, 일시적/영구적 저장소 오류, 그 밖의 RuntimeException</li>
 * </ul>
 *
 * <p><strong>성공으로 기록하는 예외:</strong> 충돌, Not Found, etag 불일치.
 * 정상 동작 중인 저장소의 응답이므로 락 경합이 Circuit을 열지 않습니다.</p>
 *
 * <p>호출자 취소({@link CancellationException})는 기록하지 않습니다.</p>
 *
 * <p><strong>작업 이름:</strong> {@code get-JobDocument}, {@code create-LockDocument},
 * {@code query-SetDocument}, {@code delete}</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class ResilientDocumentStore implements DocumentStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientDocumentStore.class);

    private final DocumentStore delegate;
    private final CircuitBreaker circuitBreaker;
    private final TimeoutPolicy timeoutPolicy;
    private final ExecutorService callExecutor;

    public ResilientDocumentStore(DocumentStore delegate, CircuitBreaker circuitBreaker, TimeoutPolicy timeoutPolicy) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (timeoutPolicy == null) {
            throw new IllegalArgumentException("timeoutPolicy cannot be null");
        }
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
        this.timeoutPolicy = timeoutPolicy;
        this.callExecutor = Executors.newCachedThreadPool(new CallThreadFactory());
    }

    @Override
    public <T extends BaseDocument> Optional<T> get(String collection, String id, String partitionKey, Class<T> type) {
        return execute("get-" + type.getSimpleName(), () -> delegate.get(collection, id, partitionKey, type));
    }

    @Override
    public <T extends BaseDocument> T create(String collection, T document) {
        return execute("create-" + nameOf(document), () -> delegate.create(collection, document));
    }

    @Override
    public <T extends BaseDocument> T upsert(String collection, T document) {
        return execute("upsert-" + nameOf(document), () -> delegate.upsert(collection, document));
    }

    @Override
    public <T extends BaseDocument> T replace(String collection, T document) {
        return execute("replace-" + nameOf(document), () -> delegate.replace(collection, document));
    }

    @Override
    public void delete(String collection, String id, String partitionKey, String ifMatchEtag) {
        execute("delete", () -> {
            delegate.delete(collection, id, partitionKey, ifMatchEtag);
            return null;
        });
    }

    @Override
    public <T extends BaseDocument> DocumentPage<T> query(String collection, DocumentQuery query, String partitionKey,
                                                          Class<T> type, String continuationToken, int pageSize) {
        return execute("query-" + type.getSimpleName(),
            () -> delegate.query(collection, query, partitionKey, type, continuationToken, pageSize));
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    /**
     * 호출용 스레드 풀 종료.
     *
     * <p>진행 중인 호출이 60초 안에 끝나지 않으면 강제 종료합니다.</p>
     */
    @Override
    public void close() {
        callExecutor.shutdown();
        try {
            if (!callExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
                callExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            callExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private <R> R execute(String operationName, Supplier<R> call) {
        if (!circuitBreaker.tryAcquire(operationName)) {
            log.debug("Rejected '{}': circuit is OPEN", operationName);
            throw new CircuitBreakerOpenException(operationName, circuitBreaker.retryAfter());
        }

        try {
            R result = invokeWithTimeout(operationName, call);
            circuitBreaker.recordSuccess(operationName);
            return result;
        } catch (CancellationException e) {
            throw e;
        } catch (DocumentStoreException e) {
            if (e.indicatesStoreFailure()) {
                circuitBreaker.recordFailure(operationName, e);
            } else {
                circuitBreaker.recordSuccess(operationName);
            }
            throw e;
        } catch (RuntimeException e) {
            circuitBreaker.recordFailure(operationName, e);
            throw e;
        }
    }

    private <R> R invokeWithTimeout(String operationName, Supplier<R> call) {
        long timeoutMs = timeoutPolicy.getPerAttemptTimeoutMs(operationName);
        if (timeoutMs <= 0) {
            return call.get();
        }

        Future<R> future = callExecutor.submit(call::get);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            timeoutPolicy.recordTimeout(operationName, timeoutMs);
            throw new DocumentStoreTimeoutException(operationName, timeoutMs, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting for '" + operationName + "'");
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new DocumentStoreException("Operation '" + operationName + "' failed", cause, false);
        }
    }

    private static String nameOf(BaseDocument document) {
        return document == null ? "null" : document.getClass().getSimpleName();
    }

    private static final class CallThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "jobstore-store-call-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
