package com.ryuqq.jobstore.core.model;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 협조적 취소 신호.
 *
 * <p>저장소 호출 직전에 확인됩니다. 취소가 요청되면 다음 호출은 실행되지 않고
 * {@link CancellationException}이 발생합니다. 이미 저장소에 반영된 쓰기는 되돌리지 않습니다.</p>
 *
 * <pre>{@code
 * CancellationToken token = CancellationToken.create();
 * executor.submit(() -> connection.fetchNextJob(List.of("default"), token));
 * // 종료 시
 * token.cancel();
 * }</pre>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class CancellationToken {

    /**
     * 절대 취소되지 않는 토큰.
     */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * 취소 가능한 토큰 생성.
     *
     * @return 새 토큰
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * 취소 요청.
     *
     * @throws IllegalStateException {@link #NONE}에 대해 호출한 경우
     */
    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("CancellationToken.NONE cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * 취소가 요청되었으면 예외 발생.
     *
     * @throws CancellationException 취소가 요청된 경우
     */
    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new CancellationException("Operation was cancelled");
        }
    }
}
