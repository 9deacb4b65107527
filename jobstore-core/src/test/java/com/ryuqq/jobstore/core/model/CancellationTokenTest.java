package com.ryuqq.jobstore.core.model;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CancellationToken 테스트.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class CancellationTokenTest {

    @Test
    void cancel_이후_throwIfCancellationRequested_예외() {
        // given
        CancellationToken token = CancellationToken.create();
        assertDoesNotThrow(token::throwIfCancellationRequested);

        // when
        token.cancel();

        // then
        assertTrue(token.isCancellationRequested());
        assertThrows(CancellationException.class, token::throwIfCancellationRequested);
    }

    @Test
    void NONE_토큰은_취소할_수_없음() {
        assertThrows(IllegalStateException.class, CancellationToken.NONE::cancel);
        assertFalse(CancellationToken.NONE.isCancellationRequested());
    }
}
