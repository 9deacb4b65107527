package com.ryuqq.jobstore.testkit.contract;

import com.ryuqq.jobstore.application.lock.DistributedLock;
import com.ryuqq.jobstore.application.lock.LockUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: at most one live holder per resource.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
class DistributedLockContractTest extends AbstractContractTest {

    @Test
    void secondAcquire_failsWhileHeld() {
        // Given
        DistributedLock held = connection.acquireDistributedLock("recurring-jobs:lock", Duration.ofMinutes(1));

        // When / Then
        LockUnavailableException error = assertThrows(LockUnavailableException.class,
            () -> connection.acquireDistributedLock("recurring-jobs:lock", Duration.ofMinutes(1)));
        assertEquals("recurring-jobs:lock", error.getResource());
        assertEquals(held.getOwner(), error.getOwner());
    }

    @Test
    void release_allowsNextAcquire() {
        // Given
        try (DistributedLock ignored = connection.acquireDistributedLock("resource", Duration.ofMinutes(1))) {
            assertFalse(ignored.isReleased());
        }

        // When
        DistributedLock next = connection.acquireDistributedLock("resource", Duration.ofMinutes(1));

        // Then
        assertNotNull(next);
    }

    @Test
    void expiredLock_canBeTakenOver() {
        // Given
        connection.acquireDistributedLock("resource", Duration.ofSeconds(1));

        // When
        advance(Duration.ofMillis(1100));
        DistributedLock taken = connection.acquireDistributedLock("resource", Duration.ofSeconds(1));

        // Then
        assertEquals(clock.instant().plusSeconds(1), taken.getExpiresAt());
    }

    @Test
    void releasingExpiredLock_doesNotRemoveNewOwnersLock() {
        // Given
        DistributedLock stale = connection.acquireDistributedLock("resource", Duration.ofSeconds(1));
        advance(Duration.ofSeconds(2));
        DistributedLock current = connection.acquireDistributedLock("resource", Duration.ofMinutes(1));

        // When
        stale.release();

        // Then
        assertThrows(LockUnavailableException.class,
            () -> connection.acquireDistributedLock("resource", Duration.ofMinutes(1)));
        current.release();
    }

    @Test
    void renew_extendsExpiry() {
        // Given
        DistributedLock lock = connection.acquireDistributedLock("resource", Duration.ofSeconds(10));
        advance(Duration.ofSeconds(8));

        // When
        assertTrue(lock.renew());
        advance(Duration.ofSeconds(8));

        // Then: still held 16s after acquisition
        assertThrows(LockUnavailableException.class,
            () -> connection.acquireDistributedLock("resource", Duration.ofSeconds(10)));
    }

    @Test
    void renew_afterLosingLock_returnsFalse() {
        // Given
        DistributedLock lock = connection.acquireDistributedLock("resource", Duration.ofSeconds(1));
        advance(Duration.ofSeconds(2));
        connection.acquireDistributedLock("resource", Duration.ofMinutes(1));

        // When / Then
        assertFalse(lock.renew());
    }

    @Test
    void release_isIdempotent() {
        DistributedLock lock = connection.acquireDistributedLock("resource", Duration.ofMinutes(1));

        lock.release();
        lock.release();

        assertTrue(lock.isReleased());
    }

    @Test
    void invalidArguments_rejected() {
        assertThrows(IllegalArgumentException.class,
            () -> connection.acquireDistributedLock(" ", Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class,
            () -> connection.acquireDistributedLock("resource", Duration.ZERO));
    }
}
