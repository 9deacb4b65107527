package com.ryuqq.jobstore.adapter.runner;

import com.ryuqq.jobstore.application.connection.JobStorageConnection;
import com.ryuqq.jobstore.application.lock.DistributedLock;
import com.ryuqq.jobstore.application.lock.LockUnavailableException;
import com.ryuqq.jobstore.core.spi.DocumentStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

/**
 * Reaper 유닛 테스트.
 *
 * <p>Reaper의 장기 processing Job 리컨실 동작을 검증합니다:</p>
 * <ul>
 *   <li>RETRY 전략: 원래 큐로 재등록</li>
 *   <li>FAIL 전략: failed로 전이</li>
 *   <li>스캔 락을 다른 인스턴스가 보유하면 건너뜀</li>
 *   <li>예외 발생 시에도 계속 진행</li>
 * </ul>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ReaperTest {

    private static final Duration THRESHOLD = Duration.ofMillis(1800000);

    @Mock
    private JobStorageConnection connection;

    @Mock
    private DistributedLock scanLock;

    private ReaperConfig config;
    private Reaper reaper;

    @BeforeEach
    void setUp() {
        config = new ReaperConfig(); // RETRY, timeoutThresholdMs=1800000, batchSize=50
        reaper = new Reaper(connection, config);
    }

    private void givenScanLockAcquired() {
        when(connection.acquireDistributedLock(ReaperConfig.LOCK_RESOURCE, Duration.ofMillis(config.scanIntervalMs())))
            .thenReturn(scanLock);
    }

    // ============================================================
    // 1. RETRY 전략
    // ============================================================

    @Test
    void scan_RETRY_전략이면_장기_processing_Job을_재등록함() {
        // given
        givenScanLockAcquired();
        when(connection.findStaleProcessingJobs(THRESHOLD, 50)).thenReturn(List.of("stuck-1", "stuck-2"));
        when(connection.requeueStaleJob(anyString(), eq(THRESHOLD), anyString())).thenReturn(true);

        // when
        int reconciled = reaper.scan();

        // then
        assertThat(reconciled).isEqualTo(2);
        verify(connection).requeueStaleJob(eq("stuck-1"), eq(THRESHOLD), startsWith("Requeued by reaper after"));
        verify(connection).requeueStaleJob(eq("stuck-2"), eq(THRESHOLD), startsWith("Requeued by reaper after"));
        verify(connection, never()).failStaleJob(any(), any(), any());
        verify(scanLock).close();
    }

    // ============================================================
    // 2. FAIL 전략
    // ============================================================

    @Test
    void scan_FAIL_전략이면_failed로_전이함() {
        // given
        reaper = new Reaper(connection, config.withDefaultStrategy(ReconcileStrategy.FAIL));
        givenScanLockAcquired();
        when(connection.findStaleProcessingJobs(THRESHOLD, 50)).thenReturn(List.of("stuck-1"));
        when(connection.failStaleJob(eq("stuck-1"), eq(THRESHOLD), anyString())).thenReturn(true);

        // when
        int reconciled = reaper.scan();

        // then
        assertThat(reconciled).isEqualTo(1);
        verify(connection).failStaleJob(eq("stuck-1"), eq(THRESHOLD), startsWith("Failed by reaper after"));
        verify(connection, never()).requeueStaleJob(any(), any(), any());
    }

    // ============================================================
    // 3. 건너뛰기와 부분 실패
    // ============================================================

    @Test
    void scan_다른_인스턴스가_락을_보유하면_아무것도_하지_않음() {
        // given
        when(connection.acquireDistributedLock(eq(ReaperConfig.LOCK_RESOURCE), any(Duration.class)))
            .thenThrow(new LockUnavailableException(ReaperConfig.LOCK_RESOURCE, "other-host", Instant.now()));

        // when
        int reconciled = reaper.scan();

        // then
        assertThat(reconciled).isZero();
        verify(connection, never()).findStaleProcessingJobs(any(), anyInt());
        verify(connection, never()).removeTimedOutServers(any());
    }

    @Test
    void scan_그사이_진행된_Job은_건수에서_제외함() {
        // given
        givenScanLockAcquired();
        when(connection.findStaleProcessingJobs(THRESHOLD, 50)).thenReturn(List.of("moved-on"));
        when(connection.requeueStaleJob(eq("moved-on"), eq(THRESHOLD), anyString())).thenReturn(false);

        // when & then
        assertThat(reaper.scan()).isZero();
    }

    @Test
    void scan_한_Job에서_예외가_나도_나머지를_계속_처리함() {
        // given
        givenScanLockAcquired();
        when(connection.findStaleProcessingJobs(THRESHOLD, 50)).thenReturn(List.of("broken", "stuck-2"));
        when(connection.requeueStaleJob(eq("broken"), eq(THRESHOLD), anyString()))
            .thenThrow(new DocumentStoreException("store unavailable", true));
        when(connection.requeueStaleJob(eq("stuck-2"), eq(THRESHOLD), anyString())).thenReturn(true);

        // when
        int reconciled = reaper.scan();

        // then
        assertThat(reconciled).isEqualTo(1);
        verify(scanLock).close();
    }

    // ============================================================
    // 4. 서버 정리
    // ============================================================

    @Test
    void scan_Job_리컨실_전에_응답_없는_서버를_정리함() {
        // given
        givenScanLockAcquired();
        when(connection.removeTimedOutServers(Duration.ofMillis(300000))).thenReturn(2);
        when(connection.findStaleProcessingJobs(THRESHOLD, 50)).thenReturn(List.of());

        // when
        reaper.scan();

        // then
        InOrder inOrder = inOrder(connection);
        inOrder.verify(connection).removeTimedOutServers(Duration.ofMillis(300000));
        inOrder.verify(connection).findStaleProcessingJobs(THRESHOLD, 50);
    }
}
