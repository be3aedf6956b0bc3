package io.github.drompincen.carebridge.runtime.sync;

import io.github.drompincen.carebridge.protocol.api.CycleStatus;
import io.github.drompincen.carebridge.protocol.api.SyncCycleResult;
import io.github.drompincen.carebridge.runtime.cursor.CursorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SyncWorkerTest {

    @Mock private SyncEngine engine;
    @Mock private CursorStore cursorStore;
    @Mock private TaskScheduler taskScheduler;

    private SyncCounters counters;
    private SyncWorker worker;

    @BeforeEach
    void setUp() {
        counters = new SyncCounters();
        worker = new SyncWorker(engine, cursorStore, counters, taskScheduler, 4000, 30000);
        when(cursorStore.current()).thenReturn("7");
    }

    @Test
    void backoffDoublesUpToTheCap() {
        assertThat(SyncWorker.backoff(4000, 30000, 1)).isEqualTo(8000);
        assertThat(SyncWorker.backoff(4000, 30000, 2)).isEqualTo(16000);
        assertThat(SyncWorker.backoff(4000, 30000, 3)).isEqualTo(30000);
        assertThat(SyncWorker.backoff(4000, 30000, 60)).isEqualTo(30000);
    }

    @Test
    void nextDelayFollowsCycleOutcome() {
        assertThat(worker.nextDelay(result(CycleStatus.COMPLETED, true))).isZero();
        assertThat(worker.nextDelay(result(CycleStatus.COMPLETED, false))).isEqualTo(4000);
        assertThat(worker.nextDelay(result(CycleStatus.FETCH_FAILED, false))).isEqualTo(8000);
        assertThat(worker.nextDelay(result(CycleStatus.STORE_UNAVAILABLE, false))).isEqualTo(16000);
        assertThat(worker.nextDelay(result(CycleStatus.COMPLETED, false))).isEqualTo(4000);
        assertThat(worker.nextDelay(result(CycleStatus.FETCH_FAILED, false))).isEqualTo(8000);
    }

    @Test
    void runOnceRecordsCounters() {
        when(engine.runCycle(any())).thenReturn(result(CycleStatus.COMPLETED, false));

        SyncCycleResult result = worker.runOnce();

        assertThat(result.succeeded()).isTrue();
        assertThat(counters.cycles()).isEqualTo(1);
        assertThat(counters.applied()).isEqualTo(2);
        assertThat(counters.lastCycle()).isSameAs(result);
    }

    @Test
    void concurrentRunReportsBusy() throws Exception {
        CountDownLatch inCycle = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(engine.runCycle(any())).thenAnswer(invocation -> {
            inCycle.countDown();
            release.await(5, TimeUnit.SECONDS);
            return result(CycleStatus.COMPLETED, false);
        });

        AtomicReference<SyncCycleResult> first = new AtomicReference<>();
        Thread runner = new Thread(() -> first.set(worker.runOnce()));
        runner.start();
        assertThat(inCycle.await(5, TimeUnit.SECONDS)).isTrue();

        SyncCycleResult second = worker.runOnce();
        assertThat(second.status()).isEqualTo(CycleStatus.BUSY);
        assertThat(second.exitCode()).isEqualTo(SyncCycleResult.EXIT_BUSY);
        assertThat(worker.isCycleInProgress()).isTrue();

        release.countDown();
        runner.join(5000);
        assertThat(first.get().succeeded()).isTrue();
        assertThat(worker.isCycleInProgress()).isFalse();
    }

    @Test
    void startSchedulesImmediatelyAndOnlyOnce() {
        worker.start();
        worker.start();

        assertThat(worker.isDaemonActive()).isTrue();
        verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));

        worker.stop();
        assertThat(worker.isDaemonActive()).isFalse();
    }

    @Test
    void resetDelegatesToCursorStore() {
        worker.resetCursor();

        verify(cursorStore).reset();
        verify(engine, never()).runCycle(any());
    }

    @Test
    void shutdownStopsDaemon() {
        worker.start();
        worker.shutdown();

        assertThat(worker.isDaemonActive()).isFalse();
        verify(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    private static SyncCycleResult result(CycleStatus status, boolean hasMore) {
        Instant now = Instant.now();
        return new SyncCycleResult(status, "7", "9", 2, 2, 0, 0, 0, 0, hasMore, null, now, now);
    }
}
