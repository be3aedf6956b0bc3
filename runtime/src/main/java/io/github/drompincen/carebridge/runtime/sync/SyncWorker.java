package io.github.drompincen.carebridge.runtime.sync;

import io.github.drompincen.carebridge.protocol.api.CycleStatus;
import io.github.drompincen.carebridge.protocol.api.SyncCycleResult;
import io.github.drompincen.carebridge.runtime.cursor.CursorStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives {@link SyncEngine} as a daemon on the shared task scheduler, and serializes on-demand
 * cycles with it. Each tick schedules the next: immediately while the feed reports more
 * changes, after the poll interval when caught up, and with exponential backoff after failures.
 */
@Service
public class SyncWorker {

    private static final Logger log = LoggerFactory.getLogger(SyncWorker.class);

    private final SyncEngine engine;
    private final CursorStore cursorStore;
    private final SyncCounters counters;
    private final TaskScheduler taskScheduler;
    private final long pollIntervalMs;
    private final long maxBackoffMs;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean shuttingDown;
    private volatile ScheduledFuture<?> nextTick;
    private int consecutiveFailures;

    public SyncWorker(SyncEngine engine,
                      CursorStore cursorStore,
                      SyncCounters counters,
                      TaskScheduler taskScheduler,
                      @Value("${carebridge.sync.poll-interval-ms:4000}") long pollIntervalMs,
                      @Value("${carebridge.sync.max-backoff-ms:30000}") long maxBackoffMs) {
        this.engine = engine;
        this.cursorStore = cursorStore;
        this.counters = counters;
        this.taskScheduler = taskScheduler;
        this.pollIntervalMs = pollIntervalMs;
        this.maxBackoffMs = maxBackoffMs;
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Sync daemon started (poll interval {}ms, max backoff {}ms)", pollIntervalMs, maxBackoffMs);
            schedule(0);
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            ScheduledFuture<?> tick = nextTick;
            if (tick != null) {
                tick.cancel(false);
            }
            log.info("Sync daemon stopped");
        }
    }

    /**
     * Runs one cycle now, or reports busy when another cycle holds the lock.
     */
    public SyncCycleResult runOnce() {
        if (!cycleLock.tryLock()) {
            return SyncCycleResult.busy(cursorStore.current());
        }
        try {
            SyncCycleResult result = engine.runCycle(() -> shuttingDown);
            counters.record(result);
            return result;
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Moves the cursor back to the beginning of the feed. Waits for an in-flight cycle.
     */
    public void resetCursor() {
        cycleLock.lock();
        try {
            cursorStore.reset();
        } finally {
            cycleLock.unlock();
        }
    }

    public boolean isDaemonActive() {
        return running.get();
    }

    public boolean isCycleInProgress() {
        return cycleLock.isLocked();
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        stop();
        cycleLock.lock();
        cycleLock.unlock();
    }

    private void tick() {
        if (!running.get()) {
            return;
        }
        long delay;
        try {
            delay = nextDelay(runOnce());
        } catch (RuntimeException e) {
            log.error("Sync cycle failed unexpectedly", e);
            consecutiveFailures++;
            delay = backoff(pollIntervalMs, maxBackoffMs, consecutiveFailures);
        }
        if (running.get()) {
            schedule(delay);
        }
    }

    long nextDelay(SyncCycleResult result) {
        if (result.status() == CycleStatus.COMPLETED) {
            consecutiveFailures = 0;
            return result.hasMore() ? 0 : pollIntervalMs;
        }
        if (result.status() == CycleStatus.BUSY || result.status() == CycleStatus.INTERRUPTED) {
            return pollIntervalMs;
        }
        consecutiveFailures++;
        long delay = backoff(pollIntervalMs, maxBackoffMs, consecutiveFailures);
        log.warn("Sync cycle {} ({} consecutive), next attempt in {}ms", result.status(), consecutiveFailures, delay);
        return delay;
    }

    static long backoff(long pollIntervalMs, long maxBackoffMs, int failures) {
        long delay = pollIntervalMs;
        for (int i = 0; i < failures && delay < maxBackoffMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxBackoffMs);
    }

    private void schedule(long delayMs) {
        nextTick = taskScheduler.schedule(this::tick, Instant.now().plusMillis(delayMs));
    }
}
