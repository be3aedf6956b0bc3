package io.github.drompincen.carebridge.runtime.sync;

import io.github.drompincen.carebridge.protocol.api.SyncCycleResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Running totals since process start.
 */
@Component
public class SyncCounters {

    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong conflicts = new AtomicLong();
    private final AtomicLong errored = new AtomicLong();
    private final AtomicLong deleted = new AtomicLong();
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong failedCycles = new AtomicLong();
    private final AtomicReference<Instant> lastSuccessAt = new AtomicReference<>();
    private final AtomicReference<SyncCycleResult> lastCycle = new AtomicReference<>();

    public void record(SyncCycleResult result) {
        applied.addAndGet(result.applied());
        skipped.addAndGet(result.skipped());
        conflicts.addAndGet(result.conflicts());
        errored.addAndGet(result.errored());
        deleted.addAndGet(result.deleted());
        cycles.incrementAndGet();
        if (result.succeeded()) {
            lastSuccessAt.set(result.finishedAt());
        } else {
            failedCycles.incrementAndGet();
        }
        lastCycle.set(result);
    }

    public long applied() { return applied.get(); }
    public long skipped() { return skipped.get(); }
    public long conflicts() { return conflicts.get(); }
    public long errored() { return errored.get(); }
    public long deleted() { return deleted.get(); }
    public long cycles() { return cycles.get(); }
    public long failedCycles() { return failedCycles.get(); }
    public Instant lastSuccessAt() { return lastSuccessAt.get(); }
    public SyncCycleResult lastCycle() { return lastCycle.get(); }
}
