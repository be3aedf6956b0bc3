package io.github.drompincen.carebridge.protocol.api;

import java.time.Instant;

public record SyncStatusDto(
        String cursor,
        boolean daemonActive,
        boolean cycleInProgress,
        long applied,
        long skipped,
        long conflicts,
        long errored,
        long deleted,
        long cycles,
        long failedCycles,
        Instant lastSuccessAt,
        SyncCycleResult lastCycle
) {}
