package io.github.drompincen.carebridge.protocol.api;

import java.time.Instant;

/**
 * Outcome of one sync cycle. {@code toCursor} equals {@code fromCursor} unless the cycle completed.
 */
public record SyncCycleResult(
        CycleStatus status,
        String fromCursor,
        String toCursor,
        int fetched,
        int applied,
        int skipped,
        int conflicts,
        int errored,
        int deleted,
        boolean hasMore,
        String message,
        Instant startedAt,
        Instant finishedAt
) {

    public static final int EXIT_OK = 0;
    public static final int EXIT_BUSY = 1;
    public static final int EXIT_FAILED = 2;
    public static final int EXIT_DOCUMENTS_SKIPPED = 3;

    public static SyncCycleResult busy(String cursor) {
        Instant now = Instant.now();
        return new SyncCycleResult(CycleStatus.BUSY, cursor, cursor, 0, 0, 0, 0, 0, 0, false,
                "A sync cycle is already running", now, now);
    }

    public boolean succeeded() {
        return status == CycleStatus.COMPLETED;
    }

    /**
     * Process exit status for one-shot runs.
     */
    public int exitCode() {
        return switch (status) {
            case COMPLETED -> (skipped + errored) > 0 ? EXIT_DOCUMENTS_SKIPPED : EXIT_OK;
            case BUSY -> EXIT_BUSY;
            default -> EXIT_FAILED;
        };
    }
}
