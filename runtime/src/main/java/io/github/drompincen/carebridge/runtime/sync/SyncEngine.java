package io.github.drompincen.carebridge.runtime.sync;

import io.github.drompincen.carebridge.protocol.api.CycleStatus;
import io.github.drompincen.carebridge.protocol.api.SyncCycleResult;
import io.github.drompincen.carebridge.protocol.sync.ChangeBatch;
import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import io.github.drompincen.carebridge.runtime.cursor.CursorStore;
import io.github.drompincen.carebridge.runtime.source.ChangeSource;
import io.github.drompincen.carebridge.runtime.source.ChangeSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * One sync cycle: read cursor, fetch a batch, process each change in feed order, then advance
 * the cursor. The cursor moves only when every change in the batch has been handled.
 */
@Service
public class SyncEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final ChangeSource changeSource;
    private final CursorStore cursorStore;
    private final DocumentProcessor documentProcessor;
    private final int batchSize;

    public SyncEngine(ChangeSource changeSource,
                      CursorStore cursorStore,
                      DocumentProcessor documentProcessor,
                      @Value("${carebridge.sync.batch-size:100}") int batchSize) {
        this.changeSource = changeSource;
        this.cursorStore = cursorStore;
        this.documentProcessor = documentProcessor;
        this.batchSize = batchSize;
    }

    public SyncCycleResult runCycle() {
        return runCycle(() -> false);
    }

    /**
     * @param stopRequested checked between documents; when it turns true the cycle ends without
     *                      advancing the cursor
     */
    public SyncCycleResult runCycle(BooleanSupplier stopRequested) {
        Cycle cycle = new Cycle();

        try {
            cycle.from = cursorStore.current();
        } catch (DataAccessException | TransactionException e) {
            log.error("Cannot read sync cursor: {}", e.getMessage());
            return cycle.finish(CycleStatus.STORE_UNAVAILABLE, null, false, "Cursor unreadable: " + e.getMessage());
        }

        ChangeBatch batch;
        try {
            batch = changeSource.fetchChanges(cycle.from, batchSize);
        } catch (ChangeSourceException e) {
            log.warn("Fetching changes since {} failed: {}", cycle.from, e.getMessage());
            return cycle.finish(CycleStatus.FETCH_FAILED, cycle.from, false, e.getMessage());
        }
        cycle.fetched = batch.changes().size();

        for (ChangeRecord change : batch.changes()) {
            if (stopRequested.getAsBoolean()) {
                log.info("Stop requested, leaving cycle after {} of {} changes", cycle.processed(), cycle.fetched);
                return cycle.finish(CycleStatus.INTERRUPTED, cycle.from, batch.hasMore(), "Stopped before batch end");
            }
            DocumentResult result;
            try {
                result = documentProcessor.process(change);
            } catch (StoreUnavailableException e) {
                log.error("{}: {}", e.getMessage(), e.getCause().getMessage());
                return cycle.finish(CycleStatus.STORE_UNAVAILABLE, cycle.from, batch.hasMore(), e.getMessage());
            }
            cycle.count(result);
        }

        try {
            cursorStore.advance(batch.newCursor());
        } catch (DataAccessException | TransactionException e) {
            log.error("Cannot persist sync cursor {}: {}", batch.newCursor(), e.getMessage());
            return cycle.finish(CycleStatus.STORE_UNAVAILABLE, cycle.from, batch.hasMore(), "Cursor not saved: " + e.getMessage());
        }

        SyncCycleResult result = cycle.finish(CycleStatus.COMPLETED, batch.newCursor(), batch.hasMore(), null);
        if (result.fetched() > 0) {
            log.info("Sync cycle {} -> {}: fetched={} applied={} skipped={} conflicts={} errored={} deleted={}",
                    result.fromCursor(), result.toCursor(), result.fetched(), result.applied(), result.skipped(),
                    result.conflicts(), result.errored(), result.deleted());
        }
        return result;
    }

    private static final class Cycle {
        private final Instant startedAt = Instant.now();
        private String from;
        private int fetched;
        private int applied;
        private int skipped;
        private int conflicts;
        private int errored;
        private int deleted;
        private int unchanged;

        void count(DocumentResult result) {
            switch (result) {
                case APPLIED -> applied++;
                case DELETED -> deleted++;
                case UNCHANGED, DEFERRED -> unchanged++;
                case SKIPPED -> skipped++;
                case CONFLICT -> conflicts++;
                case ERRORED -> errored++;
            }
        }

        int processed() {
            return applied + deleted + unchanged + skipped + conflicts + errored;
        }

        SyncCycleResult finish(CycleStatus status, String to, boolean hasMore, String message) {
            return new SyncCycleResult(status, from, to != null ? to : from, fetched, applied, skipped, conflicts,
                    errored, deleted, hasMore, message, startedAt, Instant.now());
        }
    }
}
