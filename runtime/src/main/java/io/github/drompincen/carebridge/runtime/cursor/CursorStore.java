package io.github.drompincen.carebridge.runtime.cursor;

import io.github.drompincen.carebridge.persistence.entity.SyncCursorEntity;
import io.github.drompincen.carebridge.persistence.repository.SyncCursorRepository;
import io.github.drompincen.carebridge.runtime.source.ChangeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Durable checkpoint of the change feed position. Only the sync loop writes it.
 */
@Service
public class CursorStore {

    private static final Logger log = LoggerFactory.getLogger(CursorStore.class);
    public static final String CURSOR_NAME = "couchdb_sync_sequence";

    private final SyncCursorRepository cursorRepository;

    public CursorStore(SyncCursorRepository cursorRepository) {
        this.cursorRepository = cursorRepository;
    }

    public String current() {
        return cursorRepository.findById(CURSOR_NAME)
                .map(SyncCursorEntity::getCursorValue)
                .orElse(ChangeSource.BEGINNING);
    }

    @Transactional
    public void advance(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return;
        }
        SyncCursorEntity entity = cursorRepository.findById(CURSOR_NAME)
                .orElseGet(() -> new SyncCursorEntity(CURSOR_NAME, ChangeSource.BEGINNING, Instant.now()));
        entity.setCursorValue(cursor);
        entity.setUpdatedAt(Instant.now());
        cursorRepository.save(entity);
    }

    @Transactional
    public void reset() {
        advance(ChangeSource.BEGINNING);
        log.info("Sync cursor reset to the beginning of the change feed");
    }
}
