package io.github.drompincen.carebridge.gateway.controller;

import io.github.drompincen.carebridge.protocol.api.CycleStatus;
import io.github.drompincen.carebridge.protocol.api.SyncCycleResult;
import io.github.drompincen.carebridge.protocol.api.SyncStatusDto;
import io.github.drompincen.carebridge.protocol.api.SyncVerificationDto;
import io.github.drompincen.carebridge.runtime.cursor.CursorStore;
import io.github.drompincen.carebridge.runtime.sync.SyncCounters;
import io.github.drompincen.carebridge.runtime.sync.SyncVerificationService;
import io.github.drompincen.carebridge.runtime.sync.SyncWorker;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/sync")
public class SyncController {

    private final SyncWorker worker;
    private final CursorStore cursorStore;
    private final SyncCounters counters;
    private final SyncVerificationService verificationService;

    public SyncController(SyncWorker worker,
                          CursorStore cursorStore,
                          SyncCounters counters,
                          SyncVerificationService verificationService) {
        this.worker = worker;
        this.cursorStore = cursorStore;
        this.counters = counters;
        this.verificationService = verificationService;
    }

    @GetMapping("/status")
    public SyncStatusDto status() {
        return new SyncStatusDto(
                cursorStore.current(),
                worker.isDaemonActive(),
                worker.isCycleInProgress(),
                counters.applied(),
                counters.skipped(),
                counters.conflicts(),
                counters.errored(),
                counters.deleted(),
                counters.cycles(),
                counters.failedCycles(),
                counters.lastSuccessAt(),
                counters.lastCycle());
    }

    @PostMapping("/run")
    public ResponseEntity<SyncCycleResult> run() {
        SyncCycleResult result = worker.runOnce();
        if (result.status() == CycleStatus.BUSY) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/reset")
    public ResponseEntity<?> reset() {
        worker.resetCursor();
        return ResponseEntity.ok(Map.of("cursor", cursorStore.current()));
    }

    @GetMapping("/verify")
    public SyncVerificationDto verify() {
        return verificationService.verify();
    }
}
