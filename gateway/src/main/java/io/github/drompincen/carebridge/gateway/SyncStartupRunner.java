package io.github.drompincen.carebridge.gateway;

import io.github.drompincen.carebridge.protocol.api.SyncCycleResult;
import io.github.drompincen.carebridge.runtime.sync.SyncWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Starts syncing according to {@code carebridge.sync.mode}: {@code daemon} polls until shutdown,
 * {@code once} runs a single cycle and exits with its status, {@code off} leaves syncing to the
 * REST controls.
 */
@Component
public class SyncStartupRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SyncStartupRunner.class);

    private final SyncWorker worker;
    private final ConfigurableApplicationContext context;
    private final String mode;
    private final boolean resetOnStart;

    public SyncStartupRunner(SyncWorker worker,
                             ConfigurableApplicationContext context,
                             @Value("${carebridge.sync.mode:daemon}") String mode,
                             @Value("${carebridge.sync.reset-on-start:false}") boolean resetOnStart) {
        this.worker = worker;
        this.context = context;
        this.mode = mode;
        this.resetOnStart = resetOnStart;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (resetOnStart) {
            log.info("Resetting sync cursor for a full resync");
            worker.resetCursor();
        }

        switch (mode.trim().toLowerCase()) {
            case "daemon" -> worker.start();
            case "once" -> {
                int exitCode = runOnce();
                System.exit(SpringApplication.exit(context, () -> exitCode));
            }
            case "off" -> log.info("Sync disabled at startup; use /api/sync/run to trigger cycles");
            default -> throw new IllegalStateException("Unknown carebridge.sync.mode: " + mode);
        }
    }

    int runOnce() {
        SyncCycleResult result = worker.runOnce();
        log.info("One-shot sync {}: fetched={} applied={} skipped={} conflicts={} errored={} deleted={}",
                result.status(), result.fetched(), result.applied(), result.skipped(), result.conflicts(),
                result.errored(), result.deleted());
        return result.exitCode();
    }
}
