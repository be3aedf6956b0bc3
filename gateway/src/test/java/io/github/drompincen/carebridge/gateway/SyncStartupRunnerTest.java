package io.github.drompincen.carebridge.gateway;

import io.github.drompincen.carebridge.protocol.api.CycleStatus;
import io.github.drompincen.carebridge.protocol.api.SyncCycleResult;
import io.github.drompincen.carebridge.runtime.sync.SyncWorker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncStartupRunnerTest {

    @Mock private SyncWorker worker;
    @Mock private ConfigurableApplicationContext context;

    @Test
    void daemonModeStartsWorker() {
        new SyncStartupRunner(worker, context, "daemon", false).run(new DefaultApplicationArguments());

        verify(worker).start();
        verify(worker, never()).resetCursor();
    }

    @Test
    void resetOnStartResetsBeforeStarting() {
        new SyncStartupRunner(worker, context, "off", true).run(new DefaultApplicationArguments());

        verify(worker).resetCursor();
        verify(worker, never()).start();
    }

    @Test
    void oneShotExitCodeFollowsCycleOutcome() {
        Instant now = Instant.now();
        when(worker.runOnce())
                .thenReturn(new SyncCycleResult(CycleStatus.COMPLETED, "0", "5", 5, 5, 0, 0, 0, 0, false, null, now, now))
                .thenReturn(new SyncCycleResult(CycleStatus.COMPLETED, "5", "9", 4, 3, 1, 0, 0, 0, false, null, now, now))
                .thenReturn(new SyncCycleResult(CycleStatus.FETCH_FAILED, "9", "9", 0, 0, 0, 0, 0, 0, false, "down", now, now));
        SyncStartupRunner runner = new SyncStartupRunner(worker, context, "once", false);

        assertThat(runner.runOnce()).isEqualTo(0);
        assertThat(runner.runOnce()).isEqualTo(3);
        assertThat(runner.runOnce()).isEqualTo(2);
    }

    @Test
    void unknownModeFailsStartup() {
        SyncStartupRunner runner = new SyncStartupRunner(worker, context, "sometimes", false);

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalStateException.class);
    }
}
