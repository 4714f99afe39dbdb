package com.my.integrity.adapter.in.cli;

import com.my.integrity.TestAppConfig;
import com.my.integrity.domain.exception.SnapshotNotFoundException;
import com.my.integrity.domain.model.MonitorPolicy;
import com.my.integrity.domain.port.in.RestoreUseCase;
import com.my.integrity.domain.port.out.ContainerRuntimePort;
import com.my.integrity.domain.service.MonitorScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MonitorCommandTest {

    @TempDir
    Path tempDir;

    private MonitorScheduler scheduler;
    private RestoreUseCase restorer;
    private ContainerRuntimePort runtime;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() {
        scheduler = mock(MonitorScheduler.class);
        restorer = mock(RestoreUseCase.class);
        runtime = mock(ContainerRuntimePort.class);
        when(restorer.recoverInterrupted()).thenReturn(List.of());
    }

    private int run(String... args) {
        MonitorCommand command = new MonitorCommand(scheduler, restorer, runtime,
                new TestAppConfig(tempDir.resolve("store"), tempDir.resolve("containers")));
        CommandLine commandLine = new CommandLine(command);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void allSkipsContainersWithoutBaselineAndRunsUntilStopped() throws Exception {
        when(runtime.listRunning()).thenReturn(List.of("web", "scratch"));
        when(scheduler.register("scratch", Duration.ofSeconds(5), MonitorPolicy.AUTO_RESTORE))
                .thenThrow(new SnapshotNotFoundException("scratch"));

        int code = run("--all", "--interval", "5", "--auto-restore");

        assertThat(code).isEqualTo(ExitCodes.INTERRUPTED);
        verify(scheduler).register("web", Duration.ofSeconds(5), MonitorPolicy.AUTO_RESTORE);
        verify(scheduler).start();
        verify(scheduler).awaitTermination();
        assertThat(out.toString()).contains("monitoring 1 container(s) every 5s (AUTO_RESTORE)");
    }

    @Test
    void namedContainerWithoutBaselineFailsStartup() {
        when(scheduler.register("web", Duration.ofSeconds(30), MonitorPolicy.DETECT_ONLY))
                .thenThrow(new SnapshotNotFoundException("web"));

        assertThat(run("web")).isEqualTo(ExitCodes.FAILURE);
        verify(scheduler, never()).start();
    }

    @Test
    void nothingToMonitorOrBadIntervalIsAFailure() {
        assertThat(run()).isEqualTo(ExitCodes.FAILURE);
        assertThat(run("web", "--interval", "0")).isEqualTo(ExitCodes.FAILURE);

        verify(scheduler, never()).register(any(), any(), any());
        assertThat(err.toString()).contains("0");
    }
}
