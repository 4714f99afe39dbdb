package com.my.integrity.adapter.in.cli;

import com.my.integrity.domain.exception.RuntimeUnavailableException;
import com.my.integrity.domain.exception.SnapshotNotFoundException;
import com.my.integrity.domain.model.CheckResult;
import com.my.integrity.domain.model.EventKind;
import com.my.integrity.domain.model.IntegrityEvent;
import com.my.integrity.domain.model.RestoreOutcome;
import com.my.integrity.domain.model.RestoreStatus;
import com.my.integrity.domain.model.Snapshot;
import com.my.integrity.domain.model.Verdict;
import com.my.integrity.domain.port.in.BaselineUseCase;
import com.my.integrity.domain.port.in.CheckIntegrityUseCase;
import com.my.integrity.domain.port.in.RestoreUseCase;
import com.my.integrity.domain.port.out.IntegrityEventPort;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CommandsTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 1, 9, 0, 0, 0, ZoneOffset.UTC);

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(Object command, String... args) {
        CommandLine commandLine = new CommandLine(command);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private static Snapshot snapshot(int version) {
        return new Snapshot("web", version, NOW, "ab".repeat(32), "SHA-256", List.of("/tmp"),
                "archives/web/v" + version + ".tar", 42);
    }

    @Test
    void checkExitCodeFollowsVerdict() {
        CheckIntegrityUseCase detector = mock(CheckIntegrityUseCase.class);
        when(detector.check("web")).thenReturn(new CheckResult("web", 3, "aa", "aa", Verdict.MATCH));
        when(detector.check("db")).thenReturn(new CheckResult("db", 1, "aa", "bb", Verdict.DRIFT));
        when(detector.check("cache")).thenThrow(new SnapshotNotFoundException("cache"));

        assertThat(run(new CheckCommand(detector), "web")).isEqualTo(ExitCodes.OK);
        assertThat(run(new CheckCommand(detector), "db")).isEqualTo(ExitCodes.DRIFT);
        assertThat(run(new CheckCommand(detector), "cache")).isEqualTo(ExitCodes.FAILURE);

        assertThat(out.toString()).contains("MATCH web (baseline v3)").contains("DRIFT db (baseline v1)");
        assertThat(err.toString()).contains("cache");
    }

    @Test
    void baselinePassesExtraExclusions() {
        BaselineUseCase baselines = mock(BaselineUseCase.class);
        when(baselines.createBaseline("web", List.of("/srv/cache", "*.pid"))).thenReturn(snapshot(2));

        int code = run(new BaselineCommand(baselines), "web", "--exclude", "/srv/cache", "--exclude", "*.pid");

        assertThat(code).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).contains("baseline web v2 SHA-256:").contains("(42 entries)");
    }

    @Test
    void restoreReportsOutcomeAndFailsOnUnsuccessfulStatus() {
        RestoreUseCase restorer = mock(RestoreUseCase.class);
        when(restorer.restore("web", OptionalInt.of(2), true))
                .thenReturn(new RestoreOutcome(RestoreStatus.RESTORED, 2, "ab", Duration.ofMillis(1500), null));
        when(restorer.restore("db", OptionalInt.empty(), false))
                .thenReturn(new RestoreOutcome(RestoreStatus.VERIFICATION_FAILED, 1, "cd", Duration.ofMillis(10),
                        "digest mismatch"));
        when(restorer.restore("cache", OptionalInt.empty(), false))
                .thenThrow(new RuntimeUnavailableException("daemon down"));

        assertThat(run(new RestoreCommand(restorer), "web", "--version", "2", "--force")).isEqualTo(ExitCodes.OK);
        assertThat(run(new RestoreCommand(restorer), "db")).isEqualTo(ExitCodes.FAILURE);
        assertThat(run(new RestoreCommand(restorer), "cache")).isEqualTo(ExitCodes.FAILURE);

        assertThat(out.toString())
                .contains("RESTORED web v2 (1500ms)")
                .contains("VERIFICATION_FAILED db v1 (10ms) digest mismatch");
        assertThat(err.toString()).contains("daemon down");
    }

    @Test
    void historyListsSnapshotsAndRecentEvents() {
        BaselineUseCase baselines = mock(BaselineUseCase.class);
        IntegrityEventPort events = mock(IntegrityEventPort.class);
        when(baselines.history("web")).thenReturn(List.of(snapshot(1), snapshot(2)));
        when(events.recent("web", 5)).thenReturn(List.of(
                new IntegrityEvent("web", NOW, EventKind.CHECK, 2, "aa", "bb", Verdict.DRIFT, null, 30L, null),
                new IntegrityEvent("web", NOW, EventKind.RESTORE, 2, "aa", "aa", null, RestoreStatus.RESTORED, 900L, null)));

        int code = run(new HistoryCommand(baselines, events), "web", "--events", "5");

        assertThat(code).isEqualTo(ExitCodes.OK);
        assertThat(out.toString())
                .contains("snapshots (2)")
                .contains("events (2)")
                .contains("CHECK v2 DRIFT 30ms")
                .contains("RESTORE v2 RESTORED 900ms");
        verify(events).recent("web", 5);
    }

    @Test
    void missingContainerArgumentIsAUsageError() {
        CheckIntegrityUseCase detector = mock(CheckIntegrityUseCase.class);

        assertThat(run(new CheckCommand(detector))).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
