package com.my.integrity.adapter.in.cli;

import com.my.integrity.domain.exception.IntegrityException;
import com.my.integrity.domain.model.IntegrityEvent;
import com.my.integrity.domain.model.Snapshot;
import com.my.integrity.domain.port.in.BaselineUseCase;
import com.my.integrity.domain.port.out.IntegrityEventPort;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "history", description = "스냅샷 버전과 최근 감사 기록을 보여줍니다.")
public class HistoryCommand implements Callable<Integer> {

    private final BaselineUseCase baselines;
    private final IntegrityEventPort events;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<container>")
    String container;

    @Option(names = "--events", paramLabel = "<n>", defaultValue = "10", description = "보여줄 최근 감사 기록 수")
    int eventCount;

    @Inject
    public HistoryCommand(BaselineUseCase baselines, IntegrityEventPort events) {
        this.baselines = baselines;
        this.events = events;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            List<Snapshot> snapshots = baselines.history(container);
            out.printf("snapshots (%d)%n", snapshots.size());
            for (Snapshot snapshot : snapshots) {
                out.printf("  v%-4d %s %s:%s %d entries%n", snapshot.version(), snapshot.createdAt(),
                        snapshot.algorithm(), snapshot.digest(), snapshot.entryCount());
            }
            List<IntegrityEvent> recent = events.recent(container, Math.max(eventCount, 0));
            out.printf("events (%d)%n", recent.size());
            for (IntegrityEvent event : recent) {
                out.println("  " + describe(event));
            }
            return ExitCodes.OK;
        } catch (IntegrityException | IllegalStateException e) {
            spec.commandLine().getErr().println("이력 조회 실패: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }

    private static String describe(IntegrityEvent event) {
        StringBuilder line = new StringBuilder()
                .append(event.timestamp()).append(' ').append(event.kind());
        if (event.snapshotVersion() != null) {
            line.append(" v").append(event.snapshotVersion());
        }
        if (event.verdict() != null) {
            line.append(' ').append(event.verdict());
        }
        if (event.restoreOutcome() != null) {
            line.append(' ').append(event.restoreOutcome());
        }
        if (event.elapsedMillis() != null) {
            line.append(' ').append(event.elapsedMillis()).append("ms");
        }
        if (event.error() != null) {
            line.append(" error=").append(event.error());
        }
        return line.toString();
    }
}
