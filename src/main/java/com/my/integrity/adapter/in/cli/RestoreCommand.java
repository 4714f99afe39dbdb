package com.my.integrity.adapter.in.cli;

import com.my.integrity.domain.exception.IntegrityException;
import com.my.integrity.domain.model.RestoreOutcome;
import com.my.integrity.domain.port.in.RestoreUseCase;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.OptionalInt;
import java.util.concurrent.Callable;

@Command(name = "restore", description = "스냅샷으로 컨테이너 파일시스템을 되돌리고 검증합니다.")
public class RestoreCommand implements Callable<Integer> {

    private final RestoreUseCase restorer;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<container>")
    String container;

    @Option(names = "--version", paramLabel = "<n>", description = "복구할 스냅샷 버전 (기본: 최신)")
    Integer version;

    @Option(names = "--force", description = "비정상 종료로 남은 진행 중 복구 기록을 무시합니다")
    boolean force;

    @Inject
    public RestoreCommand(RestoreUseCase restorer) {
        this.restorer = restorer;
    }

    @Override
    public Integer call() {
        try {
            OptionalInt requested = version == null ? OptionalInt.empty() : OptionalInt.of(version);
            RestoreOutcome outcome = restorer.restore(container, requested, force);
            spec.commandLine().getOut().printf("%s %s v%d (%dms)%s%n",
                    outcome.status(), container, outcome.snapshotVersion(), outcome.elapsed().toMillis(),
                    outcome.detail() == null ? "" : " " + outcome.detail());
            return outcome.success() ? ExitCodes.OK : ExitCodes.FAILURE;
        } catch (IntegrityException | IllegalStateException e) {
            spec.commandLine().getErr().println("복구 실패: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }
}
