package com.my.integrity.adapter.in.cli;

import com.my.integrity.domain.exception.IntegrityException;
import com.my.integrity.domain.model.CheckResult;
import com.my.integrity.domain.port.in.CheckIntegrityUseCase;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * 1회 점검. 일치하면 0, 변조가 있으면 1, 점검 자체를 못 하면 2를 돌려준다.
 */
@Command(name = "check", description = "최신 기준선과 현재 파일시스템을 비교합니다.")
public class CheckCommand implements Callable<Integer> {

    private final CheckIntegrityUseCase detector;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<container>")
    String container;

    @Inject
    public CheckCommand(CheckIntegrityUseCase detector) {
        this.detector = detector;
    }

    @Override
    public Integer call() {
        try {
            CheckResult result = detector.check(container);
            spec.commandLine().getOut().printf("%s %s (baseline v%d)%n",
                    result.verdict(), result.container(), result.snapshotVersion());
            return result.drifted() ? ExitCodes.DRIFT : ExitCodes.OK;
        } catch (IntegrityException | IllegalStateException e) {
            spec.commandLine().getErr().println("점검 실패: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }
}
