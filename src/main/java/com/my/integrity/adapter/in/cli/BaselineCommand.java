package com.my.integrity.adapter.in.cli;

import com.my.integrity.domain.exception.IntegrityException;
import com.my.integrity.domain.model.Snapshot;
import com.my.integrity.domain.port.in.BaselineUseCase;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "baseline", description = "현재 파일시스템을 새 기준선 스냅샷으로 기록합니다.")
public class BaselineCommand implements Callable<Integer> {

    private final BaselineUseCase baselines;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<container>")
    String container;

    @Option(names = "--exclude", paramLabel = "<path>", description = "기본 제외 목록에 더할 경로 또는 glob")
    List<String> excludes = new ArrayList<>();

    @Inject
    public BaselineCommand(BaselineUseCase baselines) {
        this.baselines = baselines;
    }

    @Override
    public Integer call() {
        try {
            Snapshot snapshot = baselines.createBaseline(container, excludes);
            spec.commandLine().getOut().printf("baseline %s v%d %s:%s (%d entries)%n",
                    snapshot.container(), snapshot.version(), snapshot.algorithm(), snapshot.digest(),
                    snapshot.entryCount());
            return ExitCodes.OK;
        } catch (IntegrityException | IllegalStateException e) {
            spec.commandLine().getErr().println("기준선 생성 실패: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }
}
