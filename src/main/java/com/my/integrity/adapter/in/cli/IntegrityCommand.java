package com.my.integrity.adapter.in.cli;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/**
 * 왜: 기준선/점검/감시/복구/이력 명령을 하나의 실행 파일 아래에 묶기 위함.
 */
@TopCommand
@Command(name = "integrity",
        mixinStandardHelpOptions = true,
        description = "컨테이너 파일시스템 무결성 감시 및 복구",
        subcommands = {
                BaselineCommand.class,
                CheckCommand.class,
                MonitorCommand.class,
                RestoreCommand.class,
                HistoryCommand.class
        })
public class IntegrityCommand {
}
