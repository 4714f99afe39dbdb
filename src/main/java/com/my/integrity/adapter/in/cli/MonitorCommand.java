package com.my.integrity.adapter.in.cli;

import com.my.integrity.config.AppConfig;
import com.my.integrity.domain.exception.IntegrityException;
import com.my.integrity.domain.exception.SnapshotNotFoundException;
import com.my.integrity.domain.model.MonitorPolicy;
import com.my.integrity.domain.port.in.RestoreUseCase;
import com.my.integrity.domain.port.out.ContainerRuntimePort;
import com.my.integrity.domain.service.MonitorScheduler;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * 왜: 지정한(또는 실행 중인 모든) 컨테이너를 주기적으로 점검하고, 중단될 때까지 머무르기 위함.
 *
 * <p>종료는 애플리케이션 종료 시 스케줄러가 정리되면서 일어난다. 진행 중인 작업이 끝난 뒤 130을 돌려준다.
 */
@Command(name = "monitor", description = "컨테이너를 주기적으로 점검합니다. 중단될 때까지 실행됩니다.")
public class MonitorCommand implements Callable<Integer> {

    private static final Logger log = Logger.getLogger(MonitorCommand.class);

    private final MonitorScheduler scheduler;
    private final RestoreUseCase restorer;
    private final ContainerRuntimePort runtime;
    private final AppConfig appConfig;

    @Spec
    CommandSpec spec;

    @Parameters(arity = "0..*", paramLabel = "<container>")
    List<String> containers = new ArrayList<>();

    @Option(names = "--interval", paramLabel = "<seconds>", description = "점검 주기 (기본: integrity.monitor.interval-seconds)")
    Integer intervalSeconds;

    @Option(names = "--auto-restore", description = "변조를 발견하면 최신 스냅샷으로 자동 복구합니다")
    boolean autoRestore;

    @Option(names = "--all", description = "런타임이 보고하는 실행 중인 컨테이너를 모두 감시합니다")
    boolean all;

    @Inject
    public MonitorCommand(MonitorScheduler scheduler, RestoreUseCase restorer,
                          ContainerRuntimePort runtime, AppConfig appConfig) {
        this.scheduler = scheduler;
        this.restorer = restorer;
        this.runtime = runtime;
        this.appConfig = appConfig;
    }

    @Override
    public Integer call() {
        int seconds = intervalSeconds != null ? intervalSeconds : appConfig.monitor().intervalSeconds();
        if (seconds < 1) {
            spec.commandLine().getErr().println("점검 주기는 1초 이상이어야 합니다: " + seconds);
            return ExitCodes.FAILURE;
        }
        Duration interval = Duration.ofSeconds(seconds);
        MonitorPolicy policy = autoRestore || appConfig.monitor().autoRestore()
                ? MonitorPolicy.AUTO_RESTORE
                : MonitorPolicy.DETECT_ONLY;

        int registered;
        try {
            List<String> held = restorer.recoverInterrupted();
            if (!held.isEmpty()) {
                log.warnf("중단된 복구가 있어 보류 상태로 둡니다: %s", held);
            }
            registered = registerAll(interval, policy);
        } catch (IntegrityException | IllegalStateException e) {
            spec.commandLine().getErr().println("감시 시작 실패: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
        if (registered == 0) {
            spec.commandLine().getErr().println("감시할 컨테이너가 없습니다");
            return ExitCodes.FAILURE;
        }

        scheduler.start();
        spec.commandLine().getOut().printf("monitoring %d container(s) every %ds (%s)%n", registered, seconds, policy);
        spec.commandLine().getOut().flush();
        try {
            scheduler.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdown();
        }
        return ExitCodes.INTERRUPTED;
    }

    private int registerAll(Duration interval, MonitorPolicy policy) {
        Set<String> names = new LinkedHashSet<>(containers);
        if (all) {
            names.addAll(runtime.listRunning());
        }
        int registered = 0;
        for (String name : names) {
            try {
                scheduler.register(name, interval, policy);
                registered++;
            } catch (SnapshotNotFoundException e) {
                if (containers.contains(name)) {
                    throw e;
                }
                log.warnf("기준선이 없어 감시에서 제외합니다: %s", name);
            }
        }
        return registered;
    }
}
