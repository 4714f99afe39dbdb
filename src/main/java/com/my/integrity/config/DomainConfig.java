package com.my.integrity.config;

import com.my.integrity.adapter.out.clock.OffsetClockAdapter;
import com.my.integrity.domain.hash.ContentHasher;
import com.my.integrity.domain.hash.DigestAlgorithm;
import com.my.integrity.domain.hash.ExclusionRules;
import com.my.integrity.domain.port.in.BaselineUseCase;
import com.my.integrity.domain.port.in.CheckIntegrityUseCase;
import com.my.integrity.domain.port.in.RestoreUseCase;
import com.my.integrity.domain.port.out.ClockPort;
import com.my.integrity.domain.port.out.ContainerRuntimePort;
import com.my.integrity.domain.port.out.IntegrityEventPort;
import com.my.integrity.domain.port.out.RestoreJournalPort;
import com.my.integrity.domain.port.out.SnapshotRepositoryPort;
import com.my.integrity.domain.service.DriftDetector;
import com.my.integrity.domain.service.MonitorScheduler;
import com.my.integrity.domain.service.Restorer;
import com.my.integrity.domain.service.SnapshotService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;

import java.time.Duration;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        return OffsetClockAdapter.system(appConfig.clock().zone());
    }

    @Produces
    @ApplicationScoped
    public ContentHasher contentHasher(AppConfig appConfig) {
        return new ContentHasher(appConfig.hash().maxConcurrent());
    }

    @Produces
    @ApplicationScoped
    public BaselineUseCase baselineUseCase(ContainerRuntimePort runtime,
                                           SnapshotRepositoryPort repository,
                                           IntegrityEventPort events,
                                           RestoreJournalPort journal,
                                           ContentHasher hasher,
                                           ClockPort clockPort,
                                           AppConfig appConfig) {
        return new SnapshotService(runtime, repository, events, journal, hasher, clockPort,
                ExclusionRules.of(appConfig.hash().exclusions()),
                DigestAlgorithm.of(appConfig.hash().algorithm()));
    }

    @Produces
    @ApplicationScoped
    public CheckIntegrityUseCase checkIntegrityUseCase(ContainerRuntimePort runtime,
                                                       SnapshotRepositoryPort repository,
                                                       IntegrityEventPort events,
                                                       ContentHasher hasher,
                                                       ClockPort clockPort,
                                                       AppConfig appConfig) {
        return new DriftDetector(runtime, repository, events, hasher, clockPort, appConfig.detector().verbose());
    }

    @Produces
    @ApplicationScoped
    public RestoreUseCase restoreUseCase(ContainerRuntimePort runtime,
                                         SnapshotRepositoryPort repository,
                                         RestoreJournalPort journal,
                                         IntegrityEventPort events,
                                         ContentHasher hasher,
                                         ClockPort clockPort) {
        return new Restorer(runtime, repository, journal, events, hasher, clockPort);
    }

    @Produces
    @ApplicationScoped
    public MonitorScheduler monitorScheduler(CheckIntegrityUseCase detector,
                                             RestoreUseCase restorer,
                                             BaselineUseCase baselines,
                                             RestoreJournalPort journal,
                                             ClockPort clockPort,
                                             AppConfig appConfig) {
        AppConfig.MonitorConfig monitor = appConfig.monitor();
        return new MonitorScheduler(detector, restorer, baselines, journal, clockPort,
                new MonitorScheduler.Settings(monitor.workers(),
                        Duration.ofSeconds(monitor.operationTimeoutSeconds()),
                        Duration.ofSeconds(monitor.shutdownGraceSeconds())));
    }

    void closeScheduler(@Disposes MonitorScheduler scheduler) {
        scheduler.shutdown();
    }
}
