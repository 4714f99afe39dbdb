package com.my.integrity.domain.service;

import com.my.integrity.domain.exception.RestoreInProgressException;
import com.my.integrity.domain.exception.RuntimeUnavailableException;
import com.my.integrity.domain.exception.SnapshotCorruptedException;
import com.my.integrity.domain.exception.SnapshotNotFoundException;
import com.my.integrity.domain.exception.UnreadableEntryException;
import com.my.integrity.domain.hash.ContentHasher;
import com.my.integrity.domain.hash.DigestAlgorithm;
import com.my.integrity.domain.hash.ExclusionRules;
import com.my.integrity.domain.hash.TarTreeSource;
import com.my.integrity.domain.hash.TreeDigest;
import com.my.integrity.domain.model.ContainerNames;
import com.my.integrity.domain.model.EventKind;
import com.my.integrity.domain.model.IntegrityEvent;
import com.my.integrity.domain.model.RestoreJournalEntry;
import com.my.integrity.domain.model.RestoreOutcome;
import com.my.integrity.domain.model.RestorePhase;
import com.my.integrity.domain.model.RestoreStatus;
import com.my.integrity.domain.model.Snapshot;
import com.my.integrity.domain.port.in.RestoreUseCase;
import com.my.integrity.domain.port.out.ClockPort;
import com.my.integrity.domain.port.out.ContainerRuntimePort;
import com.my.integrity.domain.port.out.IntegrityEventPort;
import com.my.integrity.domain.port.out.RestoreJournalPort;
import com.my.integrity.domain.port.out.SnapshotRepositoryPort;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 정지 - 파일시스템 교체 - 재시작 - 검증을 하나의 절차로 묶어, 어느 단계에서 실패해도 "복구되지 않음"으로 확정하고 감사 기록을 남기기 위함.
 *
 * <p>복구 후 검증 불일치는 재시도하지 않는다. 손상됐을 수 있는 스냅샷으로 반복 복구하면 침해된 기준선을 가릴 수 있기 때문이다.
 * 정지/시작의 일시적 실패는 런타임 어댑터가 재시도한다.
 */
public class Restorer implements RestoreUseCase {

    private static final Logger log = Logger.getLogger(Restorer.class);

    private final ContainerRuntimePort runtime;
    private final SnapshotRepositoryPort repository;
    private final RestoreJournalPort journal;
    private final IntegrityEventPort events;
    private final ContentHasher hasher;
    private final ClockPort clock;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public Restorer(ContainerRuntimePort runtime,
                    SnapshotRepositoryPort repository,
                    RestoreJournalPort journal,
                    IntegrityEventPort events,
                    ContentHasher hasher,
                    ClockPort clock) {
        this.runtime = runtime;
        this.repository = repository;
        this.journal = journal;
        this.events = events;
        this.hasher = hasher;
        this.clock = clock;
    }

    @Override
    public RestoreOutcome restore(String container, OptionalInt version, boolean force) {
        ContainerNames.requireValid(container);
        Snapshot snapshot = version.isPresent()
                ? repository.findVersion(container, version.getAsInt())
                        .orElseThrow(() -> new SnapshotNotFoundException(container, version.getAsInt()))
                : repository.findLatest(container)
                        .orElseThrow(() -> new SnapshotNotFoundException(container));
        return run(container, snapshot, force, () -> { });
    }

    @Override
    public RestoreOutcome restore(String container, Snapshot snapshot, Runnable onClaimed) {
        return run(container, snapshot, false, onClaimed);
    }

    @Override
    public boolean isRestoring(String container) {
        return inFlight.contains(container)
                || journal.find(container).map(entry -> entry.phase().isActive()).orElse(false);
    }

    @Override
    public List<String> recoverInterrupted() {
        List<String> recovered = new ArrayList<>();
        for (RestoreJournalEntry entry : journal.findAll()) {
            if (!entry.phase().isActive() || inFlight.contains(entry.container())) {
                continue;
            }
            String detail = "프로세스 중단으로 " + entry.phase() + " 단계에서 멈춘 복구";
            journal.record(entry.container(), entry.snapshotVersion(), RestorePhase.FAILED, detail);
            events.append(new IntegrityEvent(entry.container(), clock.now(), EventKind.RESTORE, entry.snapshotVersion(),
                    null, null, null, RestoreStatus.INTERRUPTED, null, detail));
            log.warnf("중단된 복구를 발견해 실패로 고정합니다: %s (%s)", entry.container(), entry.phase());
            recovered.add(entry.container());
        }
        return recovered;
    }

    private RestoreOutcome run(String container, Snapshot snapshot, boolean force, Runnable onClaimed) {
        if (!inFlight.add(container)) {
            throw new RestoreInProgressException(container);
        }
        MDC.put("container", container);
        try {
            Optional<RestoreJournalEntry> open = journal.find(container);
            if (open.isPresent() && open.get().phase().isActive()) {
                if (!force) {
                    throw new RestoreInProgressException(container);
                }
                log.warnf("남아 있는 진행 중 복구 기록(%s)을 무시합니다: %s", open.get().phase(), container);
            }
            onClaimed.run();
            log.infof("복구 시작: %s (스냅샷 v%d)", container, snapshot.version());
            long started = System.nanoTime();
            RestoreOutcome outcome;
            try {
                outcome = execute(container, snapshot, started);
            } catch (RuntimeException e) {
                outcome = outcome(RestoreStatus.INTERRUPTED, snapshot, null, started, e.getMessage());
            }
            try {
                settle(container, snapshot, outcome);
            } finally {
                events.append(IntegrityEvent.restored(container, snapshot.digest(), outcome, clock.now()));
            }
            return outcome;
        } finally {
            inFlight.remove(container);
            MDC.remove("container");
        }
    }

    /** 성공이면 저널을 비우고, 실패면 운영자 조치 전까지 보류로 남긴다. */
    private void settle(String container, Snapshot snapshot, RestoreOutcome outcome) {
        if (outcome.success()) {
            journal.clear(container);
            log.infof("복구 완료: %s (v%d, %dms)", container, snapshot.version(), outcome.elapsed().toMillis());
        } else {
            log.errorf("복구 실패: %s (%s) %s", container, outcome.status(), outcome.detail());
            journal.record(container, snapshot.version(), RestorePhase.FAILED, outcome.detail());
        }
    }

    private RestoreOutcome execute(String container, Snapshot snapshot, long started) {
        ExclusionRules rules = ExclusionRules.of(snapshot.exclusions());
        DigestAlgorithm algorithm = DigestAlgorithm.of(snapshot.algorithm());

        try {
            verifyArchive(snapshot, rules, algorithm);
        } catch (SnapshotCorruptedException e) {
            return outcome(RestoreStatus.CORRUPTED, snapshot, null, started, e.getMessage());
        } catch (RuntimeUnavailableException e) {
            return outcome(RestoreStatus.INTERRUPTED, snapshot, null, started, e.getMessage());
        }

        // 정지 후 재시작 전까지 true. 이 구간에서 단계 기록이 실패하면 컨테이너를 다시 띄운다
        boolean stopped = false;
        try {
            journal.record(container, snapshot.version(), RestorePhase.STOPPING, null);
            try {
                runtime.stop(container);
            } catch (RuntimeException e) {
                return outcome(RestoreStatus.STOP_FAILED, snapshot, null, started, e.getMessage());
            }
            stopped = true;

            journal.record(container, snapshot.version(), RestorePhase.REPLACING, null);
            try (InputStream archive = repository.openArchive(snapshot)) {
                runtime.replaceFilesystem(container, archive);
            } catch (IOException | RuntimeException e) {
                stopped = false;
                rollbackStart(container);
                return outcome(RestoreStatus.REPLACE_FAILED, snapshot, null, started, e.getMessage());
            }

            journal.record(container, snapshot.version(), RestorePhase.STARTING, null);
            stopped = false;
            try {
                runtime.start(container);
            } catch (RuntimeException e) {
                return outcome(RestoreStatus.START_FAILED, snapshot, null, started, e.getMessage());
            }

            journal.record(container, snapshot.version(), RestorePhase.VERIFYING, null);
        } catch (RuntimeException e) {
            if (stopped) {
                rollbackStart(container);
            }
            return outcome(RestoreStatus.INTERRUPTED, snapshot, null, started, "복구 단계 기록 실패: " + e.getMessage());
        }
        return verifyRestored(container, snapshot, rules, algorithm, started);
    }

    private RestoreOutcome verifyRestored(String container, Snapshot snapshot, ExclusionRules rules,
                                          DigestAlgorithm algorithm, long started) {
        TreeDigest observed;
        try (InputStream export = runtime.exportFilesystem(container)) {
            observed = hasher.digest(new TarTreeSource(new BufferedInputStream(export)), rules, algorithm, false);
        } catch (IOException | RuntimeException e) {
            return outcome(RestoreStatus.VERIFICATION_FAILED, snapshot, null, started, "복구 후 검증 불가: " + e.getMessage());
        }
        if (!observed.matches(snapshot.digest())) {
            return outcome(RestoreStatus.VERIFICATION_FAILED, snapshot, observed.hex(), started,
                    "복구 후 다이제스트가 스냅샷과 다릅니다");
        }
        return outcome(RestoreStatus.RESTORED, snapshot, observed.hex(), started, null);
    }

    /** 기준선 시점의 다이제스트를 아카이브에서 재현할 수 없으면 손상으로 본다. */
    private void verifyArchive(Snapshot snapshot, ExclusionRules rules, DigestAlgorithm algorithm) {
        try (InputStream archive = new BufferedInputStream(repository.openArchive(snapshot))) {
            TreeDigest digest = hasher.digest(new TarTreeSource(archive), rules, algorithm, false);
            if (!digest.matches(snapshot.digest())) {
                throw new SnapshotCorruptedException("스냅샷 아카이브가 기록된 다이제스트를 재현하지 못합니다: "
                        + snapshot.container() + " v" + snapshot.version());
            }
        } catch (IOException | UnreadableEntryException e) {
            throw new SnapshotCorruptedException("스냅샷 아카이브를 읽을 수 없습니다: "
                    + snapshot.container() + " v" + snapshot.version(), e);
        }
    }

    private void rollbackStart(String container) {
        try {
            runtime.start(container);
            log.warnf("복구를 마치지 못해 정지했던 컨테이너를 다시 시작했습니다: %s", container);
        } catch (RuntimeException e) {
            log.errorf("복구 중단 후 컨테이너 재시작도 실패했습니다: %s (%s)", container, e.getMessage());
        }
    }

    private RestoreOutcome outcome(RestoreStatus status, Snapshot snapshot, String observedDigest, long startedNanos, String detail) {
        return new RestoreOutcome(status, snapshot.version(), observedDigest,
                Duration.ofNanos(System.nanoTime() - startedNanos), detail);
    }
}
