package com.my.integrity.domain.service;

import com.my.integrity.domain.exception.RuntimeUnavailableException;
import com.my.integrity.domain.exception.SnapshotNotFoundException;
import com.my.integrity.domain.hash.ArchiveFilter;
import com.my.integrity.domain.hash.ContentHasher;
import com.my.integrity.domain.hash.DigestAlgorithm;
import com.my.integrity.domain.hash.ExclusionRules;
import com.my.integrity.domain.hash.TarTreeSource;
import com.my.integrity.domain.hash.TreeDigest;
import com.my.integrity.domain.model.ContainerNames;
import com.my.integrity.domain.model.IntegrityEvent;
import com.my.integrity.domain.model.RestoreJournalEntry;
import com.my.integrity.domain.model.Snapshot;
import com.my.integrity.domain.port.in.BaselineUseCase;
import com.my.integrity.domain.port.out.ClockPort;
import com.my.integrity.domain.port.out.ContainerRuntimePort;
import com.my.integrity.domain.port.out.IntegrityEventPort;
import com.my.integrity.domain.port.out.RestoreJournalPort;
import com.my.integrity.domain.port.out.SnapshotRepositoryPort;
import org.jboss.logging.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 왜: 컨테이너 파일시스템을 불변 아카이브와 다이제스트로 고정하고 버전을 부여하는 절차를 한 곳에서 보장하기 위함.
 *
 * <p>쓰기(기준선 생성)는 컨테이너 단위로 직렬화되고, 조회는 잠금 없이 수행된다.
 */
public class SnapshotService implements BaselineUseCase {

    private static final Logger log = Logger.getLogger(SnapshotService.class);

    private final ContainerRuntimePort runtime;
    private final SnapshotRepositoryPort repository;
    private final IntegrityEventPort events;
    private final RestoreJournalPort journal;
    private final ContentHasher hasher;
    private final ClockPort clock;
    private final ExclusionRules defaultExclusions;
    private final DigestAlgorithm algorithm;
    private final ConcurrentMap<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    public SnapshotService(ContainerRuntimePort runtime,
                           SnapshotRepositoryPort repository,
                           IntegrityEventPort events,
                           RestoreJournalPort journal,
                           ContentHasher hasher,
                           ClockPort clock,
                           ExclusionRules defaultExclusions,
                           DigestAlgorithm algorithm) {
        this.runtime = runtime;
        this.repository = repository;
        this.events = events;
        this.journal = journal;
        this.hasher = hasher;
        this.clock = clock;
        this.defaultExclusions = defaultExclusions;
        this.algorithm = algorithm;
    }

    @Override
    public Snapshot createBaseline(String container, List<String> extraExclusions) {
        ContainerNames.requireValid(container);
        ReentrantLock lock = writeLocks.computeIfAbsent(container, key -> new ReentrantLock());
        lock.lock();
        try {
            return capture(container, defaultExclusions.plus(extraExclusions));
        } finally {
            lock.unlock();
        }
    }

    private Snapshot capture(String container, ExclusionRules rules) {
        long started = System.nanoTime();
        Path staged = repository.stagingFile(container);
        try {
            try (InputStream export = runtime.exportFilesystem(container);
                 OutputStream out = new BufferedOutputStream(Files.newOutputStream(staged))) {
                ArchiveFilter.copy(new BufferedInputStream(export), rules, out);
            }
            TreeDigest digest;
            try (InputStream archive = new BufferedInputStream(Files.newInputStream(staged))) {
                digest = hasher.digest(new TarTreeSource(archive), rules, algorithm, true);
            }
            Snapshot snapshot = repository.append(container, clock.now(), digest.hex(), algorithm.jcaName,
                    rules.patterns(), digest.entryCount(), staged);
            events.append(IntegrityEvent.baseline(snapshot, elapsedMillis(started)));
            saveManifest(container, snapshot, digest);
            releaseHold(container);
            log.infof("기준선 생성: %s v%d (항목 %d개)", container, snapshot.version(), snapshot.entryCount());
            return snapshot;
        } catch (IOException e) {
            throw new RuntimeUnavailableException("기준선 아카이브 기록 실패: " + container, e);
        } finally {
            discard(staged);
        }
    }

    /** 매니페스트는 진단용이라, 이미 확정된 버전을 실패로 되돌리지 않는다. */
    private void saveManifest(String container, Snapshot snapshot, TreeDigest digest) {
        try {
            repository.saveManifest(container, "v" + snapshot.version(), digest.manifest());
        } catch (RuntimeException e) {
            log.warnf("기준선 매니페스트 저장 실패, 스냅샷은 유지됩니다: %s v%d (%s)",
                    container, snapshot.version(), e.getMessage());
        }
    }

    private void releaseHold(String container) {
        journal.find(container)
                .filter(RestoreJournalEntry::isHold)
                .ifPresent(entry -> {
                    journal.clear(container);
                    log.infof("재기준선으로 복구 실패 보류를 해제합니다: %s", container);
                });
    }

    private void discard(Path staged) {
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            log.warnf("임시 아카이브 삭제 실패: %s (%s)", staged, e.getMessage());
        }
    }

    @Override
    public Snapshot latest(String container) {
        return repository.findLatest(container)
                .orElseThrow(() -> new SnapshotNotFoundException(container));
    }

    @Override
    public Snapshot version(String container, int version) {
        return repository.findVersion(container, version)
                .orElseThrow(() -> new SnapshotNotFoundException(container, version));
    }

    @Override
    public List<Snapshot> history(String container) {
        return repository.findAll(container);
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
