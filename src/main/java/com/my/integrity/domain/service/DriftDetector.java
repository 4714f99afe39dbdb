package com.my.integrity.domain.service;

import com.my.integrity.domain.exception.RuntimeUnavailableException;
import com.my.integrity.domain.exception.SnapshotNotFoundException;
import com.my.integrity.domain.hash.ContentHasher;
import com.my.integrity.domain.hash.DigestAlgorithm;
import com.my.integrity.domain.hash.ExclusionRules;
import com.my.integrity.domain.hash.TarTreeSource;
import com.my.integrity.domain.hash.TreeDigest;
import com.my.integrity.domain.model.CheckResult;
import com.my.integrity.domain.model.IntegrityEvent;
import com.my.integrity.domain.model.Snapshot;
import com.my.integrity.domain.model.Verdict;
import com.my.integrity.domain.port.in.CheckIntegrityUseCase;
import com.my.integrity.domain.port.out.ClockPort;
import com.my.integrity.domain.port.out.ContainerRuntimePort;
import com.my.integrity.domain.port.out.IntegrityEventPort;
import com.my.integrity.domain.port.out.SnapshotRepositoryPort;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 실행 중인 컨테이너의 다이제스트를 기준선과 같은 정규화 규칙으로 다시 계산해 일치 여부만 판정하기 위함.
 *
 * <p>파일별 차이를 로그로 남기지 않는다. 로그를 볼 수 있는 공격자에게 어떤 파일이 탐지됐는지 알리지 않기 위해서다.
 * 다이제스트 전체는 감사 기록에만 남긴다. 상세 모드에서는 경로별 매니페스트를 저장소에 따로 보관한다.
 */
public class DriftDetector implements CheckIntegrityUseCase {

    private static final Logger log = Logger.getLogger(DriftDetector.class);

    private final ContainerRuntimePort runtime;
    private final SnapshotRepositoryPort repository;
    private final IntegrityEventPort events;
    private final ContentHasher hasher;
    private final ClockPort clock;
    private final boolean verbose;

    public DriftDetector(ContainerRuntimePort runtime,
                         SnapshotRepositoryPort repository,
                         IntegrityEventPort events,
                         ContentHasher hasher,
                         ClockPort clock,
                         boolean verbose) {
        this.runtime = runtime;
        this.repository = repository;
        this.events = events;
        this.hasher = hasher;
        this.clock = clock;
        this.verbose = verbose;
    }

    @Override
    public CheckResult check(String container) {
        long started = System.nanoTime();
        Snapshot expected = null;
        MDC.put("container", container);
        try {
            expected = repository.findLatest(container)
                    .orElseThrow(() -> new SnapshotNotFoundException(container));
            TreeDigest observed = digestLive(container, expected);
            Verdict verdict = observed.matches(expected.digest()) ? Verdict.MATCH : Verdict.DRIFT;
            CheckResult result = new CheckResult(container, expected.version(), expected.digest(), observed.hex(), verdict);
            if (verbose) {
                repository.saveManifest(container, "observed-" + clock.now().toInstant().toEpochMilli(), observed.manifest());
            }
            events.append(IntegrityEvent.checked(result, clock.now(), elapsedMillis(started)));
            if (result.drifted()) {
                log.warnf("무결성 위반 감지: %s (기준선 v%d)", container, expected.version());
            } else {
                log.debugf("무결성 확인: %s (기준선 v%d)", container, expected.version());
            }
            return result;
        } catch (RuntimeException e) {
            events.append(IntegrityEvent.checkFailed(container, expected, clock.now(), elapsedMillis(started), e.getMessage()));
            throw e;
        } finally {
            MDC.remove("container");
        }
    }

    private TreeDigest digestLive(String container, Snapshot expected) {
        ExclusionRules rules = ExclusionRules.of(expected.exclusions());
        DigestAlgorithm algorithm = DigestAlgorithm.of(expected.algorithm());
        try (InputStream export = runtime.exportFilesystem(container)) {
            return hasher.digest(new TarTreeSource(new BufferedInputStream(export)), rules, algorithm, verbose);
        } catch (IOException e) {
            throw new RuntimeUnavailableException("export 스트림을 닫지 못했습니다: " + container, e);
        }
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
