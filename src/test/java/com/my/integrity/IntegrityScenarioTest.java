package com.my.integrity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.integrity.adapter.out.audit.JsonLinesIntegrityEventLog;
import com.my.integrity.adapter.out.clock.OffsetClockAdapter;
import com.my.integrity.adapter.out.directory.DirectoryContainerRuntime;
import com.my.integrity.adapter.out.persistence.TestStores;
import com.my.integrity.domain.hash.ContentHasher;
import com.my.integrity.domain.hash.DigestAlgorithm;
import com.my.integrity.domain.hash.ExclusionRules;
import com.my.integrity.domain.model.EventKind;
import com.my.integrity.domain.model.IntegrityEvent;
import com.my.integrity.domain.model.RestoreOutcome;
import com.my.integrity.domain.model.RestoreStatus;
import com.my.integrity.domain.model.Snapshot;
import com.my.integrity.domain.model.Verdict;
import com.my.integrity.domain.port.out.ClockPort;
import com.my.integrity.domain.port.out.RestoreJournalPort;
import com.my.integrity.domain.port.out.SnapshotRepositoryPort;
import com.my.integrity.domain.service.DriftDetector;
import com.my.integrity.domain.service.Restorer;
import com.my.integrity.domain.service.SnapshotService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 디렉터리 런타임과 실제 저장소로 기준선-점검-복구 흐름 전체를 돌린다.
 */
class IntegrityScenarioTest {

    @TempDir
    Path tempDir;

    private Path container;
    private SnapshotService baselines;
    private DriftDetector detector;
    private Restorer restorer;
    private JsonLinesIntegrityEventLog events;

    @BeforeEach
    void setUp() throws Exception {
        Path store = tempDir.resolve("store");
        Path containers = tempDir.resolve("containers");
        container = Files.createDirectories(containers.resolve("web"));
        Files.writeString(container.resolve("a.txt"), "v1");
        Files.writeString(container.resolve("b.log"), "x");

        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        ClockPort clock = OffsetClockAdapter.system("Etc/UTC");
        DataSource dataSource = TestStores.dataSource(store);
        SnapshotRepositoryPort repository = TestStores.snapshots(dataSource, store, objectMapper);
        RestoreJournalPort journal = TestStores.journal(dataSource, clock);
        events = new JsonLinesIntegrityEventLog(store.resolve("events.jsonl"), objectMapper);
        DirectoryContainerRuntime runtime = new DirectoryContainerRuntime(containers);
        ContentHasher hasher = new ContentHasher(2);

        baselines = new SnapshotService(runtime, repository, events, journal, hasher, clock,
                ExclusionRules.of(TestAppConfig.DEFAULT_EXCLUSIONS), DigestAlgorithm.SHA256);
        detector = new DriftDetector(runtime, repository, events, hasher, clock, false);
        restorer = new Restorer(runtime, repository, journal, events, hasher, clock);
    }

    @Test
    void tamperIsDetectedExcludedNoiseIsIgnoredAndRestoreReturnsToBaseline() throws Exception {
        Snapshot baseline = baselines.createBaseline("web", List.of("*.log"));
        String d0 = baseline.digest();

        Files.writeString(container.resolve("a.txt"), "v2");
        assertThat(detector.check("web").verdict()).isEqualTo(Verdict.DRIFT);

        Files.writeString(container.resolve("a.txt"), "v1");
        Files.writeString(container.resolve("b.log"), "rotated");
        assertThat(detector.check("web").verdict()).isEqualTo(Verdict.MATCH);

        Files.writeString(container.resolve("a.txt"), "v2");
        RestoreOutcome outcome = restorer.restore("web", OptionalInt.empty(), false);

        assertThat(outcome.status()).isEqualTo(RestoreStatus.RESTORED);
        assertThat(outcome.observedDigest()).isEqualTo(d0);
        assertThat(Files.readString(container.resolve("a.txt"))).isEqualTo("v1");
        assertThat(detector.check("web").observedDigest()).isEqualTo(d0);
        assertThat(events.recent("web", 10)).extracting(IntegrityEvent::kind)
                .containsExactly(EventKind.BASELINE, EventKind.CHECK, EventKind.CHECK, EventKind.RESTORE, EventKind.CHECK);
    }

    @Test
    void restoringACleanContainerIsHarmless() {
        Snapshot baseline = baselines.createBaseline("web", List.of("*.log"));

        RestoreOutcome first = restorer.restore("web", OptionalInt.empty(), false);
        RestoreOutcome second = restorer.restore("web", OptionalInt.of(baseline.version()), false);

        assertThat(first.status()).isEqualTo(RestoreStatus.RESTORED);
        assertThat(second.status()).isEqualTo(RestoreStatus.RESTORED);
        assertThat(second.observedDigest()).isEqualTo(baseline.digest());
        assertThat(restorer.isRestoring("web")).isFalse();
    }

    @Test
    void newBaselineSupersedesWithoutOverwriting() throws Exception {
        Snapshot first = baselines.createBaseline("web", List.of());
        Files.writeString(container.resolve("a.txt"), "v2");
        Snapshot second = baselines.createBaseline("web", List.of());

        assertThat(second.version()).isEqualTo(first.version() + 1);
        assertThat(second.digest()).isNotEqualTo(first.digest());
        assertThat(detector.check("web").verdict()).isEqualTo(Verdict.MATCH);
        assertThat(baselines.history("web")).extracting(Snapshot::digest).containsExactly(first.digest(), second.digest());

        RestoreOutcome rollback = restorer.restore("web", OptionalInt.of(first.version()), false);

        assertThat(rollback.status()).isEqualTo(RestoreStatus.RESTORED);
        assertThat(Files.readString(container.resolve("a.txt"))).isEqualTo("v1");
        assertThat(detector.check("web").verdict()).isEqualTo(Verdict.DRIFT);
    }
}
