package com.my.integrity.adapter.out.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.integrity.domain.exception.SnapshotCorruptedException;
import com.my.integrity.domain.model.EntryType;
import com.my.integrity.domain.model.ManifestEntry;
import com.my.integrity.domain.model.Snapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteSnapshotRepositoryTest {

    private static final OffsetDateTime T1 = OffsetDateTime.of(2026, 3, 1, 9, 0, 0, 0, ZoneOffset.ofHours(9));

    @TempDir
    Path storePath;

    private SqliteSnapshotRepository repository;

    @BeforeEach
    void setUp() {
        repository = TestStores.snapshots(TestStores.dataSource(storePath), storePath, new ObjectMapper());
    }

    private Path staged(String content) throws Exception {
        Path file = repository.stagingFile("web");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void versionsAreAssignedInOrderPerContainer() throws Exception {
        Snapshot first = repository.append("web", T1, "aa", "SHA-256", List.of("/tmp"), 3, staged("one"));
        Snapshot second = repository.append("web", T1.plusHours(1), "bb", "SHA-256", List.of("/tmp", "*.log"), 4, staged("two"));
        Snapshot other = repository.append("db", T1, "cc", "SHA-512", List.of(), 1, staged("three"));

        assertThat(first.version()).isEqualTo(1);
        assertThat(second.version()).isEqualTo(2);
        assertThat(other.version()).isEqualTo(1);
        assertThat(repository.findLatest("web")).contains(second);
        assertThat(repository.findVersion("web", 1)).contains(first);
        assertThat(repository.findAll("web")).containsExactly(first, second);
        assertThat(repository.findLatest("cache")).isEmpty();
    }

    @Test
    void metadataRoundTripsExactly() throws Exception {
        repository.append("web", T1, "aa", "SHA-256", List.of("/tmp", "*.log"), 3, staged("one"));

        Snapshot loaded = repository.findLatest("web").orElseThrow();

        assertThat(loaded.createdAt()).isEqualTo(T1);
        assertThat(loaded.exclusions()).containsExactly("/tmp", "*.log");
        assertThat(loaded.algorithm()).isEqualTo("SHA-256");
        assertThat(loaded.entryCount()).isEqualTo(3);
        assertThat(loaded.archive()).isEqualTo("archives/web/v1.tar");
    }

    @Test
    void stagedArchiveIsMovedIntoTheStore() throws Exception {
        Path staged = staged("archive-bytes");

        Snapshot snapshot = repository.append("web", T1, "aa", "SHA-256", List.of(), 1, staged);

        assertThat(staged).doesNotExist();
        assertThat(storePath.resolve(snapshot.archive())).exists();
        try (InputStream in = repository.openArchive(snapshot)) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("archive-bytes");
        }
    }

    @Test
    void missingArchiveIsCorruption() throws Exception {
        Snapshot snapshot = repository.append("web", T1, "aa", "SHA-256", List.of(), 1, staged("x"));
        Path archive = storePath.resolve(snapshot.archive());
        archive.toFile().setWritable(true);
        Files.delete(archive);

        assertThatThrownBy(() -> repository.openArchive(snapshot)).isInstanceOf(SnapshotCorruptedException.class);
    }

    @Test
    void manifestIsWrittenAsJson() throws Exception {
        repository.saveManifest("web", "v1", List.of(
                new ManifestEntry("etc", EntryType.DIRECTORY, 0755, null, null),
                new ManifestEntry("etc/passwd", EntryType.FILE, 0644, "ab12", null)));

        String json = Files.readString(storePath.resolve("manifests/web/v1.json"));
        assertThat(json).contains("\"path\":\"etc/passwd\"").contains("\"contentDigest\":\"ab12\"");
    }
}
