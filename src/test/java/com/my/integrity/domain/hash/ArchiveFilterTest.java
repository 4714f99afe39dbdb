package com.my.integrity.domain.hash;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ArchiveFilterTest {

    @Test
    void keepsExcludedDirectoriesEmptyAndDropsExcludedFiles() throws IOException {
        TarBuilder export = new TarBuilder()
                .dir("etc", 0755)
                .file("etc/passwd", 0644, "root:x:0:0\n")
                .dir("tmp", 01777)
                .file("tmp/session", 0600, "secret")
                .dir("tmp/cache", 0700)
                .file("srv/app.log", 0644, "noise")
                .hardlink("srv/app.log.1", 0644, "srv/app.log");
        ExclusionRules rules = ExclusionRules.of(List.of("/tmp", "*.log"));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int written = ArchiveFilter.copy(export.stream(), rules, out);

        Map<String, String> entries = read(out.toByteArray());
        assertThat(entries).containsOnlyKeys("etc/", "etc/passwd", "tmp/", "tmp/cache/", "srv/app.log.1");
        assertThat(entries.get("etc/passwd")).isEqualTo("root:x:0:0\n");
        assertThat(entries.get("srv/app.log.1")).isEqualTo("noise");
        assertThat(written).isEqualTo(5);
    }

    @Test
    void hardlinkToDroppedFileBecomesRegularFile() throws IOException {
        TarBuilder export = new TarBuilder()
                .file("data/a.log", 0640, "payload")
                .hardlink("data/z.txt", 0640, "data/a.log")
                .hardlink("data/zz.txt", 0640, "data/a.log");
        ExclusionRules rules = ExclusionRules.of(List.of("*.log"));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ArchiveFilter.copy(export.stream(), rules, out);

        Map<String, TarArchiveEntry> headers = headers(out.toByteArray());
        assertThat(headers).containsOnlyKeys("data/z.txt", "data/zz.txt");
        assertThat(headers.get("data/z.txt").isFile()).isTrue();
        assertThat(headers.get("data/z.txt").getMode() & 07777).isEqualTo(0640);
        assertThat(headers.get("data/zz.txt").isLink()).isTrue();
        assertThat(headers.get("data/zz.txt").getLinkName()).isEqualTo("data/z.txt");
        assertThat(read(out.toByteArray()).get("data/z.txt")).isEqualTo("payload");
    }

    @Test
    void hardlinkToDroppedFileHashesTheSameBeforeAndAfterFiltering() throws IOException {
        TarBuilder live = new TarBuilder()
                .dir("data", 0755)
                .file("data/a.log", 0644, "payload")
                .hardlink("data/z.txt", 0644, "data/a.log");
        ExclusionRules rules = ExclusionRules.of(List.of("*.log"));
        ContentHasher hasher = new ContentHasher(1);

        byte[] liveTar = live.build();
        ByteArrayOutputStream filtered = new ByteArrayOutputStream();
        ArchiveFilter.copy(new ByteArrayInputStream(liveTar), rules, filtered);

        String fromLive = hasher.digest(new TarTreeSource(new ByteArrayInputStream(liveTar)), rules,
                DigestAlgorithm.SHA256, false).hex();
        String fromArchive = hasher.digest(new TarTreeSource(new ByteArrayInputStream(filtered.toByteArray())), rules,
                DigestAlgorithm.SHA256, false).hex();
        String plainFile = hasher.digest(new TarTreeSource(new TarBuilder()
                        .dir("data", 0755)
                        .file("data/z.txt", 0644, "payload")
                        .stream()), rules,
                DigestAlgorithm.SHA256, false).hex();
        assertThat(fromArchive).isEqualTo(fromLive).isEqualTo(plainFile);
    }

    @Test
    void filteredArchiveHashesLikeTheLiveTree() throws IOException {
        TarBuilder live = new TarBuilder()
                .dir("etc", 0755)
                .file("etc/passwd", 0644, "root:x:0:0\n")
                .dir("var/log", 0755)
                .file("var/log/boot.log", 0640, "boot");
        ExclusionRules rules = ExclusionRules.of(List.of("/var/log"));
        ContentHasher hasher = new ContentHasher(1);

        byte[] liveTar = live.build();
        ByteArrayOutputStream filtered = new ByteArrayOutputStream();
        ArchiveFilter.copy(new ByteArrayInputStream(liveTar), rules, filtered);

        String fromLive = hasher.digest(new TarTreeSource(new ByteArrayInputStream(liveTar)), rules,
                DigestAlgorithm.SHA256, false).hex();
        String fromArchive = hasher.digest(new TarTreeSource(new ByteArrayInputStream(filtered.toByteArray())), rules,
                DigestAlgorithm.SHA256, false).hex();
        assertThat(fromArchive).isEqualTo(fromLive);
    }

    private static Map<String, TarArchiveEntry> headers(byte[] tar) throws IOException {
        Map<String, TarArchiveEntry> entries = new LinkedHashMap<>();
        try (TarArchiveInputStream in = new TarArchiveInputStream(new ByteArrayInputStream(tar))) {
            TarArchiveEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                entries.put(entry.getName(), entry);
            }
        }
        return entries;
    }

    private static Map<String, String> read(byte[] tar) throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        try (TarArchiveInputStream in = new TarArchiveInputStream(new ByteArrayInputStream(tar))) {
            TarArchiveEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                entries.put(entry.getName(), new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
        return entries;
    }
}
