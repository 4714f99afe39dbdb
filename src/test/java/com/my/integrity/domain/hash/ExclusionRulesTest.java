package com.my.integrity.domain.hash;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExclusionRulesTest {

    @Test
    void absolutePathExcludesItselfAndItsSubtreeOnly() {
        ExclusionRules rules = ExclusionRules.of(List.of("/tmp", "/var/log/"));

        assertThat(rules.excludes("tmp")).isTrue();
        assertThat(rules.excludes("tmp/a/b")).isTrue();
        assertThat(rules.excludes("var/log/syslog")).isTrue();
        assertThat(rules.excludes("tmpfiles.d")).isFalse();
        assertThat(rules.excludes("var/logs")).isFalse();
        assertThat(rules.excludes("etc/tmp")).isFalse();
    }

    @Test
    void globWithoutSlashMatchesFileNameAtAnyDepth() {
        ExclusionRules rules = ExclusionRules.of(List.of("*.log", "core.[0-9]*"));

        assertThat(rules.excludes("b.log")).isTrue();
        assertThat(rules.excludes("srv/app/today.log")).isTrue();
        assertThat(rules.excludes("core.1234")).isTrue();
        assertThat(rules.excludes("a.txt")).isFalse();
        assertThat(rules.excludes("log")).isFalse();
        assertThat(rules.excludes("core.dump")).isFalse();
    }

    @Test
    void globWithSlashMatchesWholeRelativePath() {
        ExclusionRules rules = ExclusionRules.of(List.of("var/cache/**", "/home/*/.cache"));

        assertThat(rules.excludes("var/cache/apt/pkgcache.bin")).isTrue();
        assertThat(rules.excludes("home/alice/.cache")).isTrue();
        assertThat(rules.excludes("home/alice/.cache/thumbs/1.png")).isTrue();
        assertThat(rules.excludes("home/alice/.config")).isFalse();
        assertThat(rules.excludes("srv/var/cache/x")).isFalse();
    }

    @Test
    void matchedDirectoryExcludesEverythingBelowIt() {
        ExclusionRules rules = ExclusionRules.of(List.of("cache*"));

        assertThat(rules.excludes("srv/cache-01")).isTrue();
        assertThat(rules.excludes("srv/cache-01/blob")).isTrue();
        assertThat(rules.excludes("srv/data/blob")).isFalse();
    }

    @Test
    void negatedCharacterClass() {
        ExclusionRules rules = ExclusionRules.of(List.of("run[!0-9]"));

        assertThat(rules.excludes("runx")).isTrue();
        assertThat(rules.excludes("run1")).isFalse();
    }

    @Test
    void patternsAreTrimmedDeduplicatedAndMerged() {
        ExclusionRules rules = ExclusionRules.of(List.of(" /tmp ", "/tmp", "", "*.log"));

        assertThat(rules.patterns()).containsExactly("/tmp", "*.log");
        assertThat(rules.plus(List.of("*.log", "/cache")).patterns()).containsExactly("/tmp", "*.log", "/cache");
    }

    @Test
    void noRulesExcludeNothing() {
        assertThat(ExclusionRules.none().excludes("proc/1/status")).isFalse();
        assertThat(ExclusionRules.none().patterns()).isEmpty();
    }
}
