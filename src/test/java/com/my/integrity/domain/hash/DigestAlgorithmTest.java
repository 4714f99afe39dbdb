package com.my.integrity.domain.hash;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DigestAlgorithmTest {

    @Test
    void namesAreCaseInsensitiveRegardlessOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(DigestAlgorithm.of("sha-256")).isEqualTo(DigestAlgorithm.SHA256);
            assertThat(DigestAlgorithm.of("Sha512")).isEqualTo(DigestAlgorithm.SHA512);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void unknownAlgorithmIsRejected() {
        assertThatThrownBy(() -> DigestAlgorithm.of("md5"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("지원하지 않는 다이제스트 알고리즘")
                .hasMessageContaining("md5");
    }
}
