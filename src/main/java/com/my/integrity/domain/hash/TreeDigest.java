package com.my.integrity.domain.hash;

import com.my.integrity.domain.model.ManifestEntry;

import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

public record TreeDigest(DigestAlgorithm algorithm, String hex, int entryCount, List<ManifestEntry> manifest) {

    public TreeDigest {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(hex, "hex");
        manifest = List.copyOf(manifest);
    }

    /** 16진 문자열이 아닌 디코딩된 바이트를 상수 시간으로 비교한다. */
    public boolean matches(String expectedHex) {
        return sameDigest(hex, expectedHex);
    }

    private static boolean sameDigest(String left, String right) {
        if (left == null || right == null) {
            return false;
        }
        try {
            return MessageDigest.isEqual(HexFormat.of().parseHex(left), HexFormat.of().parseHex(right));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
