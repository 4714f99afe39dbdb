package com.my.integrity.domain.hash;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

public enum DigestAlgorithm {
    SHA256("SHA-256"),
    SHA384("SHA-384"),
    SHA512("SHA-512");

    public final String jcaName;

    DigestAlgorithm(String jcaName) {
        this.jcaName = jcaName;
    }

    public static DigestAlgorithm of(String s) {
        return switch (s.toUpperCase(Locale.ROOT)) {
            case "SHA-256", "SHA256" -> SHA256;
            case "SHA-384", "SHA384" -> SHA384;
            case "SHA-512", "SHA512" -> SHA512;
            default -> throw new IllegalArgumentException("지원하지 않는 다이제스트 알고리즘입니다: " + s);
        };
    }

    public MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(jcaName);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JCA에 다이제스트 알고리즘이 없습니다: " + jcaName, e);
        }
    }
}
