package com.my.integrity.domain.hash;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;

/**
 * 왜: tar 항목 이름과 호스트 디렉터리 경로를 같은 정규형으로 맞춰, 어느 쪽에서 계산해도 같은 다이제스트가 나오게 하기 위함.
 */
public final class TreePaths {

    /** UTF-8 바이트의 부호 없는 사전식 순서. 플랫폼/로케일과 무관하다. */
    public static final Comparator<String> CANONICAL_ORDER =
            (a, b) -> Arrays.compareUnsigned(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

    private TreePaths() {
    }

    public static String normalize(String raw) {
        String path = raw.replace('\\', '/');
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') {
            start++;
        }
        int end = path.length();
        while (end > start && path.charAt(end - 1) == '/') {
            end--;
        }
        path = path.substring(start, end);
        return ".".equals(path) ? "" : path;
    }

    public static String fileName(String normalized) {
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? normalized : normalized.substring(slash + 1);
    }
}
