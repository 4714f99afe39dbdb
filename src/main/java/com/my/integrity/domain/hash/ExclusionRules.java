package com.my.integrity.domain.hash;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 정상 운영 중에도 바뀌는 경로(가상 파일시스템, 임시/로그 디렉터리)를 다이제스트에서 제외하는 규칙.
 *
 * <ul>
 *   <li>{@code /proc}: 슬래시로 시작하면 해당 경로와 하위 전체를 제외한다.</li>
 *   <li>{@code *.log}: 슬래시가 없는 글롭은 파일 이름에 대해 매칭한다.</li>
 *   <li>{@code var/cache/**}: 그 외 글롭은 정규화된 상대 경로 전체에 대해 매칭한다.</li>
 * </ul>
 */
public final class ExclusionRules {

    private static final ExclusionRules NONE = new ExclusionRules(List.of());

    private final List<String> patterns;
    private final List<String> prefixes = new ArrayList<>();
    private final List<Pattern> nameGlobs = new ArrayList<>();
    private final List<Pattern> pathGlobs = new ArrayList<>();

    private ExclusionRules(List<String> patterns) {
        this.patterns = List.copyOf(patterns);
        for (String pattern : this.patterns) {
            if (isGlob(pattern)) {
                String glob = TreePaths.normalize(pattern);
                if (glob.indexOf('/') < 0) {
                    nameGlobs.add(globToRegex(glob));
                } else {
                    pathGlobs.add(globToRegex(glob));
                }
            } else {
                String prefix = TreePaths.normalize(pattern);
                if (!prefix.isEmpty()) {
                    prefixes.add(prefix);
                }
            }
        }
    }

    public static ExclusionRules none() {
        return NONE;
    }

    public static ExclusionRules of(List<String> patterns) {
        Set<String> unique = new LinkedHashSet<>();
        for (String pattern : patterns) {
            if (pattern != null && !pattern.isBlank()) {
                unique.add(pattern.trim());
            }
        }
        return new ExclusionRules(new ArrayList<>(unique));
    }

    /** 스냅샷에 기록되는 원본 패턴 목록. */
    public List<String> patterns() {
        return patterns;
    }

    public ExclusionRules plus(List<String> extra) {
        List<String> merged = new ArrayList<>(patterns);
        merged.addAll(extra);
        return of(merged);
    }

    /**
     * 경로 자신이나 상위 디렉터리 중 하나라도 규칙에 걸리면 제외한다.
     */
    public boolean excludes(String relativePath) {
        for (String prefix : prefixes) {
            if (relativePath.equals(prefix) || relativePath.startsWith(prefix + "/")) {
                return true;
            }
        }
        if (nameGlobs.isEmpty() && pathGlobs.isEmpty()) {
            return false;
        }
        int end = relativePath.length();
        while (end > 0) {
            String candidate = relativePath.substring(0, end);
            if (matchesGlob(candidate)) {
                return true;
            }
            end = candidate.lastIndexOf('/');
        }
        return false;
    }

    private boolean matchesGlob(String path) {
        String name = TreePaths.fileName(path);
        for (Pattern glob : nameGlobs) {
            if (glob.matcher(name).matches()) {
                return true;
            }
        }
        for (Pattern glob : pathGlobs) {
            if (glob.matcher(path).matches()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isGlob(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0 || pattern.indexOf('[') >= 0;
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i += 2;
                    continue;
                }
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else if (c == '[') {
                int close = glob.indexOf(']', i + 1);
                if (close < 0) {
                    regex.append("\\[");
                } else {
                    String members = glob.substring(i + 1, close);
                    if (members.startsWith("!")) {
                        members = "^" + members.substring(1);
                    }
                    regex.append('[').append(members).append(']');
                    i = close;
                }
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(regex.toString());
    }

    @Override
    public String toString() {
        return "ExclusionRules" + patterns;
    }
}
