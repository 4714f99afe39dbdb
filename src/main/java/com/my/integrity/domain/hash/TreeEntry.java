package com.my.integrity.domain.hash;

import com.my.integrity.domain.model.EntryType;

import java.util.Objects;

/**
 * 트리 소스가 방문하는 단일 항목. {@code path}는 {@link TreePaths#normalize(String)}를 거친 상대 경로다.
 * {@code linkTarget}은 심볼릭 링크의 대상 문자열, 하드 링크는 같은 트리 안의 대상 경로다.
 */
public record TreeEntry(String path, EntryType type, int mode, String linkTarget) {
    public TreeEntry {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(type, "type");
    }
}
