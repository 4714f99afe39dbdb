package com.my.integrity.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 왜: 사고 이후 포렌식을 위해 경로별 다이제스트를 남기되, 일치 여부 판정은 집계 다이제스트만 사용하도록 분리하기 위함.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManifestEntry(String path, EntryType type, int mode, String contentDigest, String linkTarget) {
}
