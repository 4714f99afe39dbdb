package com.my.integrity.domain.model;

/**
 * 왜: 변조 감지 시 자동 복구할지 경보만 남길지를 컨테이너 단위로 선택하기 위함.
 */
public enum MonitorPolicy {
    DETECT_ONLY,
    AUTO_RESTORE
}
