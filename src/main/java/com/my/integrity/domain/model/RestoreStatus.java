package com.my.integrity.domain.model;

/**
 * 왜: 복구 실패 원인을 단계별로 구분해 운영자가 재기준선이 필요한지(손상) 재시도로 충분한지 판단하게 하기 위함.
 */
public enum RestoreStatus {
    RESTORED,
    STOP_FAILED,
    REPLACE_FAILED,
    START_FAILED,
    VERIFICATION_FAILED,
    CORRUPTED,
    INTERRUPTED
}
