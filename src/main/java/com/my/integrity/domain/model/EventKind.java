package com.my.integrity.domain.model;

public enum EventKind {
    BASELINE,
    CHECK,
    RESTORE
}
