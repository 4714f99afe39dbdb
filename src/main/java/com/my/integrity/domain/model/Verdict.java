package com.my.integrity.domain.model;

public enum Verdict {
    MATCH,
    DRIFT
}
