package com.my.integrity.adapter.in.cli;

/**
 * CLI 종료 코드.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int DRIFT = 1;
    public static final int FAILURE = 2;
    public static final int INTERRUPTED = 130;

    private ExitCodes() {
    }
}
