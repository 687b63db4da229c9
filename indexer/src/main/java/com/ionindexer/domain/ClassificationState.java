package com.ionindexer.domain;

/**
 * Trace classification progress. Set to {@link #UNCLASSIFIED} on assembly; the block classifier moves it on.
 */
public enum ClassificationState {
    UNCLASSIFIED("unclassified"),
    OK("ok"),
    FAILED("failed"),
    BROKEN("broken");

    private final String code;

    ClassificationState(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
