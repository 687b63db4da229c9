package com.ionindexer.domain;

public enum TraceState {
    COMPLETE("complete"),
    PENDING("pending"),
    BROKEN("broken");

    private final String code;

    TraceState(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
