package com.ionindexer.domain;

/**
 * Account status change produced by the storage or action phase. Wire codes 0 = unchanged, 1 = frozen, 2 = deleted.
 */
public enum StatusChange {
    UNCHANGED("unchanged"),
    FROZEN("frozen"),
    DELETED("deleted");

    private final String code;

    StatusChange(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
