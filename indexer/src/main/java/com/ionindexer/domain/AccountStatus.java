package com.ionindexer.domain;

/**
 * Account status before/after a transaction. Wire codes are the ordinal positions 0..3.
 */
public enum AccountStatus {
    UNINIT("uninit"),
    FROZEN("frozen"),
    ACTIVE("active"),
    NONEXIST("nonexist");

    private final String code;

    AccountStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
