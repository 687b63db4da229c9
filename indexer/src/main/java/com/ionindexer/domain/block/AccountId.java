package com.ionindexer.domain.block;

import java.util.Locale;
import java.util.Objects;

/**
 * Account (contract) address in raw form: workchain plus 256-bit account hash in hex.
 */
public record AccountId(int workchain, String hashHex) {

    public AccountId {
        Objects.requireNonNull(hashHex, "hashHex");
        hashHex = hashHex.toUpperCase(Locale.ROOT);
    }

    /**
     * Parses {@code "<workchain>:<hex>"}.
     */
    public static AccountId parse(String raw) {
        int sep = raw == null ? -1 : raw.indexOf(':');
        if (sep <= 0 || sep == raw.length() - 1) {
            throw new IllegalArgumentException("Not a raw account address: " + raw);
        }
        return new AccountId(Integer.parseInt(raw.substring(0, sep)), raw.substring(sep + 1));
    }

    /** Canonical string form, e.g. {@code 0:83DF...}. */
    public String asStr() {
        return workchain + ":" + hashHex;
    }

    @Override
    public String toString() {
        return asStr();
    }
}
