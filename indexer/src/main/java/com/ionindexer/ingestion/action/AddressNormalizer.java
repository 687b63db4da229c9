package com.ionindexer.ingestion.action;

import com.ionindexer.domain.block.AccountId;
import com.ionindexer.domain.block.Asset;

/**
 * Canonical string rendering of account and asset references. Null input and the native coin map to null.
 */
public final class AddressNormalizer {

    private AddressNormalizer() {
    }

    public static String address(AccountId account) {
        return account == null ? null : account.asStr();
    }

    /**
     * Jetton master address of {@code asset}; null for the native coin.
     */
    public static String asset(Asset asset) {
        if (asset == null || asset.isNative()) {
            return null;
        }
        return asset.jettonAddress().asStr();
    }
}
