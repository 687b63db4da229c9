package com.ionindexer.domain.block;

/**
 * Either the native coin ({@code jettonAddress == null}) or a jetton identified by its master contract.
 */
public record Asset(AccountId jettonAddress) {

    private static final Asset NATIVE = new Asset(null);

    public static Asset nativeCoin() {
        return NATIVE;
    }

    public static Asset jetton(AccountId master) {
        return new Asset(master);
    }

    public boolean isNative() {
        return jettonAddress == null;
    }
}
