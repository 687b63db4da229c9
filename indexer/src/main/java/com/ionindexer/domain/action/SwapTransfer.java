package com.ionindexer.domain.action;

import java.math.BigInteger;

/**
 * One leg of a DEX swap. {@code asset} is null for the native coin.
 */
public record SwapTransfer(
        BigInteger amount,
        String source,
        String sourceJettonWallet,
        String destination,
        String destinationJettonWallet,
        String asset
) {
}
