package com.ionindexer.domain.action;

import java.math.BigInteger;

/**
 * {@code price} is set only for purchases.
 */
public record NftTransferData(
        BigInteger queryId,
        boolean isPurchase,
        BigInteger price,
        BigInteger nftItemIndex,
        BigInteger forwardAmount,
        String customPayload,
        String forwardPayload,
        String responseDestination
) {
}
