package com.ionindexer.domain.action;

import java.math.BigInteger;

/**
 * {@code comment} is UTF-8 text, or base64 of the raw bytes when {@code isEncryptedComment}.
 */
public record JettonTransferData(
        BigInteger queryId,
        String responseDestination,
        BigInteger forwardAmount,
        String customPayload,
        String forwardPayload,
        String comment,
        boolean isEncryptedComment
) {
}
