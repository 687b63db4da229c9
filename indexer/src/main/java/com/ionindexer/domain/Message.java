package com.ionindexer.domain;

/**
 * One value/data transfer attached to exactly one transaction.
 * External messages leave source (inbound) or destination (outbound) and most fee fields null.
 */
public record Message(
        String msgHash,
        String txHash,
        long txLt,
        MessageDirection direction,
        String source,
        String destination,
        Long value,
        Long fwdFee,
        Long ihrFee,
        Long createdLt,
        Long createdAt,
        Long opcode,
        Boolean ihrDisabled,
        Boolean bounce,
        Boolean bounced,
        Long importFee,
        MessageContent messageContent,
        MessageContent initState
) {

    public boolean isOutbound() {
        return direction == MessageDirection.OUT;
    }
}
