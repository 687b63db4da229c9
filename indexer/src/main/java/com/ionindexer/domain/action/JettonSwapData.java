package com.ionindexer.domain.action;

public record JettonSwapData(
        String dex,
        String sender,
        SwapTransfer dexIncomingTransfer,
        SwapTransfer dexOutgoingTransfer
) {
}
