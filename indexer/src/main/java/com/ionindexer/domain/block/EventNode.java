package com.ionindexer.domain.block;

/**
 * One transaction contributing to a block. {@code msgHash} is the hash of the originating message, or null.
 */
public record EventNode(long lt, String txHash, String msgHash) {

    public boolean hasMessage() {
        return msgHash != null;
    }
}
