package com.ionindexer.domain;

/**
 * Parent to child link: {@code msgHash} is an outbound message of {@code leftTx} and the inbound message of {@code rightTx}.
 */
public record TraceEdge(String leftTx, String rightTx, String msgHash, String traceId) {
}
