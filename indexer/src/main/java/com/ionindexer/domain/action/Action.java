package com.ionindexer.domain.action;

import lombok.Builder;
import lombok.Getter;

import java.math.BigInteger;
import java.util.Set;

/**
 * Canonical summary of one classified block. Built once per block and never mutated.
 * Every field past {@code success} is optional and null when the block type does not define it.
 */
@Getter
@Builder
public class Action {

    private final String traceId;
    private final String type;
    private final String actionId;
    private final Set<String> txHashes;
    private final long startLt;
    private final long endLt;
    private final long startUtime;
    private final long endUtime;
    private final boolean success;

    private final String source;
    private final String sourceSecondary;
    private final String destination;
    private final String destinationSecondary;
    private final BigInteger value;
    private final BigInteger amount;
    private final String asset;
    private final String asset2;
    private final String assetSecondary;
    private final Long opcode;

    private final TonTransferData tonTransferData;
    private final JettonTransferData jettonTransferData;
    private final NftTransferData nftTransferData;
    private final NftMintData nftMintData;
    private final JettonSwapData jettonSwapData;
    private final ChangeDnsRecordData changeDnsRecordData;
}
