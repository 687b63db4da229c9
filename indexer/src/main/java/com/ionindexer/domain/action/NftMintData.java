package com.ionindexer.domain.action;

import java.math.BigInteger;

public record NftMintData(BigInteger nftItemIndex) {
}
