package com.ionindexer.domain.block;

import java.math.BigInteger;

/**
 * Token or coin amount in base units.
 */
public record Amount(BigInteger value) {

    public static Amount of(long value) {
        return new Amount(BigInteger.valueOf(value));
    }
}
