package com.ionindexer.ingestion.decoder;

import lombok.Getter;

/**
 * Thrown when a binary transaction record is malformed: short tuple, wrong arity, wrong value type or
 * out-of-range enum code. Fatal to that record's decode.
 */
@Getter
public class DecodeException extends RuntimeException {

    /** Hash of the offending transaction record; null when it could not be read. */
    private final String recordHash;
    /** Message without the transaction hash suffix. */
    private final String detail;

    public DecodeException(String message, String recordHash) {
        super(withHash(message, recordHash));
        this.recordHash = recordHash;
        this.detail = message;
    }

    public DecodeException(String message, String recordHash, Throwable cause) {
        super(withHash(message, recordHash), cause);
        this.recordHash = recordHash;
        this.detail = message;
    }

    private static String withHash(String message, String recordHash) {
        return recordHash == null ? message : message + " (transaction " + recordHash + ")";
    }
}
