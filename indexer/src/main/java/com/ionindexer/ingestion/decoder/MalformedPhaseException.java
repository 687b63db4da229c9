package com.ionindexer.ingestion.decoder;

/**
 * Thrown when the transaction description (storage/credit/compute/action phases) does not match its positional layout.
 */
public class MalformedPhaseException extends DecodeException {

    public MalformedPhaseException(String message, String recordHash) {
        super(message, recordHash);
    }

    public MalformedPhaseException(String message, String recordHash, Throwable cause) {
        super(message, recordHash, cause);
    }
}
