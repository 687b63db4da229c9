package com.ionindexer.ingestion.trace;

import lombok.Getter;

/**
 * Thrown when a transaction referenced by an outbound message (or the root itself) is absent from the lookup table.
 */
@Getter
public class MissingTransactionException extends TraceAssemblyException {

    private final String missingHash;
    /** Transaction whose outbound message points at the missing hash; null when the root is missing. */
    private final String parentHash;

    public MissingTransactionException(String traceId, String missingHash, String parentHash) {
        super(traceId, parentHash == null
                ? "root transaction " + missingHash + " not found"
                : "transaction for message " + missingHash + " (emitted by " + parentHash + ") not found");
        this.missingHash = missingHash;
        this.parentHash = parentHash;
    }
}
