package com.ionindexer.ingestion.trace;

import lombok.Getter;

/**
 * Thrown when a trace cannot be assembled completely. No partial trace is returned.
 */
@Getter
public class TraceAssemblyException extends RuntimeException {

    private final String traceId;

    public TraceAssemblyException(String traceId, String message) {
        super("Trace " + traceId + ": " + message);
        this.traceId = traceId;
    }
}
