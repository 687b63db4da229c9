package com.ionindexer.ingestion.trace;

import com.ionindexer.domain.Trace;

import java.util.List;
import java.util.Map;

/**
 * Outcome of assembling a batch of traces. {@code failures} maps trace id to the error that aborted it.
 */
public record TraceBatchResult(List<Trace> traces, Map<String, RuntimeException> failures) {

    public TraceBatchResult {
        traces = List.copyOf(traces);
        failures = Map.copyOf(failures);
    }
}
