package com.ionindexer.domain;

import java.util.List;

/**
 * All transactions reachable from the root transaction {@code traceId}, plus the edges linking them.
 */
public record Trace(
        String traceId,
        List<Transaction> transactions,
        List<TraceEdge> edges,
        ClassificationState classificationState,
        TraceState state
) {

    public Trace {
        transactions = List.copyOf(transactions);
        edges = List.copyOf(edges);
    }
}
