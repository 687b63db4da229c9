package com.ionindexer.ingestion.trace;

import com.ionindexer.domain.Trace;
import com.ionindexer.ingestion.config.IndexerCoreConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Assembles batches of independent traces in parallel. Each trace succeeds or fails on its own;
 * a failed trace is logged and reported, never returned partially.
 */
@Service
@Slf4j
public class TraceAssemblyService {

    private final TraceAssembler traceAssembler;
    private final Executor executor;

    public TraceAssemblyService(TraceAssembler traceAssembler,
                                @Qualifier(IndexerCoreConfig.TRACE_ASSEMBLY_EXECUTOR) Executor executor) {
        this.traceAssembler = traceAssembler;
        this.executor = executor;
    }

    /**
     * @param recordsByTrace trace id to that trace's read-only record lookup table
     */
    public TraceBatchResult assembleAll(Map<String, Map<String, byte[]>> recordsByTrace) {
        Map<String, CompletableFuture<Trace>> futures = new LinkedHashMap<>();
        recordsByTrace.forEach((traceId, records) -> futures.put(traceId,
                CompletableFuture.supplyAsync(() -> traceAssembler.assemble(traceId, records), executor)));

        List<Trace> traces = new ArrayList<>();
        Map<String, RuntimeException> failures = new LinkedHashMap<>();
        futures.forEach((traceId, future) -> {
            try {
                traces.add(future.join());
            } catch (CompletionException e) {
                RuntimeException cause = e.getCause() instanceof RuntimeException re ? re : e;
                log.error("Trace assembly failed for {}: {}", traceId, cause.getMessage(), cause);
                failures.put(traceId, cause);
            }
        });
        log.debug("Assembled {} of {} traces", traces.size(), recordsByTrace.size());
        return new TraceBatchResult(traces, failures);
    }
}
