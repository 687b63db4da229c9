package com.ionindexer.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Trace assembly limits and batch parallelism.
 */
@ConfigurationProperties(prefix = "ionindexer.trace")
@NoArgsConstructor
@Getter
@Setter
public class TraceProperties {

    /** Upper bound on transactions in one trace; assembly aborts beyond it. Default 100000. */
    private int maxTransactions = 100_000;

    /** Worker threads for assembling independent traces of a batch. Default 4. */
    private int assemblyThreads = 4;
}
