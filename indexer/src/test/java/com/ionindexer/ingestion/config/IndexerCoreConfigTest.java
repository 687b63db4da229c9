package com.ionindexer.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ionindexer.ingestion.action.ActionService;
import com.ionindexer.ingestion.action.ActionExtractor;
import com.ionindexer.ingestion.decoder.TransactionDecoder;
import com.ionindexer.ingestion.trace.TraceAssemblyService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.msgpack.jackson.dataformat.MessagePackFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = IndexerCoreConfig.class)
class IndexerCoreConfigTest {

    @Autowired
    @Qualifier(IndexerCoreConfig.MSGPACK_OBJECT_MAPPER)
    ObjectMapper msgpackObjectMapper;

    @Autowired
    @Qualifier(IndexerCoreConfig.TRACE_ASSEMBLY_EXECUTOR)
    Executor traceAssemblyExecutor;

    @Autowired
    TraceProperties traceProperties;

    @Autowired
    List<ActionExtractor> extractors;

    @Autowired
    TransactionDecoder transactionDecoder;

    @Autowired
    TraceAssemblyService traceAssemblyService;

    @Autowired
    ActionService actionService;

    @Test
    @DisplayName("properties are bound from application.yml")
    void propertiesBound() {
        assertThat(traceProperties.getAssemblyThreads()).isEqualTo(2);
        assertThat(traceProperties.getMaxTransactions()).isEqualTo(50_000);
    }

    @Test
    void msgpackMapperReadsMessagePack() {
        assertThat(msgpackObjectMapper.getFactory()).isInstanceOf(MessagePackFactory.class);
    }

    @Test
    void executorSizedFromProperties() {
        assertThat(traceAssemblyExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) traceAssemblyExecutor;
        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("trace-assembly-");
    }

    @Test
    @DisplayName("every extractor component is registered")
    void extractorsScanned() {
        assertThat(extractors).hasSize(13);
        assertThat(transactionDecoder).isNotNull();
        assertThat(traceAssemblyService).isNotNull();
        assertThat(actionService).isNotNull();
    }
}
