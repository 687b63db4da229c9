package com.ionindexer.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.msgpack.jackson.dataformat.MessagePackFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Wires the decoding and action derivation core: MessagePack mapper for transaction records and the
 * trace-assembly worker pool.
 */
@Configuration
@ComponentScan(basePackages = {
        "com.ionindexer.ingestion.decoder",
        "com.ionindexer.ingestion.trace",
        "com.ionindexer.ingestion.action"
})
@EnableConfigurationProperties(TraceProperties.class)
public class IndexerCoreConfig {

    public static final String MSGPACK_OBJECT_MAPPER = "msgpackObjectMapper";
    public static final String TRACE_ASSEMBLY_EXECUTOR = "trace-assembly-executor";

    @Bean(name = MSGPACK_OBJECT_MAPPER)
    public ObjectMapper msgpackObjectMapper() {
        return new ObjectMapper(new MessagePackFactory());
    }

    @Bean(name = TRACE_ASSEMBLY_EXECUTOR)
    public Executor traceAssemblyExecutor(TraceProperties properties) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(properties.getAssemblyThreads());
        e.setMaxPoolSize(properties.getAssemblyThreads());
        e.setThreadNamePrefix("trace-assembly-");
        e.initialize();
        return e;
    }
}
