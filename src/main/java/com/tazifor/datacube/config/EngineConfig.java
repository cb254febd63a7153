package com.tazifor.datacube.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tazifor.datacube.export.ArrayJsonWriter;
import com.tazifor.datacube.store.LocalTileStore;
import com.tazifor.datacube.store.TileStore;
import com.tazifor.datacube.store.TileWorkerPool;
import com.tazifor.datacube.udf.GroovyUdfRuntime;
import com.tazifor.datacube.udf.UdfPipeline;
import com.tazifor.datacube.udf.UdfRuntime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the tile worker pool, tile store and udf runtime.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService tileExecutor(EngineProperties properties) {
        int threads = Math.max(1, properties.getWorkers().getThreads());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "tile-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        log.info("tile worker pool: {} threads", threads);
        return Executors.newFixedThreadPool(threads, factory);
    }

    @Bean
    public TileWorkerPool tileWorkerPool(ExecutorService tileExecutor) {
        return new TileWorkerPool(tileExecutor);
    }

    @Bean
    public TileStore tileStore(TileWorkerPool tileWorkerPool) {
        return new LocalTileStore(tileWorkerPool);
    }

    @Bean
    public UdfRuntime udfRuntime() {
        return new GroovyUdfRuntime();
    }

    @Bean
    public UdfPipeline udfPipeline(UdfRuntime udfRuntime, TileStore tileStore, TileWorkerPool tileWorkerPool,
                                   EngineProperties properties) {
        EngineProperties.Udf udf = properties.getUdf();
        return new UdfPipeline(udfRuntime, tileStore, tileWorkerPool, udf.getProjection(),
            udf.getCollapsedTimePolicy(), udf.getCollapsedTimeLabel());
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public ArrayJsonWriter arrayJsonWriter(ObjectMapper objectMapper, EngineProperties properties) {
        return new ArrayJsonWriter(objectMapper, properties.getExport().isPrettyPrint());
    }
}
