package com.ledgerindexer.config;

import com.ledgerindexer.ingestion.config.PipelineProperties;
import com.ledgerindexer.ingestion.handler.LaneHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Named thread pools: lane-executor runs one coordinator per lane, extraction-executor is the bounded extraction
 * pool shared by all lanes. Both keep accepting tasks after context close so lanes can drain during shutdown.
 */
@Configuration
public class AsyncConfig {

    public static final String LANE_EXECUTOR = "lane-executor";
    public static final String EXTRACTION_EXECUTOR = "extraction-executor";

    /** One thread per lane, plus headroom for a restarted lane whose previous run is still unwinding. */
    @Bean(name = LANE_EXECUTOR)
    public Executor laneExecutor(List<LaneHandler<?>> handlers) {
        int lanes = Math.max(1, handlers.size());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(lanes);
        e.setMaxPoolSize(lanes * 2);
        e.setQueueCapacity(lanes);
        e.setThreadNamePrefix("lane-");
        e.setAcceptTasksAfterContextClose(true);
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.initialize();
        return e;
    }

    /** Saturation runs the extraction on the submitting lane thread, which throttles that lane's intake. */
    @Bean(name = EXTRACTION_EXECUTOR)
    public Executor extractionExecutor(PipelineProperties properties) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(properties.getExtractionWorkers());
        e.setMaxPoolSize(properties.getExtractionWorkers());
        e.setQueueCapacity(properties.getExtractionQueueCapacity());
        e.setThreadNamePrefix("extract-");
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        e.setAcceptTasksAfterContextClose(true);
        e.initialize();
        return e;
    }
}
