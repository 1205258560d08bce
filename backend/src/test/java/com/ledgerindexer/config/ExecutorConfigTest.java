package com.ledgerindexer.config;

import com.ledgerindexer.ingestion.config.ContractProperties;
import com.ledgerindexer.ingestion.config.PipelineProperties;
import com.ledgerindexer.ingestion.handler.ContractEventHandler;
import com.ledgerindexer.ingestion.handler.LaneHandler;
import com.ledgerindexer.ingestion.handler.TransactionDigestHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutorConfigTest {

    private final AsyncConfig config = new AsyncConfig();

    @Test
    @DisplayName("lane executor has one core thread per lane")
    void laneExecutor_sizedByLaneCount() {
        List<LaneHandler<?>> handlers = List.of(new TransactionDigestHandler(),
                new ContractEventHandler(new ContractProperties()));

        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.laneExecutor(handlers);
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(2);
            assertThat(executor.getMaxPoolSize()).isEqualTo(4);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("lane-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void extractionExecutor_usesConfiguredWorkersAndCallerRuns() {
        PipelineProperties properties = new PipelineProperties();
        properties.setExtractionWorkers(3);

        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.extractionExecutor(properties);
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(3);
            assertThat(executor.getMaxPoolSize()).isEqualTo(3);
            assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
        } finally {
            executor.shutdown();
        }
    }
}
