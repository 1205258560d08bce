package com.ledgerindexer.ingestion.pipeline;

import com.ledgerindexer.domain.CheckpointFixtures;
import com.ledgerindexer.domain.LaneUnhealthyEvent;
import com.ledgerindexer.domain.PipelineCompletedEvent;
import com.ledgerindexer.ingestion.config.PipelineProperties;
import com.ledgerindexer.ingestion.handler.LaneHandler;
import com.ledgerindexer.ingestion.handler.TransactionDigestHandler;
import com.ledgerindexer.ingestion.store.TransactionDigestTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineSupervisorTest {

    private static final String FAILING = "lane_a";
    private static final String HEALTHY = TransactionDigestHandler.NAME;

    private PipelineFixture fixture;
    private FailingDigestHandler failingHandler;
    private ExecutorService laneExecutor;
    private ThreadPoolTaskScheduler scheduler;
    private PipelineSupervisor supervisor;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
        fixture.properties.setFirstCheckpoint(1);
        fixture.properties.setLastCheckpoint(12L);
        PipelineProperties.LaneSettings failingSettings = new PipelineProperties.LaneSettings();
        failingSettings.setMaxAttempts(2);
        failingSettings.setBaseDelayMs(10);
        failingSettings.setMaxDelayMs(10);
        fixture.properties.setLanes(Map.of(FAILING, failingSettings));
        LongStream.rangeClosed(1, 12).forEach(seq -> fixture.feed.add(CheckpointFixtures.singleTransaction(seq)));

        failingHandler = new FailingDigestHandler(FAILING, 10L);
        List<LaneHandler<?>> handlers = List.of(failingHandler, new TransactionDigestHandler());
        LaneRegistry registry = new LaneRegistry(handlers, List.of(new TransactionDigestTable()),
                fixture.commitSinkFactory(), fixture.properties, fixture.context);

        laneExecutor = Executors.newCachedThreadPool();
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.initialize();
        supervisor = new PipelineSupervisor(registry, fixture.watermarkStore, fixture.properties, fixture.context,
                laneExecutor, scheduler);
    }

    @AfterEach
    void tearDown() {
        supervisor.stop();
        scheduler.shutdown();
        laneExecutor.shutdownNow();
        fixture.close();
    }

    @Test
    @DisplayName("a lane failing at checkpoint 10 goes unhealthy at watermark 9 while the other lane completes")
    void start_failingLane_isIsolatedAndMarkedUnhealthy() {
        supervisor.start();

        awaitCondition(() -> !fixture.events(PipelineCompletedEvent.class).isEmpty());

        LaneSnapshot failing = supervisor.snapshot(FAILING);
        assertThat(failing.status()).isEqualTo(LaneStatus.UNHEALTHY);
        assertThat(failing.watermark()).isEqualTo(9L);
        assertThat(failing.attempts()).isEqualTo(2);
        assertThat(failing.lastError()).contains("Checkpoint 10");
        assertThat(fixture.watermark(FAILING)).isEqualTo(9L);

        LaneSnapshot healthy = supervisor.snapshot(HEALTHY);
        assertThat(healthy.status()).isEqualTo(LaneStatus.COMPLETED);
        assertThat(fixture.watermark(HEALTHY)).isEqualTo(12L);

        PipelineCompletedEvent completed = fixture.events(PipelineCompletedEvent.class).get(0);
        assertThat(completed.completedLanes()).containsExactly(HEALTHY);
        assertThat(completed.unhealthyLanes()).containsExactly(FAILING);
        assertThat(completed.clean()).isFalse();
        assertThat(fixture.events(LaneUnhealthyEvent.class)).singleElement()
                .satisfies(event -> assertThat(event.lane()).isEqualTo(FAILING));
        assertThat(failingHandler.rejections.get()).isEqualTo(2);
    }

    @Test
    void restart_unhealthyLane_resumesFromWatermark() {
        supervisor.start();
        awaitCondition(() -> supervisor.snapshot(FAILING).status() == LaneStatus.UNHEALTHY);
        failingHandler.heal();

        LaneSnapshot restarted = supervisor.restart(FAILING);

        assertThat(restarted.attempts()).isZero();
        awaitCondition(() -> supervisor.snapshot(FAILING).status() == LaneStatus.COMPLETED);
        assertThat(fixture.watermark(FAILING)).isEqualTo(12L);
        awaitCondition(() -> fixture.events(PipelineCompletedEvent.class).size() == 2);
        assertThat(fixture.events(PipelineCompletedEvent.class).get(1).clean()).isTrue();
    }

    @Test
    void restart_completedLane_isRejected() {
        supervisor.start();
        awaitCondition(() -> supervisor.snapshot(HEALTHY).status() == LaneStatus.COMPLETED);

        assertThatThrownBy(() -> supervisor.restart(HEALTHY))
                .isInstanceOf(LaneNotRestartableException.class);
    }

    @Test
    void restart_unknownLane_throws() {
        supervisor.start();

        assertThatThrownBy(() -> supervisor.restart("no_such_lane"))
                .isInstanceOf(UnknownLaneException.class);
        assertThatThrownBy(() -> supervisor.snapshot("no_such_lane"))
                .isInstanceOf(UnknownLaneException.class);
    }

    @Test
    void start_registersWatermarksBeforeLanesRun() {
        supervisor.start();

        assertThat(supervisor.snapshots()).extracting(LaneSnapshot::name).containsExactly(FAILING, HEALTHY);
        assertThat(fixture.watermarkStore.read(FAILING)).isPresent();
        assertThat(fixture.watermarkStore.read(HEALTHY)).isPresent();
        assertThat(supervisor.isRunning()).isTrue();
    }

    @Test
    @DisplayName("stop commits what each lane buffered and leaves no completion event for an unbounded run")
    void stop_unboundedRun_marksRunningLanesStopped() {
        fixture.properties.setLastCheckpoint(null);
        supervisor.start();
        awaitCondition(() -> supervisor.snapshot(FAILING).status() == LaneStatus.UNHEALTHY);

        supervisor.stop();

        assertThat(supervisor.isRunning()).isFalse();
        LaneSnapshot healthy = supervisor.snapshot(HEALTHY);
        assertThat(healthy.status()).isEqualTo(LaneStatus.STOPPED);
        assertThat(fixture.watermark(HEALTHY)).isEqualTo(healthy.watermark());
        assertThat(supervisor.snapshot(FAILING).status()).isEqualTo(LaneStatus.UNHEALTHY);
        assertThat(fixture.events(PipelineCompletedEvent.class)).isEmpty();
    }

    @Test
    @DisplayName("stopping while a lane backs off cancels its pending relaunch")
    void stop_duringBackoff_laneIsNotRelaunched() throws InterruptedException {
        PipelineProperties.LaneSettings settings = fixture.properties.getLanes().get(FAILING);
        settings.setMaxAttempts(5);
        settings.setBaseDelayMs(300);
        settings.setMaxDelayMs(300);
        supervisor.start();
        awaitCondition(() -> supervisor.snapshot(FAILING).status() == LaneStatus.BACKING_OFF);

        supervisor.stop();
        Thread.sleep(500);

        assertThat(supervisor.snapshot(FAILING).status()).isEqualTo(LaneStatus.STOPPED);
        assertThat(failingHandler.rejections.get()).isEqualTo(1);
        assertThat(fixture.watermark(FAILING)).isEqualTo(9L);
    }

    private static void awaitCondition(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 10 s");
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("interrupted", e);
            }
        }
    }
}
