package com.ledgerindexer.ingestion.pipeline;

import com.ledgerindexer.common.RetryPolicy;
import com.ledgerindexer.domain.LaneUnhealthyEvent;
import com.ledgerindexer.domain.PipelineCompletedEvent;
import com.ledgerindexer.domain.Watermark;
import com.ledgerindexer.ingestion.config.PipelineProperties;
import com.ledgerindexer.ingestion.store.WatermarkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts every lane after registering its watermark, restarts failed lanes with backoff, marks lanes unhealthy
 * once they run out of attempts, and stops lanes on shutdown. Lane failures never affect other lanes.
 * Publishes {@link PipelineCompletedEvent} once every lane of a bounded run is completed or unhealthy.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineSupervisor implements SmartLifecycle {

    private final LaneRegistry laneRegistry;
    private final WatermarkStore watermarkStore;
    private final PipelineProperties properties;
    private final PipelineContext context;
    @Qualifier("lane-executor")
    private final Executor laneExecutor;
    private final TaskScheduler taskScheduler;

    private final Map<String, LaneRuntime> lanes = new LinkedHashMap<>();
    private final AtomicBoolean completionPublished = new AtomicBoolean(false);
    private volatile boolean running;

    /**
     * Mutable per-lane supervision state. Guarded by its own monitor.
     */
    private static final class LaneRuntime {
        private final LaneCoordinator<?> coordinator;
        private final RetryPolicy retryPolicy;
        private volatile LaneStatus status = LaneStatus.STARTING;
        private int attempts;
        private long commitsAtLastFailure;
        private String lastError;
        private ScheduledFuture<?> scheduledRestart;
        private volatile CompletableFuture<Void> currentRun = CompletableFuture.completedFuture(null);

        private LaneRuntime(LaneCoordinator<?> coordinator, RetryPolicy retryPolicy) {
            this.coordinator = coordinator;
            this.retryPolicy = retryPolicy;
        }
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        context.reset();
        completionPublished.set(false);
        synchronized (lanes) {
            lanes.clear();
            for (LaneCoordinator<?> coordinator : laneRegistry.lanes()) {
                Watermark registered = watermarkStore.register(coordinator.name(), properties.getFirstCheckpoint());
                coordinator.initWatermark(registered.checkpointHiInclusive());
                PipelineProperties.LaneSettings settings = properties.lane(coordinator.name());
                lanes.put(coordinator.name(), new LaneRuntime(coordinator, new RetryPolicy(settings.getBaseDelayMs(),
                        settings.getMaxDelayMs(), settings.getJitterFactor(), settings.getMaxAttempts())));
            }
        }
        running = true;
        log.info("Pipeline starting {} lane(s) from checkpoint {}{}", lanes.size(), properties.getFirstCheckpoint(),
                properties.getLastCheckpoint() != null ? " to " + properties.getLastCheckpoint() : "");
        for (LaneRuntime lane : runtimes()) {
            synchronized (lane) {
                launch(lane);
            }
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        context.cancel();
        List<LaneRuntime> runtimes = runtimes();
        for (LaneRuntime lane : runtimes) {
            synchronized (lane) {
                if (lane.scheduledRestart != null) {
                    lane.scheduledRestart.cancel(false);
                    lane.scheduledRestart = null;
                }
            }
        }
        long deadline = System.currentTimeMillis() + properties.getShutdownTimeoutMs();
        for (LaneRuntime lane : runtimes) {
            long remaining = Math.max(0, deadline - System.currentTimeMillis());
            try {
                lane.currentRun.get(remaining, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("Lane {} did not stop within {} ms", lane.coordinator.name(), properties.getShutdownTimeoutMs());
            } catch (ExecutionException e) {
                log.warn("Lane {} ended with error during shutdown: {}", lane.coordinator.name(), e.getCause().toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!lane.status.isTerminal()) {
                lane.status = LaneStatus.STOPPED;
            }
        }
        logFinalWatermarks();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Restarts an unhealthy lane with a fresh attempt budget.
     *
     * @throws UnknownLaneException        when no lane has this name
     * @throws LaneNotRestartableException when the lane is not unhealthy
     */
    public LaneSnapshot restart(String laneName) {
        LaneRuntime lane = runtime(laneName);
        synchronized (lane) {
            if (!running || !lane.status.isRestartable()) {
                throw new LaneNotRestartableException(laneName, running ? lane.status : LaneStatus.STOPPED);
            }
            lane.attempts = 0;
            lane.commitsAtLastFailure = lane.coordinator.getCommitCount();
            completionPublished.set(false);
            log.info("Lane {} restarted manually", laneName);
            launch(lane);
        }
        return snapshot(lane);
    }

    public List<LaneSnapshot> snapshots() {
        return runtimes().stream().map(PipelineSupervisor::snapshot).toList();
    }

    public LaneSnapshot snapshot(String laneName) {
        return snapshot(runtime(laneName));
    }

    @Scheduled(fixedDelayString = "${ledgerindexer.pipeline.lag-check-interval-ms:30000}")
    public void monitorLag() {
        if (!running) {
            return;
        }
        for (LaneRuntime lane : runtimes()) {
            if (lane.status == LaneStatus.RUNNING || lane.status == LaneStatus.BACKING_OFF) {
                lane.coordinator.checkLag();
            }
        }
    }

    /** Called with the lane's monitor held, so {@link #stop()} always sees the run it has to wait for. */
    private void launch(LaneRuntime lane) {
        lane.status = LaneStatus.RUNNING;
        lane.currentRun = CompletableFuture.runAsync(() -> runLane(lane), laneExecutor);
    }

    private void runLane(LaneRuntime lane) {
        String name = lane.coordinator.name();
        try {
            LaneStatus result = lane.coordinator.run();
            lane.status = result;
            if (result == LaneStatus.COMPLETED) {
                publishCompletionIfDone();
            } else {
                log.info("Lane {} stopped at watermark {}", name, lane.coordinator.getWatermark());
            }
        } catch (RuntimeException e) {
            onLaneFailed(lane, e);
        }
    }

    private void onLaneFailed(LaneRuntime lane, RuntimeException failure) {
        String name = lane.coordinator.name();
        if (!running || context.isCancelled()) {
            lane.status = LaneStatus.STOPPED;
            log.warn("Lane {} failed during shutdown: {}", name, failure.toString());
            return;
        }
        boolean unhealthy;
        synchronized (lane) {
            long commits = lane.coordinator.getCommitCount();
            if (commits > lane.commitsAtLastFailure) {
                lane.attempts = 0;
            }
            lane.commitsAtLastFailure = commits;
            lane.attempts++;
            lane.lastError = failure.toString();
            unhealthy = !lane.retryPolicy.canRetry(lane.attempts);
            if (unhealthy) {
                lane.status = LaneStatus.UNHEALTHY;
            } else {
                long delay = lane.retryPolicy.delayMs(lane.attempts - 1);
                lane.status = LaneStatus.BACKING_OFF;
                log.warn("Lane {} failed (attempt {}/{}) at watermark {}, restarting in {} ms: {}", name,
                        lane.attempts, lane.retryPolicy.getMaxAttempts(), lane.coordinator.getWatermark(), delay,
                        failure.toString());
                lane.scheduledRestart = taskScheduler.schedule(() -> relaunch(lane), Instant.now().plusMillis(delay));
            }
        }
        if (unhealthy) {
            log.error("Lane {} is UNHEALTHY after {} attempts at watermark {}", name, lane.attempts,
                    lane.coordinator.getWatermark(), failure);
            context.getEventPublisher().publishEvent(new LaneUnhealthyEvent(name, lane.attempts, lane.lastError));
            publishCompletionIfDone();
        }
    }

    private void relaunch(LaneRuntime lane) {
        synchronized (lane) {
            lane.scheduledRestart = null;
            if (!running || lane.status != LaneStatus.BACKING_OFF) {
                return;
            }
            launch(lane);
        }
    }

    private void publishCompletionIfDone() {
        if (properties.getLastCheckpoint() == null) {
            return;
        }
        List<String> completed = new ArrayList<>();
        List<String> unhealthy = new ArrayList<>();
        for (LaneRuntime lane : runtimes()) {
            switch (lane.status) {
                case COMPLETED -> completed.add(lane.coordinator.name());
                case UNHEALTHY -> unhealthy.add(lane.coordinator.name());
                default -> {
                    return;
                }
            }
        }
        if (completionPublished.compareAndSet(false, true)) {
            log.info("Pipeline finished: completed={} unhealthy={}", completed, unhealthy);
            context.getEventPublisher().publishEvent(new PipelineCompletedEvent(completed, unhealthy));
        }
    }

    private void logFinalWatermarks() {
        try {
            for (Watermark watermark : watermarkStore.readAll()) {
                log.info("Final watermark {} = {}", watermark.lane(), watermark.checkpointHiInclusive());
            }
        } catch (DataAccessException e) {
            log.warn("Could not read final watermarks: {}", e.getMessage());
        }
    }

    private LaneRuntime runtime(String laneName) {
        synchronized (lanes) {
            LaneRuntime lane = lanes.get(laneName);
            if (lane == null) {
                throw new UnknownLaneException(laneName);
            }
            return lane;
        }
    }

    private List<LaneRuntime> runtimes() {
        synchronized (lanes) {
            return new ArrayList<>(lanes.values());
        }
    }

    private static LaneSnapshot snapshot(LaneRuntime lane) {
        synchronized (lane) {
            LaneCoordinator<?> c = lane.coordinator;
            return new LaneSnapshot(c.name(), c.kind(), lane.status, c.getWatermark(), lane.attempts, lane.lastError,
                    c.getCommitCount(), c.getSkippedCheckpoints());
        }
    }
}
