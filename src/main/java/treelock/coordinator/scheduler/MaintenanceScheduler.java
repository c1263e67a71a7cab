package treelock.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.config.CoordinatorConfig;
import treelock.coordinator.metrics.MetricsRecorder;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background jobs:
 * - StaleLockReaper: reclaims locks of dead holders
 * - metrics flush: drains the recorder buffer to the metrics log
 * - advisory expiry: releases unclaimed advisory locks
 * - housekeeping: compacts the metrics log and forgets finished requests
 *
 * Uses a single-threaded executor so that jobs never overlap.
 */
public class MaintenanceScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private static final Duration HOUSEKEEPING_INTERVAL = Duration.ofHours(1);
    private static final Duration FINISHED_RETENTION = Duration.ofMinutes(10);
    private static final Duration MIN_ADVISORY_CHECK = Duration.ofMillis(50);

    private final ScheduledExecutorService executor;
    private final StaleLockReaper reaper;
    private final MetricsRecorder metrics;
    private final AdvisoryLocks advisory;
    private final PriorityScheduler scheduler;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public MaintenanceScheduler(StaleLockReaper reaper, MetricsRecorder metrics, AdvisoryLocks advisory,
            PriorityScheduler scheduler, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "treelock-maintenance");
            t.setDaemon(true);
            return t;
        });
        this.reaper = reaper;
        this.metrics = metrics;
        this.advisory = advisory;
        this.scheduler = scheduler;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Maintenance scheduler already running");
            return;
        }

        running = true;

        long reaperIntervalMs = config.reaperInterval().toMillis();
        executor.scheduleAtFixedRate(reaper, reaperIntervalMs, reaperIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Stale lock reaper scheduled every {}ms", reaperIntervalMs);

        long flushIntervalMs = config.metricsFlushInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("metrics-flush", metrics::flush),
                flushIntervalMs,
                flushIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Metrics flush scheduled every {}ms", flushIntervalMs);

        long advisoryCheckMs = Math.max(MIN_ADVISORY_CHECK.toMillis(), config.advisoryGrace().toMillis() / 4);
        executor.scheduleAtFixedRate(
                wrapRunnable("advisory-expiry", () -> advisory.expire(Instant.now())),
                advisoryCheckMs,
                advisoryCheckMs,
                TimeUnit.MILLISECONDS);

        long housekeepingMs = HOUSEKEEPING_INTERVAL.toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("housekeeping", this::housekeeping),
                housekeepingMs,
                housekeepingMs,
                TimeUnit.MILLISECONDS);

        log.info("Maintenance scheduler started");
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Maintenance scheduler forcefully stopped");
            } else {
                log.info("Maintenance scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        // last buffered events
        metrics.flush();
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public StaleLockReaper reaper() {
        return reaper;
    }

    void housekeeping() {
        int pruned = metrics.compact();
        int forgotten = scheduler.purgeFinished(Instant.now().minus(FINISHED_RETENTION));
        log.debug("Housekeeping: {} metrics line(s) pruned, {} finished request(s) forgotten", pruned, forgotten);
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
