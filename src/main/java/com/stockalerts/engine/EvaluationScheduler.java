package com.stockalerts.engine;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Drives the alert engine on a single dedicated thread.
 *
 * <p>Two fixed-rate tasks share the thread: evaluation cycles every
 * {@code evaluationIntervalSeconds} and price snapshots every {@code snapshotIntervalSeconds}.
 * Because there is one thread the tasks never run concurrently; a late tick runs as soon as
 * the previous one returns. A tick that throws is logged and the schedule carries on.
 */
@Component
public class EvaluationScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(EvaluationScheduler.class);

    private final AlertEvaluationCycle alertEvaluationCycle;
    private final AlertEngineConfig alertEngineConfig;
    private final Clock clock;

    private ScheduledExecutorService executor;
    private volatile boolean running;

    public EvaluationScheduler(
            AlertEvaluationCycle alertEvaluationCycle, AlertEngineConfig alertEngineConfig, Clock clock) {
        this.alertEvaluationCycle = alertEvaluationCycle;
        this.alertEngineConfig = alertEngineConfig;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!alertEngineConfig.isEnabled()) {
            log.info("Alert engine disabled (alert-engine.enabled=false), scheduler not started");
            return;
        }

        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "alert-engine-scheduler");
            thread.setDaemon(true);
            return thread;
        });

        long interval = alertEngineConfig.getEvaluationIntervalSeconds();
        long snapshotInterval = alertEngineConfig.getSnapshotIntervalSeconds();
        executor.scheduleAtFixedRate(this::evaluationTick, 0, interval, TimeUnit.SECONDS);
        executor.scheduleAtFixedRate(this::snapshotTick, snapshotInterval, snapshotInterval, TimeUnit.SECONDS);
        running = true;

        log.info("Alert engine scheduler started: evaluation every {}s, snapshots every {}s", interval, snapshotInterval);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Alert engine scheduler did not stop within 30s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        running = false;
        log.info("Alert engine scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** Visible for testing. */
    public void evaluationTick() {
        try {
            alertEvaluationCycle.run(clock.instant());
        } catch (Throwable t) {
            log.error("Evaluation tick failed", t);
        }
    }

    /** Visible for testing. */
    public void snapshotTick() {
        try {
            alertEvaluationCycle.collectSnapshots(clock.instant());
        } catch (Throwable t) {
            log.error("Snapshot tick failed", t);
        }
    }
}
