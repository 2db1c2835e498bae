package com.stockalerts.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.stockalerts.engine.AlertEngineConfig;
import com.stockalerts.engine.AlertEvaluationCycle;
import com.stockalerts.engine.EvaluationScheduler;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EvaluationSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T05:00:00Z");

    @Mock
    private AlertEvaluationCycle alertEvaluationCycle;

    private AlertEngineConfig config;
    private EvaluationScheduler scheduler;

    @BeforeEach
    void setUp() {
        config = new AlertEngineConfig();
        scheduler = new EvaluationScheduler(alertEvaluationCycle, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("does not start when the engine is disabled")
    void disabled() {
        config.setEnabled(false);

        scheduler.start();

        assertThat(scheduler.isRunning()).isFalse();
        verifyNoInteractions(alertEvaluationCycle);
    }

    @Test
    @DisplayName("runs the first cycle immediately and stops cleanly")
    void startStop() {
        config.setEnabled(true);
        config.setEvaluationIntervalSeconds(3600);
        config.setSnapshotIntervalSeconds(3600);

        scheduler.start();
        try {
            assertThat(scheduler.isRunning()).isTrue();
            verify(alertEvaluationCycle, timeout(2000)).run(NOW);
        } finally {
            scheduler.stop();
        }
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    @DisplayName("a failing tick is logged and does not propagate")
    void tickSwallowsFailures() {
        when(alertEvaluationCycle.run(NOW)).thenThrow(new IllegalStateException("boom"));
        when(alertEvaluationCycle.collectSnapshots(NOW)).thenThrow(new OutOfMemoryError("simulated"));

        assertThatCode(() -> scheduler.evaluationTick()).doesNotThrowAnyException();
        assertThatCode(() -> scheduler.snapshotTick()).doesNotThrowAnyException();
    }
}
