package com.stockalerts.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.stockalerts.cache.PriceCache;
import com.stockalerts.calendar.MarketCalendar;
import com.stockalerts.calendar.MarketCalendarConfig;
import com.stockalerts.condition.ConditionEvaluator;
import com.stockalerts.domain.enums.CycleOutcome;
import com.stockalerts.domain.model.AlertDefinition;
import com.stockalerts.domain.model.AlertKind;
import com.stockalerts.domain.model.AlertTriggerHistory;
import com.stockalerts.domain.model.PriceObservation;
import com.stockalerts.engine.AlertEngineConfig;
import com.stockalerts.engine.AlertEvaluationCycle;
import com.stockalerts.engine.CooldownGate;
import com.stockalerts.engine.CycleReport;
import com.stockalerts.engine.SessionReferenceStore;
import com.stockalerts.exception.DeliveryFailureException;
import com.stockalerts.exception.PriceUnavailableException;
import com.stockalerts.exception.RepositoryUnavailableException;
import com.stockalerts.notification.AlertNotification;
import com.stockalerts.notification.NotificationService;
import com.stockalerts.observability.AlertMetricsService;
import com.stockalerts.repository.AlertRepository;
import com.stockalerts.timeseries.WindowTracker;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for AlertEvaluationCycle with real calendar, windows, evaluator, cooldown gate and
 * session store; only the alert store, price cache and notification delivery are mocked.
 */
@ExtendWith(MockitoExtension.class)
class AlertEvaluationCycleTest {

    /** 10:30 IST on Monday 2026-10-19. */
    private static final Instant NOW = Instant.parse("2026-10-19T05:00:00Z");

    /** 09:16 IST, inside the session-open window. */
    private static final Instant OPENING = Instant.parse("2026-10-19T03:46:00Z");

    /** Sunday. */
    private static final Instant WEEKEND = Instant.parse("2026-10-18T05:00:00Z");

    @Mock
    private AlertRepository alertRepository;

    @Mock
    private PriceCache priceCache;

    @Mock
    private NotificationService notificationService;

    @Mock
    private AlertMetricsService alertMetricsService;

    private WindowTracker windowTracker;
    private SessionReferenceStore sessionReferenceStore;
    private AlertEvaluationCycle cycle;

    @BeforeEach
    void setUp() {
        AlertEngineConfig config = new AlertEngineConfig();
        windowTracker = new WindowTracker(List.of(Duration.ofMinutes(60), Duration.ofMinutes(120)));
        sessionReferenceStore = new SessionReferenceStore();
        cycle = new AlertEvaluationCycle(
                new MarketCalendar(new MarketCalendarConfig()),
                alertRepository,
                priceCache,
                windowTracker,
                new ConditionEvaluator(),
                new CooldownGate(alertRepository, config),
                sessionReferenceStore,
                notificationService,
                alertMetricsService,
                config,
                Runnable::run);
    }

    private static AlertDefinition alert(long id, String symbol, AlertKind kind, String threshold) {
        return AlertDefinition.builder()
                .id(id)
                .ownerKey("user-" + id)
                .symbol(symbol)
                .kind(kind)
                .thresholdPercent(new BigDecimal(threshold))
                .build();
    }

    private static PriceObservation price(String symbol, String price, Instant at) {
        return PriceObservation.builder()
                .symbol(symbol)
                .price(new BigDecimal(price))
                .previousClose(new BigDecimal("1000"))
                .observedAt(at)
                .build();
    }

    @Nested
    @DisplayName("Gating")
    class Gating {

        @Test
        @DisplayName("outside trading hours neither the store nor the feed is touched")
        void marketClosed() {
            CycleReport report = cycle.run(WEEKEND);

            assertThat(report.getOutcome()).isEqualTo(CycleOutcome.SKIPPED_MARKET_CLOSED);
            verifyNoInteractions(alertRepository, priceCache, notificationService);
            assertThat(cycle.getLastReport()).contains(report);
        }

        @Test
        @DisplayName("an unreachable alert store skips the cycle")
        void repositoryDown() {
            when(alertRepository.listActive()).thenThrow(new RepositoryUnavailableException("connection refused", null));

            CycleReport report = cycle.run(NOW);

            assertThat(report.getOutcome()).isEqualTo(CycleOutcome.SKIPPED_REPOSITORY_UNAVAILABLE);
            verifyNoInteractions(priceCache, notificationService);
        }
    }

    @Nested
    @DisplayName("Window alerts")
    class WindowAlerts {

        private final AlertDefinition dropOnY = alert(2L, "YYY", AlertKind.dropWindow(60), "8");

        @BeforeEach
        void seedWindow() {
            windowTracker.observe(price("YYY", "1000", NOW.minus(Duration.ofMinutes(20))));
        }

        @Test
        @DisplayName("a symbol whose price fails is skipped while others fire")
        void isolatesSymbolFailures() {
            AlertDefinition dropOnX = alert(1L, "XXX", AlertKind.dropWindow(60), "8");
            when(alertRepository.listActive()).thenReturn(List.of(dropOnX, dropOnY));
            when(priceCache.get("XXX", NOW)).thenThrow(new PriceUnavailableException("XXX", "HTTP 503"));
            when(priceCache.get("YYY", NOW)).thenReturn(price("YYY", "900", NOW));
            when(alertRepository.recordTrigger(2L, NOW)).thenReturn(true);

            CycleReport report = cycle.run(NOW);

            assertThat(report.getOutcome()).isEqualTo(CycleOutcome.COMPLETED);
            assertThat(report.getFailedSymbols()).containsExactly("XXX");
            assertThat(report.getAlertsFired()).isEqualTo(1);
            assertThat(report.getNotificationsSent()).isEqualTo(1);

            ArgumentCaptor<AlertNotification> sent = ArgumentCaptor.forClass(AlertNotification.class);
            verify(notificationService).deliver(sent.capture());
            assertThat(sent.getValue().getAlertId()).isEqualTo(2L);
            assertThat(sent.getValue().getReferencePrice()).isEqualByComparingTo("1000");
            assertThat(sent.getValue().getMovePercent()).isEqualByComparingTo("-10.00");
            verify(alertRepository, never()).recordTrigger(eq(1L), any());
        }

        @Test
        @DisplayName("a second firing within the cooldown is suppressed")
        void cooldownSuppresses() {
            Instant later = NOW.plus(Duration.ofMinutes(30));
            when(alertRepository.listActive()).thenReturn(List.of(dropOnY));
            when(priceCache.get("YYY", NOW)).thenReturn(price("YYY", "900", NOW));
            when(priceCache.get("YYY", later)).thenReturn(price("YYY", "880", later));
            when(alertRepository.recordTrigger(2L, NOW)).thenReturn(true);

            cycle.run(NOW);
            CycleReport second = cycle.run(later);

            assertThat(second.getAlertsFired()).isEqualTo(1);
            assertThat(second.getSuppressedByCooldown()).isEqualTo(1);
            assertThat(second.getNotificationsSent()).isZero();
            verify(notificationService, times(1)).deliver(any());
        }

        @Test
        @DisplayName("an alert deleted mid-cycle is not notified")
        void deletedAlert() {
            when(alertRepository.listActive()).thenReturn(List.of(dropOnY));
            when(priceCache.get("YYY", NOW)).thenReturn(price("YYY", "900", NOW));
            when(alertRepository.recordTrigger(2L, NOW)).thenReturn(false);

            CycleReport report = cycle.run(NOW);

            assertThat(report.getAlertsFired()).isEqualTo(1);
            assertThat(report.getNotificationsSent()).isZero();
            verifyNoInteractions(notificationService);
            verify(alertRepository, never()).saveTriggerHistory(any());
        }

        @Test
        @DisplayName("a failed trigger write still sends the notification")
        void recordFailureStillSends() {
            when(alertRepository.listActive()).thenReturn(List.of(dropOnY));
            when(priceCache.get("YYY", NOW)).thenReturn(price("YYY", "900", NOW));
            when(alertRepository.recordTrigger(2L, NOW))
                    .thenThrow(new RepositoryUnavailableException("write timed out", null));

            CycleReport report = cycle.run(NOW);

            assertThat(report.getNotificationsSent()).isEqualTo(1);
            ArgumentCaptor<AlertTriggerHistory> history = ArgumentCaptor.forClass(AlertTriggerHistory.class);
            verify(alertRepository).saveTriggerHistory(history.capture());
            assertThat(history.getValue().isCooldownRecorded()).isFalse();
            assertThat(history.getValue().isNotificationSent()).isTrue();
        }

        @Test
        @DisplayName("delivery failures are counted and kept in the trigger history")
        void deliveryFailure() {
            when(alertRepository.listActive()).thenReturn(List.of(dropOnY));
            when(priceCache.get("YYY", NOW)).thenReturn(price("YYY", "900", NOW));
            when(alertRepository.recordTrigger(2L, NOW)).thenReturn(true);
            doThrow(new DeliveryFailureException("Telegram returned HTTP 502"))
                    .when(notificationService)
                    .deliver(any());

            CycleReport report = cycle.run(NOW);

            assertThat(report.getDeliveryFailures()).isEqualTo(1);
            assertThat(report.getNotificationsSent()).isZero();
            verify(alertMetricsService).recordDeliveryFailure();
            ArgumentCaptor<AlertTriggerHistory> history = ArgumentCaptor.forClass(AlertTriggerHistory.class);
            verify(alertRepository).saveTriggerHistory(history.capture());
            assertThat(history.getValue().isNotificationSent()).isFalse();
            assertThat(history.getValue().getErrorMessage()).contains("HTTP 502");
        }

        @Test
        @DisplayName("alerts without window data are not evaluated")
        void noWindowData() {
            AlertDefinition spikeOnZ = alert(3L, "ZZZ", AlertKind.spikeWindow(60), "5");
            when(alertRepository.listActive()).thenReturn(List.of(spikeOnZ));
            when(priceCache.get("ZZZ", NOW)).thenReturn(price("ZZZ", "900", NOW));

            CycleReport report = cycle.run(NOW);

            assertThat(report.getOutcome()).isEqualTo(CycleOutcome.COMPLETED);
            assertThat(report.getAlertsEvaluated()).isZero();
        }

        @Test
        @DisplayName("a cycle past its deadline abandons the remaining symbols and keeps what was sent")
        void deadlineAbandonsRemainingSymbols() throws Exception {
            AlertEngineConfig config = new AlertEngineConfig();
            config.setCycleDeadlineSeconds(1);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            AlertEvaluationCycle boundedCycle = new AlertEvaluationCycle(
                    new MarketCalendar(new MarketCalendarConfig()),
                    alertRepository,
                    priceCache,
                    windowTracker,
                    new ConditionEvaluator(),
                    new CooldownGate(alertRepository, config),
                    sessionReferenceStore,
                    notificationService,
                    alertMetricsService,
                    config,
                    pool);

            CountDownLatch release = new CountDownLatch(1);
            AlertDefinition dropOnZ = alert(3L, "ZZZ", AlertKind.dropWindow(60), "8");
            when(alertRepository.listActive()).thenReturn(List.of(dropOnY, dropOnZ));
            when(priceCache.get("YYY", NOW)).thenReturn(price("YYY", "900", NOW));
            when(priceCache.get("ZZZ", NOW)).thenAnswer(invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return price("ZZZ", "900", NOW);
            });
            when(alertRepository.recordTrigger(2L, NOW)).thenReturn(true);

            try {
                CycleReport report = boundedCycle.run(NOW);

                assertThat(report.getOutcome()).isEqualTo(CycleOutcome.DEADLINE_EXCEEDED);
                assertThat(report.getAbandonedSymbols()).containsExactly("ZZZ");
                assertThat(report.getFailedSymbols()).isEmpty();
                assertThat(report.getNotificationsSent()).isEqualTo(1);
                verify(notificationService, times(1)).deliver(any());
            } finally {
                release.countDown();
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Gap alerts")
    class GapAlerts {

        @Test
        @DisplayName("evaluated once per session inside the opening window")
        void oncePerSession() {
            Instant nextCycle = OPENING.plusSeconds(60);
            AlertDefinition gapUp = alert(5L, "TCS", AlertKind.gapUp(), "2");
            when(alertRepository.listActive()).thenReturn(List.of(gapUp));
            when(priceCache.get("TCS", OPENING)).thenReturn(price("TCS", "1030", OPENING));
            when(priceCache.get("TCS", nextCycle)).thenReturn(price("TCS", "1040", nextCycle));
            when(alertRepository.recordTrigger(5L, OPENING)).thenReturn(true);

            CycleReport first = cycle.run(OPENING);
            CycleReport second = cycle.run(nextCycle);

            assertThat(first.getAlertsFired()).isEqualTo(1);
            assertThat(second.getAlertsEvaluated()).isZero();
            verify(notificationService, times(1)).deliver(any());
        }

        @Test
        @DisplayName("does not fire after the opening window")
        void outsideOpeningWindow() {
            AlertDefinition gapUp = alert(5L, "TCS", AlertKind.gapUp(), "2");
            when(alertRepository.listActive()).thenReturn(List.of(gapUp));
            when(priceCache.get("TCS", NOW)).thenReturn(price("TCS", "1100", NOW));

            CycleReport report = cycle.run(NOW);

            assertThat(report.getAlertsEvaluated()).isEqualTo(1);
            assertThat(report.getAlertsFired()).isZero();
            verifyNoInteractions(notificationService);
        }
    }

    @Test
    @DisplayName("snapshot collection captures the session reference")
    void snapshotsCaptureReference() {
        AlertDefinition gapDown = alert(6L, "INFY", AlertKind.gapDown(), "3");
        when(alertRepository.listActive()).thenReturn(List.of(gapDown));
        when(priceCache.get("INFY", NOW)).thenReturn(price("INFY", "990", NOW));

        int refreshed = cycle.collectSnapshots(NOW);

        assertThat(refreshed).isEqualTo(1);
        assertThat(sessionReferenceStore.find("INFY", LocalDate.parse("2026-10-19")))
                .hasValueSatisfying(ref -> assertThat(ref.getBaseline()).isEqualByComparingTo("1000"));
    }

    @Test
    @DisplayName("a cycle started while another runs is skipped")
    void overlappingCycleSkipped() throws Exception {
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AlertDefinition dropOnY = alert(2L, "YYY", AlertKind.dropWindow(60), "8");
        when(alertRepository.listActive()).thenReturn(List.of(dropOnY));
        when(priceCache.get("YYY", NOW)).thenAnswer(invocation -> {
            fetching.countDown();
            release.await(5, TimeUnit.SECONDS);
            return price("YYY", "990", NOW);
        });

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<CycleReport> first = pool.submit(() -> cycle.run(NOW));
            assertThat(fetching.await(5, TimeUnit.SECONDS)).isTrue();

            CycleReport overlapping = cycle.run(NOW.plusSeconds(1));
            int snapshots = cycle.collectSnapshots(NOW.plusSeconds(1));
            release.countDown();

            assertThat(overlapping.getOutcome()).isEqualTo(CycleOutcome.SKIPPED_OVERLAP);
            assertThat(snapshots).isZero();
            assertThat(first.get(5, TimeUnit.SECONDS).getOutcome()).isEqualTo(CycleOutcome.COMPLETED);
        } finally {
            pool.shutdownNow();
        }
    }
}
