package com.stockalerts.engine;

import com.stockalerts.cache.PriceCache;
import com.stockalerts.calendar.MarketCalendar;
import com.stockalerts.condition.ConditionContext;
import com.stockalerts.condition.ConditionEvaluator;
import com.stockalerts.condition.ConditionResult;
import com.stockalerts.domain.enums.CycleOutcome;
import com.stockalerts.domain.enums.CyclePhase;
import com.stockalerts.domain.enums.EvaluationReason;
import com.stockalerts.domain.model.AlertDefinition;
import com.stockalerts.domain.model.AlertKind;
import com.stockalerts.domain.model.AlertTriggerHistory;
import com.stockalerts.domain.model.PriceObservation;
import com.stockalerts.domain.model.SessionReference;
import com.stockalerts.domain.model.WindowStats;
import com.stockalerts.exception.DeliveryFailureException;
import com.stockalerts.exception.NoWindowDataException;
import com.stockalerts.exception.PriceUnavailableException;
import com.stockalerts.exception.RepositoryUnavailableException;
import com.stockalerts.marketdata.SymbolNormalizer;
import com.stockalerts.notification.AlertNotification;
import com.stockalerts.notification.NotificationService;
import com.stockalerts.observability.AlertMetricsService;
import com.stockalerts.repository.AlertRepository;
import com.stockalerts.timeseries.WindowTracker;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * One pass of the alert engine over all active alerts.
 *
 * <p>Phases: IDLE -> GATING -> FETCHING -> EVALUATING -> DISPATCHING -> IDLE.
 * <ol>
 *   <li>GATING: outside trading hours the cycle ends without reading the store or the feed.</li>
 *   <li>FETCHING: active alerts are listed (a store failure skips the cycle), the cooldown gate
 *       is primed, alerts are grouped by symbol and each symbol's price is requested on the
 *       fetch pool.</li>
 *   <li>EVALUATING / DISPATCHING: symbols are taken in listing order. Each symbol's alerts are
 *       evaluated sequentially and fired alerts that pass the cooldown are recorded and then
 *       notified before the next symbol starts.</li>
 * </ol>
 *
 * <p>Failures are isolated per symbol and per alert. A cycle that runs past its deadline
 * abandons the symbols it has not reached; notifications already sent stand.
 *
 * <p>Cycles never overlap: {@link #run} and {@link #collectSnapshots} share one lock and a
 * caller that cannot take it returns immediately.
 */
@Service
public class AlertEvaluationCycle {

    private static final Logger log = LoggerFactory.getLogger(AlertEvaluationCycle.class);

    private final MarketCalendar marketCalendar;
    private final AlertRepository alertRepository;
    private final PriceCache priceCache;
    private final WindowTracker windowTracker;
    private final ConditionEvaluator conditionEvaluator;
    private final CooldownGate cooldownGate;
    private final SessionReferenceStore sessionReferenceStore;
    private final NotificationService notificationService;
    private final AlertMetricsService alertMetricsService;
    private final AlertEngineConfig alertEngineConfig;
    private final Executor priceFetchExecutor;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();
    private volatile CyclePhase phase = CyclePhase.IDLE;

    public AlertEvaluationCycle(
            MarketCalendar marketCalendar,
            AlertRepository alertRepository,
            PriceCache priceCache,
            WindowTracker windowTracker,
            ConditionEvaluator conditionEvaluator,
            CooldownGate cooldownGate,
            SessionReferenceStore sessionReferenceStore,
            NotificationService notificationService,
            AlertMetricsService alertMetricsService,
            AlertEngineConfig alertEngineConfig,
            @Qualifier("priceFetchExecutor") Executor priceFetchExecutor) {
        this.marketCalendar = marketCalendar;
        this.alertRepository = alertRepository;
        this.priceCache = priceCache;
        this.windowTracker = windowTracker;
        this.conditionEvaluator = conditionEvaluator;
        this.cooldownGate = cooldownGate;
        this.sessionReferenceStore = sessionReferenceStore;
        this.notificationService = notificationService;
        this.alertMetricsService = alertMetricsService;
        this.alertEngineConfig = alertEngineConfig;
        this.priceFetchExecutor = priceFetchExecutor;
    }

    /**
     * Runs one evaluation cycle as of {@code now}. Never throws.
     */
    public CycleReport run(Instant now) {
        if (!lock.tryLock()) {
            log.warn("Evaluation cycle at {} skipped: previous cycle still running ({})", now, phase);
            alertMetricsService.recordCycle(CycleOutcome.SKIPPED_OVERLAP, null);
            return CycleReport.skipped(now, CycleOutcome.SKIPPED_OVERLAP);
        }

        long startNanos = System.nanoTime();
        CycleReport report;
        try {
            report = execute(now, startNanos);
        } catch (RuntimeException e) {
            log.error("Evaluation cycle at {} failed unexpectedly", now, e);
            report = CycleReport.builder()
                    .startedAt(now)
                    .outcome(CycleOutcome.FAILED)
                    .durationMillis(elapsedMillis(startNanos))
                    .build();
        } finally {
            phase = CyclePhase.IDLE;
            lock.unlock();
        }

        lastReport.set(report);
        alertMetricsService.recordCycle(report.getOutcome(), Duration.ofMillis(report.getDurationMillis()));
        if (report.getOutcome() == CycleOutcome.COMPLETED || report.getOutcome() == CycleOutcome.DEADLINE_EXCEEDED) {
            log.info(
                    "Cycle {} in {}ms: {} alerts on {} symbols, {} evaluated, {} fired, {} suppressed, {} sent,"
                            + " {} delivery failures, failed symbols {}, abandoned {}",
                    report.getOutcome(),
                    report.getDurationMillis(),
                    report.getActiveAlerts(),
                    report.getSymbols(),
                    report.getAlertsEvaluated(),
                    report.getAlertsFired(),
                    report.getSuppressedByCooldown(),
                    report.getNotificationsSent(),
                    report.getDeliveryFailures(),
                    report.getFailedSymbols(),
                    report.getAbandonedSymbols());
        }
        return report;
    }

    /**
     * Refreshes prices for every symbol with an active alert so rolling windows keep receiving
     * observations between evaluation cycles. Skipped while a cycle runs or the market is closed.
     *
     * @return number of symbols refreshed
     */
    public int collectSnapshots(Instant now) {
        if (!lock.tryLock()) {
            log.debug("Snapshot collection at {} skipped: cycle in progress", now);
            return 0;
        }
        try {
            if (!marketCalendar.isTradingNow(now)) {
                return 0;
            }
            List<AlertDefinition> alerts;
            try {
                alerts = alertRepository.listActive();
            } catch (RepositoryUnavailableException e) {
                log.warn("Snapshot collection skipped: {}", e.getMessage());
                return 0;
            }

            Map<String, List<AlertDefinition>> bySymbol = groupBySymbol(alerts);
            Map<String, CompletableFuture<PriceObservation>> fetches = startFetches(bySymbol.keySet(), now);
            LocalDate sessionDate = marketCalendar.sessionDate(now);
            long timeoutMillis = alertEngineConfig.getFetchTimeout().toMillis();

            int refreshed = 0;
            for (Map.Entry<String, CompletableFuture<PriceObservation>> entry : fetches.entrySet()) {
                try {
                    PriceObservation observation = entry.getValue().get(timeoutMillis, TimeUnit.MILLISECONDS);
                    sessionReferenceStore.capture(observation, sessionDate, now);
                    refreshed++;
                } catch (TimeoutException e) {
                    log.warn("Snapshot for {} timed out", entry.getKey());
                } catch (ExecutionException e) {
                    log.warn("Snapshot for {} failed: {}", entry.getKey(), e.getCause().getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Snapshot collection interrupted");
                    break;
                }
            }
            log.debug("Collected price snapshots for {}/{} symbols", refreshed, fetches.size());
            return refreshed;
        } finally {
            lock.unlock();
        }
    }

    public Optional<CycleReport> getLastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public CyclePhase getPhase() {
        return phase;
    }

    private CycleReport execute(Instant now, long startNanos) {
        phase = CyclePhase.GATING;
        if (!marketCalendar.isTradingNow(now)) {
            log.debug("Market closed at {}, cycle skipped", now);
            return CycleReport.builder()
                    .startedAt(now)
                    .outcome(CycleOutcome.SKIPPED_MARKET_CLOSED)
                    .durationMillis(elapsedMillis(startNanos))
                    .build();
        }

        phase = CyclePhase.FETCHING;
        List<AlertDefinition> alerts;
        try {
            alerts = alertRepository.listActive();
        } catch (RepositoryUnavailableException e) {
            log.warn("Cycle at {} skipped, alert store unavailable: {}", now, e.getMessage());
            return CycleReport.builder()
                    .startedAt(now)
                    .outcome(CycleOutcome.SKIPPED_REPOSITORY_UNAVAILABLE)
                    .durationMillis(elapsedMillis(startNanos))
                    .build();
        }

        cooldownGate.prime(alerts);
        Map<String, List<AlertDefinition>> bySymbol = groupBySymbol(alerts);
        Set<Long> alertIds = alerts.stream().map(AlertDefinition::getId).collect(Collectors.toSet());
        windowTracker.retainSymbols(bySymbol.keySet());
        priceCache.retainSymbols(bySymbol.keySet());
        sessionReferenceStore.retain(bySymbol.keySet(), alertIds);
        alerts.stream()
                .map(AlertDefinition::getKind)
                .filter(kind -> kind.getType().isWindowed())
                .map(AlertKind::getWindow)
                .distinct()
                .forEach(windowTracker::track);

        Map<String, CompletableFuture<PriceObservation>> fetches = startFetches(bySymbol.keySet(), now);

        LocalDate sessionDate = marketCalendar.sessionDate(now);
        boolean sessionOpenWindow = marketCalendar.isSessionOpenWindow(now);
        long deadlineNanos = startNanos + alertEngineConfig.getCycleDeadline().toNanos();
        long fetchTimeoutNanos = alertEngineConfig.getFetchTimeout().toNanos();

        Tally tally = new Tally();
        List<String> symbols = new ArrayList<>(bySymbol.keySet());
        for (int i = 0; i < symbols.size(); i++) {
            String symbol = symbols.get(i);
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                abandon(symbols.subList(i, symbols.size()), fetches, tally);
                break;
            }

            PriceObservation observation;
            try {
                observation = fetches.get(symbol).get(Math.min(remaining, fetchTimeoutNanos), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (System.nanoTime() - deadlineNanos >= 0) {
                    abandon(symbols.subList(i, symbols.size()), fetches, tally);
                    break;
                }
                log.warn(
                        "Price for {} not available within {}s, skipping",
                        symbol,
                        alertEngineConfig.getFetchTimeoutSeconds());
                markFailed(symbol, tally);
                continue;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof PriceUnavailableException) {
                    log.warn("Skipping {} this cycle: {}", symbol, cause.getMessage());
                } else {
                    log.error("Unexpected error fetching price for {}", symbol, cause);
                }
                markFailed(symbol, tally);
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Cycle interrupted while waiting for {}", symbol);
                abandon(symbols.subList(i, symbols.size()), fetches, tally);
                break;
            }

            sessionReferenceStore.capture(observation, sessionDate, now);
            evaluateSymbol(symbol, bySymbol.get(symbol), observation, now, sessionDate, sessionOpenWindow, tally);
        }

        return CycleReport.builder()
                .startedAt(now)
                .outcome(tally.abandoned.isEmpty() ? CycleOutcome.COMPLETED : CycleOutcome.DEADLINE_EXCEEDED)
                .activeAlerts(alerts.size())
                .symbols(bySymbol.size())
                .alertsEvaluated(tally.evaluated)
                .alertsFired(tally.fired)
                .suppressedByCooldown(tally.suppressed)
                .notificationsSent(tally.sent)
                .deliveryFailures(tally.deliveryFailures)
                .failedSymbols(tally.failed)
                .abandonedSymbols(tally.abandoned)
                .durationMillis(elapsedMillis(startNanos))
                .build();
    }

    private void evaluateSymbol(
            String symbol,
            List<AlertDefinition> alerts,
            PriceObservation observation,
            Instant now,
            LocalDate sessionDate,
            boolean sessionOpenWindow,
            Tally tally) {
        for (AlertDefinition alert : alerts) {
            phase = CyclePhase.EVALUATING;
            try {
                ConditionResult result = evaluate(symbol, alert, observation, now, sessionDate, sessionOpenWindow);
                if (result == null) {
                    continue;
                }
                tally.evaluated++;
                if (result.isFired()) {
                    tally.fired++;
                    alertMetricsService.recordFired();
                    phase = CyclePhase.DISPATCHING;
                    dispatch(alert, result, observation, now, tally);
                } else {
                    log.debug(
                            "Alert {} ({} {}) not fired: {}",
                            alert.getId(),
                            symbol,
                            alert.getKind().describe(),
                            result.getReason());
                }
            } catch (RuntimeException e) {
                log.error("Evaluation of alert {} on {} failed", alert.getId(), symbol, e);
            }
        }
    }

    /**
     * Evaluates one alert. Returns null when the alert is not evaluable this cycle (no window
     * data yet, or a gap alert already evaluated in this session).
     */
    private ConditionResult evaluate(
            String symbol,
            AlertDefinition alert,
            PriceObservation observation,
            Instant now,
            LocalDate sessionDate,
            boolean sessionOpenWindow) {
        AlertKind kind = alert.getKind();
        ConditionContext.ConditionContextBuilder context = ConditionContext.builder()
                .kind(kind)
                .thresholdPercent(alert.getThresholdPercent())
                .currentPrice(observation.getPrice())
                .sessionOpenWindow(sessionOpenWindow);

        if (kind.isGap()) {
            Optional<SessionReference> reference = sessionReferenceStore.find(symbol, sessionDate);
            context.gapBaseline(reference.map(SessionReference::getBaseline).orElse(null));
            if (sessionOpenWindow
                    && reference.isPresent()
                    && !sessionReferenceStore.markGapEvaluated(alert.getId(), sessionDate)) {
                return null;
            }
        } else {
            WindowStats window;
            try {
                window = windowTracker.highLow(symbol, kind.getWindow(), now);
            } catch (NoWindowDataException e) {
                log.debug("Alert {} not evaluable yet: {}", alert.getId(), e.getMessage());
                return null;
            }
            context.window(window);
        }

        ConditionResult result = conditionEvaluator.evaluate(context.build());
        if (result.getReason() == EvaluationReason.NO_REFERENCE) {
            log.debug("Alert {} on {} has no reference price yet", alert.getId(), symbol);
        }
        return result;
    }

    private void dispatch(
            AlertDefinition alert, ConditionResult result, PriceObservation observation, Instant now, Tally tally) {
        if (!cooldownGate.allow(alert.getId(), now)) {
            tally.suppressed++;
            alertMetricsService.recordSuppressed();
            log.debug("Alert {} fired but is cooling down", alert.getId());
            return;
        }

        boolean recorded;
        try {
            if (!cooldownGate.record(alert.getId(), now)) {
                log.info("Alert {} was deleted before its trigger was recorded, notification dropped", alert.getId());
                return;
            }
            recorded = true;
        } catch (RepositoryUnavailableException e) {
            log.warn("Could not record trigger for alert {}, sending anyway: {}", alert.getId(), e.getMessage());
            recorded = false;
        }

        log.info(
                "Alert {} fired: {} {} at {} vs reference {} ({}%)",
                alert.getId(),
                alert.getSymbol(),
                alert.getKind().describe(),
                observation.getPrice(),
                result.getReferencePrice(),
                result.getMovePercent());

        AlertNotification notification = AlertNotification.builder()
                .alertId(alert.getId())
                .ownerKey(alert.getOwnerKey())
                .symbol(observation.getSymbol())
                .kind(alert.getKind())
                .thresholdPercent(alert.getThresholdPercent())
                .currentPrice(observation.getPrice())
                .referencePrice(result.getReferencePrice())
                .movePercent(result.getMovePercent())
                .triggeredAt(now)
                .stalePrice(observation.isStale())
                .build();

        String error = null;
        try {
            notificationService.deliver(notification);
            tally.sent++;
        } catch (DeliveryFailureException e) {
            tally.deliveryFailures++;
            alertMetricsService.recordDeliveryFailure();
            error = e.getMessage();
            log.warn("Delivery failed for alert {}: {}", alert.getId(), e.getMessage());
        }

        saveHistory(notification, recorded, error);
    }

    private void saveHistory(AlertNotification notification, boolean cooldownRecorded, String error) {
        AlertTriggerHistory history = AlertTriggerHistory.builder()
                .alertId(notification.getAlertId())
                .symbol(notification.getSymbol())
                .kindType(notification.getKind().getType())
                .windowMinutes(notification.getKind().getWindowMinutes())
                .thresholdPercent(notification.getThresholdPercent())
                .currentPrice(notification.getCurrentPrice())
                .referencePrice(notification.getReferencePrice())
                .movePercent(notification.getMovePercent())
                .triggeredAt(notification.getTriggeredAt())
                .cooldownRecorded(cooldownRecorded)
                .notificationSent(error == null)
                .errorMessage(error)
                .build();
        try {
            alertRepository.saveTriggerHistory(history);
        } catch (RepositoryUnavailableException e) {
            log.warn("Trigger history for alert {} not saved: {}", notification.getAlertId(), e.getMessage());
        }
    }

    private Map<String, List<AlertDefinition>> groupBySymbol(List<AlertDefinition> alerts) {
        Map<String, List<AlertDefinition>> bySymbol = new LinkedHashMap<>();
        for (AlertDefinition alert : alerts) {
            bySymbol.computeIfAbsent(SymbolNormalizer.canonical(alert.getSymbol()), s -> new ArrayList<>())
                    .add(alert);
        }
        return bySymbol;
    }

    private Map<String, CompletableFuture<PriceObservation>> startFetches(Set<String> symbols, Instant now) {
        Map<String, CompletableFuture<PriceObservation>> fetches = new LinkedHashMap<>();
        for (String symbol : symbols) {
            fetches.put(symbol, CompletableFuture.supplyAsync(() -> priceCache.get(symbol, now), priceFetchExecutor));
        }
        return fetches;
    }

    private void abandon(List<String> remaining, Map<String, CompletableFuture<PriceObservation>> fetches, Tally tally) {
        log.warn("Cycle deadline of {}s exceeded, abandoning {} symbols: {}",
                alertEngineConfig.getCycleDeadline().toSeconds(), remaining.size(), remaining);
        for (String symbol : remaining) {
            fetches.get(symbol).cancel(false);
            tally.abandoned.add(symbol);
        }
    }

    private void markFailed(String symbol, Tally tally) {
        tally.failed.add(symbol);
        alertMetricsService.recordPriceFailure();
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static final class Tally {
        private int evaluated;
        private int fired;
        private int suppressed;
        private int sent;
        private int deliveryFailures;
        private final List<String> failed = new ArrayList<>();
        private final List<String> abandoned = new ArrayList<>();
    }
}
