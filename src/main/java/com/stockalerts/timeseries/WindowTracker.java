package com.stockalerts.timeseries;

import com.stockalerts.domain.model.PriceObservation;
import com.stockalerts.domain.model.WindowStats;
import com.stockalerts.engine.AlertEngineConfig;
import com.stockalerts.exception.NoWindowDataException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Keeps per-symbol rolling windows of observed prices and answers high/low queries for alert
 * evaluation.
 *
 * <p>Every symbol tracks the configured durations (default 60 and 120 minutes) from the first
 * observation on. A duration referenced by an alert but not configured is registered the first
 * time it is seen, for all symbols, and starts empty. Windows for a symbol are discarded once no
 * active alert references it ({@link #retainSymbols}).
 *
 * <p>Symbols live in a concurrent map so fetch workers for different symbols never contend;
 * each {@link RollingWindow} serializes its own updates.
 */
@Service
public class WindowTracker {

    private static final Logger log = LoggerFactory.getLogger(WindowTracker.class);

    private final Set<Duration> durations = new CopyOnWriteArraySet<>();
    private final Map<String, Map<Duration, RollingWindow>> windows = new ConcurrentHashMap<>();

    @Autowired
    public WindowTracker(AlertEngineConfig config) {
        this(config.getRollingWindowDurationsMinutes().stream()
                .map(Duration::ofMinutes)
                .collect(Collectors.toList()));
    }

    public WindowTracker(Collection<Duration> configuredDurations) {
        durations.addAll(configuredDurations);
    }

    /**
     * Appends the observation to every tracked window of its symbol. Observations older than
     * the newest one already held are dropped.
     */
    public void observe(PriceObservation observation) {
        Map<Duration, RollingWindow> perSymbol = windowsFor(observation.getSymbol());
        for (Duration duration : durations) {
            RollingWindow window = perSymbol.computeIfAbsent(duration, RollingWindow::new);
            if (!window.add(observation)) {
                log.debug(
                        "Dropped out-of-order observation for {} at {} ({}m window)",
                        observation.getSymbol(),
                        observation.getObservedAt(),
                        duration.toMinutes());
            }
        }
    }

    /**
     * Returns the high and low of {@code symbol} over {@code [now - duration, now]}.
     *
     * @throws NoWindowDataException if no observation qualifies
     */
    public WindowStats highLow(String symbol, Duration duration, Instant now) {
        track(duration);
        RollingWindow window = windowsFor(symbol).computeIfAbsent(duration, RollingWindow::new);
        WindowStats stats = window.stats(now);
        if (stats == null) {
            throw new NoWindowDataException(symbol, duration);
        }
        return stats;
    }

    /**
     * Registers a window duration. New durations start empty for every symbol.
     */
    public void track(Duration duration) {
        if (durations.add(duration)) {
            log.info("Tracking new rolling window duration of {} minutes", duration.toMinutes());
        }
    }

    /**
     * Drops all windows for symbols not in {@code activeSymbols}.
     */
    public void retainSymbols(Set<String> activeSymbols) {
        List<String> removed = windows.keySet().stream()
                .filter(symbol -> !activeSymbols.contains(symbol))
                .collect(Collectors.toList());
        removed.forEach(windows::remove);
        if (!removed.isEmpty()) {
            log.info("Discarded rolling windows for {} inactive symbols: {}", removed.size(), removed);
        }
    }

    public Set<String> getTrackedSymbols() {
        return Set.copyOf(windows.keySet());
    }

    public Set<Duration> getTrackedDurations() {
        return Set.copyOf(durations);
    }

    private Map<Duration, RollingWindow> windowsFor(String symbol) {
        return windows.computeIfAbsent(symbol, s -> new ConcurrentHashMap<>());
    }
}
