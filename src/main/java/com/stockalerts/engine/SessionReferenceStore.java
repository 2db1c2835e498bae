package com.stockalerts.engine;

import com.stockalerts.domain.model.PriceObservation;
import com.stockalerts.domain.model.SessionReference;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the gap baseline of each symbol for the current trading day and remembers which gap
 * alerts have already been evaluated in that session.
 *
 * <p>A reference is captured from the first fresh observation of a symbol on a session date
 * and is immutable for the rest of that date. Only the current session's reference is kept per
 * symbol.
 */
@Component
public class SessionReferenceStore {

    private static final Logger log = LoggerFactory.getLogger(SessionReferenceStore.class);

    private final Map<String, SessionReference> references = new ConcurrentHashMap<>();
    private final Map<Long, LocalDate> gapEvaluated = new ConcurrentHashMap<>();

    /**
     * Captures the reference for the observation's symbol unless one already exists for
     * {@code sessionDate}. Stale observations never capture a reference.
     *
     * @return the reference in force for the session, if any
     */
    public Optional<SessionReference> capture(PriceObservation observation, LocalDate sessionDate, Instant now) {
        if (observation.isStale()) {
            return find(observation.getSymbol(), sessionDate);
        }
        SessionReference reference = references.compute(observation.getSymbol(), (symbol, existing) -> {
            if (existing != null && existing.getSessionDate().equals(sessionDate)) {
                return existing;
            }
            SessionReference captured = SessionReference.builder()
                    .symbol(symbol)
                    .sessionDate(sessionDate)
                    .openingPrice(observation.getPrice())
                    .previousClose(observation.getPreviousClose())
                    .capturedAt(now)
                    .build();
            log.info(
                    "Session reference for {} on {}: baseline {} (previous close {}, first price {})",
                    symbol,
                    sessionDate,
                    captured.getBaseline(),
                    captured.getPreviousClose(),
                    captured.getOpeningPrice());
            return captured;
        });
        return Optional.of(reference);
    }

    public Optional<SessionReference> find(String symbol, LocalDate sessionDate) {
        SessionReference reference = references.get(symbol);
        if (reference == null || !reference.getSessionDate().equals(sessionDate)) {
            return Optional.empty();
        }
        return Optional.of(reference);
    }

    /**
     * Marks a gap alert as evaluated for {@code sessionDate}.
     *
     * @return true the first time for this alert and session, false afterwards
     */
    public boolean markGapEvaluated(Long alertId, LocalDate sessionDate) {
        LocalDate previous = gapEvaluated.put(alertId, sessionDate);
        return !Objects.equals(previous, sessionDate);
    }

    public void retain(Set<String> activeSymbols, Set<Long> activeAlertIds) {
        references.keySet().retainAll(activeSymbols);
        gapEvaluated.keySet().retainAll(activeAlertIds);
    }
}
