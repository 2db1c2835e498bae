package com.stockalerts.calendar;

import com.stockalerts.domain.enums.MarketPhase;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Market hours awareness for the alert engine: trading-day and holiday detection, phase
 * classification and the session-open window used by gap alerts.
 *
 * <p>All decisions are made in the configured exchange zone. Every method takes the instant
 * to classify explicitly; nothing here reads the wall clock.
 *
 * <p>The regular session is {@code [open, close]} with the close minute inclusive, so a
 * cycle landing exactly on 15:30:00 still evaluates.
 */
@Service
public class MarketCalendar {

    private final MarketCalendarConfig config;
    private final ZoneId zone;
    private final LocalTime preOpen;
    private final LocalTime open;
    private final LocalTime close;
    private final LocalTime postClose;
    private final Set<LocalDate> holidays;

    public MarketCalendar(MarketCalendarConfig config) {
        this.config = config;
        this.zone = config.getZone();
        this.preOpen = config.getPreOpenTime();
        this.open = config.getMarketOpenTime();
        this.close = config.getMarketCloseTime();
        this.postClose = config.getPostCloseTime();
        this.holidays = config.getHolidays().stream()
                .map(MarketCalendarConfig.Holiday::getLocalDate)
                .collect(Collectors.toUnmodifiableSet());
        if (!open.isBefore(close)) {
            throw new IllegalStateException("Market open " + open + " must be before close " + close);
        }
    }

    public ZoneId getZone() {
        return zone;
    }

    /** True iff {@code now} falls on a trading day within [open, close]. */
    public boolean isTradingNow(Instant now) {
        return phase(now) == MarketPhase.OPEN;
    }

    /**
     * True iff {@code now} is in the first {@code sessionOpenWindowMinutes} of a trading session,
     * i.e. within [open, open + window).
     */
    public boolean isSessionOpenWindow(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        if (!isTradingDay(local.toLocalDate())) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        LocalTime windowEnd = open.plusMinutes(config.getSessionOpenWindowMinutes());
        return !time.isBefore(open) && time.isBefore(windowEnd) && !time.isAfter(close);
    }

    /** The exchange-local calendar date of {@code now}. */
    public LocalDate sessionDate(Instant now) {
        return now.atZone(zone).toLocalDate();
    }

    public MarketPhase phase(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        if (!isTradingDay(local.toLocalDate())) {
            return MarketPhase.CLOSED;
        }
        LocalTime time = local.toLocalTime();
        if (time.isBefore(preOpen)) {
            return MarketPhase.CLOSED;
        }
        if (time.isBefore(open)) {
            return MarketPhase.PRE_OPEN;
        }
        if (!time.isAfter(close)) {
            return MarketPhase.OPEN;
        }
        if (time.isBefore(postClose)) {
            return MarketPhase.POST_CLOSE;
        }
        return MarketPhase.CLOSED;
    }

    /** Configured holiday; weekends are handled by {@link #isTradingDay}. */
    public boolean isHoliday(LocalDate date) {
        return holidays.contains(date);
    }

    public boolean isTradingDay(LocalDate date) {
        return config.getTradingDays().contains(date.getDayOfWeek()) && !isHoliday(date);
    }

    /**
     * Next session open strictly after {@code now}. If {@code now} is before today's open on a
     * trading day, that is today's open.
     */
    public Instant nextSessionOpen(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        LocalDate date = local.toLocalDate();
        if (isTradingDay(date) && local.toLocalTime().isBefore(open)) {
            return date.atTime(open).atZone(zone).toInstant();
        }
        LocalDate next = date.plusDays(1);
        // a year of consecutive closures means the calendar is misconfigured
        for (int i = 0; i < 366; i++) {
            if (isTradingDay(next)) {
                return next.atTime(open).atZone(zone).toInstant();
            }
            next = next.plusDays(1);
        }
        throw new IllegalStateException("No trading day within a year of " + date);
    }
}
