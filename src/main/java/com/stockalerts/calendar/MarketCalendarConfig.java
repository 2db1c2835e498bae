package com.stockalerts.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the trading calendar, bound from the {@code trading-calendar}
 * prefix.
 *
 * <p>Times are written as {@code HH:mm} and dates as ISO {@code yyyy-MM-dd}; both are parsed
 * on read. The holiday list is maintained by hand from the exchange's published calendar.
 */
@Component
@ConfigurationProperties(prefix = "trading-calendar")
public class MarketCalendarConfig {

    private String exchange = "NSE";
    private String timezone = "Asia/Kolkata";
    private String preOpen = "09:00";
    private String marketOpen = "09:15";
    private String marketClose = "15:30";
    private String postClose = "16:00";
    private int sessionOpenWindowMinutes = 5;
    private Set<DayOfWeek> tradingDays = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);
    private List<Holiday> holidays = new ArrayList<>();

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public ZoneId getZone() {
        return ZoneId.of(timezone);
    }

    public String getPreOpen() {
        return preOpen;
    }

    public void setPreOpen(String preOpen) {
        this.preOpen = preOpen;
    }

    public LocalTime getPreOpenTime() {
        return LocalTime.parse(preOpen);
    }

    public String getMarketOpen() {
        return marketOpen;
    }

    public void setMarketOpen(String marketOpen) {
        this.marketOpen = marketOpen;
    }

    public LocalTime getMarketOpenTime() {
        return LocalTime.parse(marketOpen);
    }

    public String getMarketClose() {
        return marketClose;
    }

    public void setMarketClose(String marketClose) {
        this.marketClose = marketClose;
    }

    public LocalTime getMarketCloseTime() {
        return LocalTime.parse(marketClose);
    }

    public String getPostClose() {
        return postClose;
    }

    public void setPostClose(String postClose) {
        this.postClose = postClose;
    }

    public LocalTime getPostCloseTime() {
        return LocalTime.parse(postClose);
    }

    public int getSessionOpenWindowMinutes() {
        return sessionOpenWindowMinutes;
    }

    public void setSessionOpenWindowMinutes(int sessionOpenWindowMinutes) {
        this.sessionOpenWindowMinutes = sessionOpenWindowMinutes;
    }

    public Set<DayOfWeek> getTradingDays() {
        return tradingDays;
    }

    public void setTradingDays(Set<DayOfWeek> tradingDays) {
        this.tradingDays = tradingDays;
    }

    public List<Holiday> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<Holiday> holidays) {
        this.holidays = holidays;
    }

    /**
     * A single full-day market closure.
     */
    public static class Holiday {

        private String date;
        private String name;

        public Holiday() {}

        public Holiday(String date, String name) {
            this.date = date;
            this.name = name;
        }

        public String getDate() {
            return date;
        }

        public void setDate(String date) {
            this.date = date;
        }

        public LocalDate getLocalDate() {
            return LocalDate.parse(date);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}
