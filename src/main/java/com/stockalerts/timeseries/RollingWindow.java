package com.stockalerts.timeseries;

import com.stockalerts.domain.model.PriceObservation;
import com.stockalerts.domain.model.WindowStats;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Sliding history of price observations for one (symbol, duration) pair.
 *
 * <p>Observations are held in arrival order, which is also {@code observedAt} order: an
 * observation older than the newest one is rejected, and one with the same timestamp replaces
 * the newest. Two monotonic deques track the running maximum and minimum, so a query at or
 * after the newest observation costs amortised O(1). A query for an earlier instant (replay)
 * falls back to a linear scan restricted to observations at or before the query time.
 *
 * <p>Eviction is driven by the query time: entries with {@code observedAt < now - duration}
 * are dropped before the extremes are read, so the window is {@code [now - duration, now]}.
 *
 * <p>Instances are thread-safe; all access is serialized on the window.
 */
public class RollingWindow {

    private final Duration duration;

    private final Deque<Entry> entries = new ArrayDeque<>();
    private final Deque<Entry> maxDeque = new ArrayDeque<>();
    private final Deque<Entry> minDeque = new ArrayDeque<>();

    public RollingWindow(Duration duration) {
        this.duration = duration;
    }

    /**
     * Appends an observation.
     *
     * @return false if the observation was older than the newest held and was dropped
     */
    public synchronized boolean add(PriceObservation observation) {
        Entry entry = new Entry(observation.getObservedAt(), observation.getPrice());
        Entry newest = entries.peekLast();
        if (newest != null) {
            int cmp = entry.at.compareTo(newest.at);
            if (cmp < 0) {
                return false;
            }
            if (cmp == 0) {
                entries.pollLast();
                entries.addLast(entry);
                rebuildExtremes();
                return true;
            }
        }
        entries.addLast(entry);
        pushExtremes(entry);
        return true;
    }

    /**
     * Evicts expired entries relative to {@code now} and returns the extremes of what remains
     * at or before {@code now}.
     *
     * @return the stats, or null when no observation qualifies
     */
    public synchronized WindowStats stats(Instant now) {
        evictBefore(now.minus(duration));
        Entry newest = entries.peekLast();
        if (newest == null) {
            return null;
        }
        if (!newest.at.isAfter(now)) {
            return WindowStats.builder()
                    .high(maxDeque.peekFirst().price)
                    .low(minDeque.peekFirst().price)
                    .count(entries.size())
                    .oldest(entries.peekFirst().at)
                    .newest(newest.at)
                    .build();
        }
        return scan(now);
    }

    public synchronized int size() {
        return entries.size();
    }

    private WindowStats scan(Instant now) {
        BigDecimal high = null;
        BigDecimal low = null;
        Instant oldest = null;
        Instant latest = null;
        int count = 0;
        for (Entry entry : entries) {
            if (entry.at.isAfter(now)) {
                break;
            }
            if (oldest == null) {
                oldest = entry.at;
            }
            latest = entry.at;
            high = high == null || entry.price.compareTo(high) > 0 ? entry.price : high;
            low = low == null || entry.price.compareTo(low) < 0 ? entry.price : low;
            count++;
        }
        if (count == 0) {
            return null;
        }
        return WindowStats.builder()
                .high(high)
                .low(low)
                .count(count)
                .oldest(oldest)
                .newest(latest)
                .build();
    }

    private void evictBefore(Instant cutoff) {
        while (!entries.isEmpty() && entries.peekFirst().at.isBefore(cutoff)) {
            Entry removed = entries.pollFirst();
            if (maxDeque.peekFirst() == removed) {
                maxDeque.pollFirst();
            }
            if (minDeque.peekFirst() == removed) {
                minDeque.pollFirst();
            }
        }
    }

    private void pushExtremes(Entry entry) {
        while (!maxDeque.isEmpty() && maxDeque.peekLast().price.compareTo(entry.price) <= 0) {
            maxDeque.pollLast();
        }
        maxDeque.addLast(entry);
        while (!minDeque.isEmpty() && minDeque.peekLast().price.compareTo(entry.price) >= 0) {
            minDeque.pollLast();
        }
        minDeque.addLast(entry);
    }

    private void rebuildExtremes() {
        maxDeque.clear();
        minDeque.clear();
        Iterator<Entry> it = entries.iterator();
        while (it.hasNext()) {
            pushExtremes(it.next());
        }
    }

    private static final class Entry {

        private final Instant at;
        private final BigDecimal price;

        private Entry(Instant at, BigDecimal price) {
            this.at = at;
            this.price = price;
        }
    }
}
