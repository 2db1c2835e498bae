package com.stockalerts.cache;

import com.stockalerts.domain.enums.PriceTier;
import com.stockalerts.domain.model.PriceObservation;
import com.stockalerts.domain.model.PriceQuote;
import com.stockalerts.engine.AlertEngineConfig;
import com.stockalerts.exception.PriceUnavailableException;
import com.stockalerts.marketdata.PriceFeed;
import com.stockalerts.observability.AlertMetricsService;
import com.stockalerts.repository.redis.PriceSnapshotRedisRepository;
import com.stockalerts.timeseries.WindowTracker;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Three-tier price lookup: in-process memory, Redis, then the external feed.
 *
 * <ol>
 *   <li>Memory entry younger than {@code fastCacheTtlSeconds}: returned as is.</li>
 *   <li>Redis entry younger than {@code slowCacheTtlSeconds}: returned and copied to memory.</li>
 *   <li>A price served from either cache tier is still appended to the {@link WindowTracker},
 *       stamped with the lookup time.</li>
 *   <li>Feed fetch: on success both tiers are refreshed and the observation is appended to the
 *       {@link WindowTracker}. On failure the newest cached entry of any age is returned with
 *       {@code stale=true}; with nothing cached a {@link PriceUnavailableException} is thrown.</li>
 * </ol>
 *
 * <p>Concurrent lookups that reach tier 3 for the same symbol share one in-flight fetch. The
 * first caller performs the fetch; the others wait for its result for at most
 * {@code fetchTimeoutSeconds}. Redis failures are logged by the repository and count as misses.
 */
@Service
public class PriceCache {

    private static final Logger log = LoggerFactory.getLogger(PriceCache.class);

    private final PriceFeed priceFeed;
    private final PriceSnapshotRedisRepository priceSnapshotRedisRepository;
    private final WindowTracker windowTracker;
    private final AlertEngineConfig alertEngineConfig;
    private final AlertMetricsService alertMetricsService;

    private final Map<String, PriceObservation> memory = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<PriceObservation>> inFlight = new ConcurrentHashMap<>();

    public PriceCache(
            PriceFeed priceFeed,
            PriceSnapshotRedisRepository priceSnapshotRedisRepository,
            WindowTracker windowTracker,
            AlertEngineConfig alertEngineConfig,
            AlertMetricsService alertMetricsService) {
        this.priceFeed = priceFeed;
        this.priceSnapshotRedisRepository = priceSnapshotRedisRepository;
        this.windowTracker = windowTracker;
        this.alertEngineConfig = alertEngineConfig;
        this.alertMetricsService = alertMetricsService;
    }

    /**
     * Returns the current price of {@code symbol} as seen at {@code now}.
     *
     * @throws PriceUnavailableException if the feed failed and nothing is cached
     */
    public PriceObservation get(String symbol, Instant now) {
        PriceObservation fast = memory.get(symbol);
        if (fast != null && isFresh(fast, now, alertEngineConfig.getFastCacheTtl())) {
            return serveFromMemory(symbol, fast, now);
        }

        Optional<PriceObservation> slow = priceSnapshotRedisRepository.find(symbol);
        if (slow.isPresent() && isFresh(slow.get(), now, alertEngineConfig.getSlowCacheTtl())) {
            log.debug("Price for {} served from Redis", symbol);
            alertMetricsService.recordPriceLookup(PriceTier.SECONDARY);
            memory.put(symbol, slow.get().toBuilder().tier(PriceTier.MEMORY).build());
            appendToWindows(slow.get(), now);
            return slow.get();
        }

        PriceObservation fallback = newest(fast, slow.orElse(null));
        return fetchCoalesced(symbol, now, fallback);
    }

    /** Drops memory entries for symbols that no active alert references. */
    public void retainSymbols(Set<String> activeSymbols) {
        memory.keySet().retainAll(activeSymbols);
    }

    private PriceObservation fetchCoalesced(String symbol, Instant now, PriceObservation fallback) {
        CompletableFuture<PriceObservation> mine = new CompletableFuture<>();
        CompletableFuture<PriceObservation> leader = inFlight.putIfAbsent(symbol, mine);
        if (leader != null) {
            log.debug("Joining in-flight fetch for {}", symbol);
            return await(symbol, leader);
        }

        try {
            // a leader may have finished between the tier lookups and putIfAbsent
            PriceObservation fast = memory.get(symbol);
            PriceObservation result = fast != null && isFresh(fast, now, alertEngineConfig.getFastCacheTtl())
                    ? serveFromMemory(symbol, fast, now)
                    : load(symbol, now, fallback);
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(symbol, mine);
        }
    }

    private PriceObservation load(String symbol, Instant now, PriceObservation fallback) {
        PriceQuote quote;
        try {
            quote = priceFeed.fetch(symbol);
        } catch (RuntimeException e) {
            if (fallback != null) {
                log.warn(
                        "Price feed failed for {}, serving stale price {} from {}: {}",
                        symbol,
                        fallback.getPrice(),
                        fallback.getObservedAt(),
                        e.getMessage());
                alertMetricsService.recordPriceLookup(fallback.getTier());
                return fallback.toBuilder().stale(true).build();
            }
            if (e instanceof PriceUnavailableException) {
                throw e;
            }
            throw new PriceUnavailableException(symbol, "Price feed failed", e);
        }

        PriceObservation observation = PriceObservation.builder()
                .symbol(symbol)
                .price(quote.getPrice())
                .previousClose(quote.getPreviousClose())
                .observedAt(now)
                .tier(PriceTier.FEED)
                .build();

        memory.put(symbol, observation.toBuilder().tier(PriceTier.MEMORY).build());
        priceSnapshotRedisRepository.store(observation);
        windowTracker.observe(observation);
        alertMetricsService.recordPriceLookup(PriceTier.FEED);
        return observation;
    }

    private PriceObservation await(String symbol, CompletableFuture<PriceObservation> leader) {
        long timeoutMillis = alertEngineConfig.getFetchTimeout().toMillis();
        try {
            return leader.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new PriceUnavailableException(symbol, "Timed out waiting for in-flight fetch", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PriceUnavailableException(symbol, "Interrupted waiting for in-flight fetch", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof PriceUnavailableException priceUnavailable) {
                throw priceUnavailable;
            }
            throw new PriceUnavailableException(symbol, "In-flight fetch failed", e.getCause());
        }
    }

    private PriceObservation serveFromMemory(String symbol, PriceObservation fast, Instant now) {
        log.debug("Price for {} served from memory", symbol);
        alertMetricsService.recordPriceLookup(PriceTier.MEMORY);
        appendToWindows(fast, now);
        return fast;
    }

    /**
     * Cached prices are appended to the windows stamped with the lookup time, so the windows
     * receive one observation per lookup whichever tier served it.
     */
    private void appendToWindows(PriceObservation served, Instant now) {
        windowTracker.observe(served.toBuilder().observedAt(now).build());
    }

    private static boolean isFresh(PriceObservation observation, Instant now, Duration ttl) {
        return observation.ageAt(now).compareTo(ttl) < 0;
    }

    private static PriceObservation newest(PriceObservation a, PriceObservation b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.getObservedAt().isAfter(b.getObservedAt()) ? a : b;
    }
}
