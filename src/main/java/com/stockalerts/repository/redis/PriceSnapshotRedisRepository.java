package com.stockalerts.repository.redis;

import com.stockalerts.config.RedisConfig;
import com.stockalerts.domain.enums.PriceTier;
import com.stockalerts.domain.model.PriceObservation;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis repository for the last known price of each symbol, shared across engine instances.
 *
 * <p>Key format: alerts:price:{symbol}
 * Value: JSON map with price, observedAt and (optionally) previousClose, all as strings.
 *
 * <p>Redis is a cache here, not a source of truth: every failure is logged and reported as a
 * miss, never propagated.
 */
@Repository
@RequiredArgsConstructor
public class PriceSnapshotRedisRepository {

    private static final Logger log = LoggerFactory.getLogger(PriceSnapshotRedisRepository.class);

    private final RedisTemplate<String, Object> redisTemplate;

    public void store(PriceObservation observation) {
        String key = RedisConfig.KEY_PREFIX_PRICE + observation.getSymbol();

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("price", observation.getPrice().toPlainString());
        snapshot.put("observedAt", observation.getObservedAt().toString());
        if (observation.getPreviousClose() != null) {
            snapshot.put("previousClose", observation.getPreviousClose().toPlainString());
        }

        try {
            redisTemplate.opsForValue().set(key, snapshot, RedisConfig.PRICE_RETENTION);
        } catch (RuntimeException e) {
            log.warn("Failed to cache price for {} in Redis: {}", observation.getSymbol(), e.getMessage());
        }
    }

    /** Returns the cached observation regardless of age, tagged with the SECONDARY tier. */
    public Optional<PriceObservation> find(String symbol) {
        String key = RedisConfig.KEY_PREFIX_PRICE + symbol;
        Object value;
        try {
            value = redisTemplate.opsForValue().get(key);
        } catch (RuntimeException e) {
            log.warn("Redis price lookup failed for {}, treating as miss: {}", symbol, e.getMessage());
            return Optional.empty();
        }
        if (!(value instanceof Map<?, ?> snapshot)) {
            return Optional.empty();
        }

        try {
            Object previousClose = snapshot.get("previousClose");
            return Optional.of(PriceObservation.builder()
                    .symbol(symbol)
                    .price(new BigDecimal(String.valueOf(snapshot.get("price"))))
                    .observedAt(Instant.parse(String.valueOf(snapshot.get("observedAt"))))
                    .previousClose(previousClose != null ? new BigDecimal(String.valueOf(previousClose)) : null)
                    .tier(PriceTier.SECONDARY)
                    .build());
        } catch (RuntimeException e) {
            log.warn("Ignoring unreadable cached price for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }
}
