package com.stockalerts.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the secondary price cache.
 *
 * <p>Values are written as JSON through {@link GenericJackson2JsonRedisSerializer}. Cached
 * prices are stored as maps of plain strings, so no JSR-310 module is required.
 *
 * <p>All keys are prefixed with "alerts:" because the Redis server may be shared.
 *
 * <p>Key schema:
 * <pre>
 *   alerts:price:{symbol}   → {price, observedAt, previousClose} (TTL 24h)
 * </pre>
 */
@Configuration
public class RedisConfig {

    /** Global prefix for all keys. */
    public static final String KEY_PREFIX = "alerts:";

    public static final String KEY_PREFIX_PRICE = KEY_PREFIX + "price:";

    /**
     * Physical expiry of cached prices. Freshness is judged by the engine against
     * {@code slowCacheTtlSeconds}; older entries are kept as a stale fallback for feed outages.
     */
    public static final Duration PRICE_RETENTION = Duration.ofHours(24);

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, Object> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringRedisSerializer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer jsonRedisSerializer = new GenericJackson2JsonRedisSerializer();

        redisTemplate.setKeySerializer(stringRedisSerializer);
        redisTemplate.setValueSerializer(jsonRedisSerializer);
        redisTemplate.setHashKeySerializer(stringRedisSerializer);
        redisTemplate.setHashValueSerializer(jsonRedisSerializer);

        return redisTemplate;
    }
}
