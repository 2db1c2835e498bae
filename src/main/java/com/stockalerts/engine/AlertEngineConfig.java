package com.stockalerts.engine;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the alert evaluation engine under the {@code alert-engine} prefix.
 *
 * <ul>
 *   <li>{@code enabled} -- master toggle; when false the scheduler never starts</li>
 *   <li>{@code evaluationIntervalSeconds} -- cadence of evaluation cycles (default 5 minutes)</li>
 *   <li>{@code snapshotIntervalSeconds} -- cadence of price snapshot refreshes between cycles</li>
 *   <li>{@code fastCacheTtlSeconds} / {@code slowCacheTtlSeconds} -- in-memory and Redis price TTLs</li>
 *   <li>{@code cooldownSeconds} -- minimum gap between two notifications for one alert</li>
 *   <li>{@code rollingWindowDurationsMinutes} -- windows tracked for every symbol from the start</li>
 *   <li>{@code fetchTimeoutSeconds} -- upper bound a cycle waits for one symbol's price</li>
 *   <li>{@code fetchPoolSize} -- worker threads for parallel symbol fetches</li>
 *   <li>{@code cycleDeadlineSeconds} -- hard cycle deadline; 0 means twice the interval</li>
 * </ul>
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "alert-engine")
public class AlertEngineConfig {

    private boolean enabled = true;

    @Min(1)
    private long evaluationIntervalSeconds = 300;

    @Min(1)
    private long snapshotIntervalSeconds = 60;

    @Min(1)
    private long fastCacheTtlSeconds = 60;

    @Min(1)
    private long slowCacheTtlSeconds = 300;

    @Min(0)
    private long cooldownSeconds = 3600;

    @NotEmpty
    private List<Integer> rollingWindowDurationsMinutes = new ArrayList<>(List.of(60, 120));

    @Min(1)
    private long fetchTimeoutSeconds = 5;

    @Min(1)
    private int fetchPoolSize = 4;

    @Min(0)
    private long cycleDeadlineSeconds = 0;

    public Duration getCooldown() {
        return Duration.ofSeconds(cooldownSeconds);
    }

    public Duration getFastCacheTtl() {
        return Duration.ofSeconds(fastCacheTtlSeconds);
    }

    public Duration getSlowCacheTtl() {
        return Duration.ofSeconds(slowCacheTtlSeconds);
    }

    public Duration getFetchTimeout() {
        return Duration.ofSeconds(fetchTimeoutSeconds);
    }

    public Duration getCycleDeadline() {
        long seconds = cycleDeadlineSeconds > 0 ? cycleDeadlineSeconds : evaluationIntervalSeconds * 2;
        return Duration.ofSeconds(seconds);
    }
}
