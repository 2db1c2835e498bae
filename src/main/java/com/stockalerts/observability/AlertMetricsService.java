package com.stockalerts.observability;

import com.stockalerts.domain.enums.CycleOutcome;
import com.stockalerts.domain.enums.PriceTier;
import com.stockalerts.timeseries.WindowTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the alert engine:
 * <ul>
 *   <li><b>alert.cycles</b> (counter, tag outcome): evaluation cycles by outcome</li>
 *   <li><b>alert.cycle.duration</b> (timer): wall time of completed cycles</li>
 *   <li><b>alert.fired</b> (counter): conditions that evaluated true</li>
 *   <li><b>alert.suppressed</b> (counter): fired conditions held back by the cooldown</li>
 *   <li><b>alert.notifications.failed</b> (counter): delivery failures</li>
 *   <li><b>price.lookups</b> (counter, tag tier): prices served per cache tier</li>
 *   <li><b>price.fetch.failures</b> (counter): symbols with no price in a cycle</li>
 *   <li><b>alert.tracked.symbols</b> (gauge): symbols with rolling windows</li>
 * </ul>
 */
@Service
public class AlertMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter firedCounter;
    private final Counter suppressedCounter;
    private final Counter deliveryFailureCounter;
    private final Counter priceFailureCounter;
    private final Timer cycleTimer;

    public AlertMetricsService(MeterRegistry meterRegistry, WindowTracker windowTracker) {
        this.meterRegistry = meterRegistry;

        this.firedCounter = Counter.builder("alert.fired")
                .description("Alert conditions that evaluated true")
                .register(meterRegistry);

        this.suppressedCounter = Counter.builder("alert.suppressed")
                .description("Fired alerts suppressed by the cooldown")
                .register(meterRegistry);

        this.deliveryFailureCounter = Counter.builder("alert.notifications.failed")
                .description("Notifications the sink failed to deliver")
                .register(meterRegistry);

        this.priceFailureCounter = Counter.builder("price.fetch.failures")
                .description("Symbols skipped because no price was available")
                .register(meterRegistry);

        this.cycleTimer = Timer.builder("alert.cycle.duration")
                .description("Wall time of one evaluation cycle")
                .publishPercentiles(0.5, 0.95)
                .maximumExpectedValue(Duration.ofMinutes(10))
                .register(meterRegistry);

        meterRegistry.gauge("alert.tracked.symbols", windowTracker, tracker -> tracker.getTrackedSymbols()
                .size());
    }

    public void recordCycle(CycleOutcome outcome, Duration duration) {
        meterRegistry.counter("alert.cycles", "outcome", outcome.name()).increment();
        if (duration != null) {
            cycleTimer.record(duration);
        }
    }

    public void recordFired() {
        firedCounter.increment();
    }

    public void recordSuppressed() {
        suppressedCounter.increment();
    }

    public void recordDeliveryFailure() {
        deliveryFailureCounter.increment();
    }

    public void recordPriceLookup(PriceTier tier) {
        meterRegistry.counter("price.lookups", "tier", tier.name()).increment();
    }

    public void recordPriceFailure() {
        priceFailureCounter.increment();
    }
}
