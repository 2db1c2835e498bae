package com.stockalerts.engine;

import com.stockalerts.domain.model.AlertDefinition;
import com.stockalerts.exception.RepositoryUnavailableException;
import com.stockalerts.repository.AlertRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Per-alert notification suppression.
 *
 * <p>An alert may notify at {@code now} only if its last recorded trigger is at least
 * {@code cooldownSeconds} earlier. The trigger timestamp is written to the alert store before
 * the notification is sent, and the in-memory record is only advanced once that write has
 * succeeded. A failed write therefore leaves the alert eligible on the next cycle: a possible
 * duplicate is preferred to a silently lost alert.
 */
@Component
public class CooldownGate {

    private final AlertRepository alertRepository;
    private final Duration cooldown;
    private final Map<Long, Instant> lastTriggered = new ConcurrentHashMap<>();

    public CooldownGate(AlertRepository alertRepository, AlertEngineConfig alertEngineConfig) {
        this.alertRepository = alertRepository;
        this.cooldown = alertEngineConfig.getCooldown();
    }

    public boolean allow(Long alertId, Instant now) {
        Instant last = lastTriggered.get(alertId);
        return last == null || !now.isBefore(last.plus(cooldown));
    }

    /**
     * Durably records a trigger.
     *
     * @return false if the alert was deleted since it was listed; the caller must not notify
     * @throws RepositoryUnavailableException if the store write failed; nothing is recorded
     */
    public boolean record(Long alertId, Instant now) {
        boolean exists = alertRepository.recordTrigger(alertId, now);
        if (exists) {
            lastTriggered.merge(alertId, now, CooldownGate::later);
        } else {
            lastTriggered.remove(alertId);
        }
        return exists;
    }

    /**
     * Seeds the gate from the store's {@code lastTriggeredAt} values, keeping the later of the
     * stored and in-memory timestamps, and forgets alerts that are no longer listed.
     */
    public void prime(Collection<AlertDefinition> alerts) {
        Set<Long> ids = alerts.stream().map(AlertDefinition::getId).collect(Collectors.toSet());
        lastTriggered.keySet().retainAll(ids);
        for (AlertDefinition alert : alerts) {
            if (alert.getLastTriggeredAt() != null) {
                lastTriggered.merge(alert.getId(), alert.getLastTriggeredAt(), CooldownGate::later);
            }
        }
    }

    public Duration getCooldown() {
        return cooldown;
    }

    private static Instant later(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
