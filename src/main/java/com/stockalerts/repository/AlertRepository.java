package com.stockalerts.repository;

import com.stockalerts.domain.model.AlertDefinition;
import com.stockalerts.domain.model.AlertTriggerHistory;
import com.stockalerts.exception.RepositoryUnavailableException;
import java.time.Instant;
import java.util.List;

/**
 * Persistent store of alert definitions, as seen by the evaluation engine.
 *
 * <p>The engine reads a fresh copy of the active alerts every cycle and writes back only the
 * trigger timestamp. Every method throws {@link RepositoryUnavailableException} when the
 * backing store cannot be reached.
 */
public interface AlertRepository {

    List<AlertDefinition> listActive();

    /**
     * Durably records that {@code alertId} fired at {@code triggeredAt}.
     *
     * @return false if the alert no longer exists (deleted since it was listed)
     */
    boolean recordTrigger(Long alertId, Instant triggeredAt);

    AlertTriggerHistory saveTriggerHistory(AlertTriggerHistory history);

    /** Newest first. */
    List<AlertTriggerHistory> findTriggerHistory(Long alertId);

    boolean exists(Long alertId);
}
