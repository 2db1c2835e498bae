package com.stockalerts.repository.jpa;

import com.stockalerts.domain.model.AlertDefinition;
import com.stockalerts.domain.model.AlertTriggerHistory;
import com.stockalerts.exception.RepositoryUnavailableException;
import com.stockalerts.mapper.AlertRuleMapper;
import com.stockalerts.repository.AlertRepository;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;

/**
 * {@link AlertRepository} backed by Spring Data JPA.
 *
 * <p>Spring's {@link DataAccessException} and {@link TransactionException} are translated into
 * {@link RepositoryUnavailableException} so the engine deals with a single failure type.
 * A rule that fails to map (corrupt kind/window combination) is skipped with a warning rather
 * than failing the whole listing.
 */
@Repository
public class JpaAlertRepository implements AlertRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaAlertRepository.class);

    private final AlertRuleJpaRepository alertRuleJpaRepository;
    private final AlertTriggerHistoryJpaRepository alertTriggerHistoryJpaRepository;
    private final AlertRuleMapper alertRuleMapper = Mappers.getMapper(AlertRuleMapper.class);

    public JpaAlertRepository(
            AlertRuleJpaRepository alertRuleJpaRepository,
            AlertTriggerHistoryJpaRepository alertTriggerHistoryJpaRepository) {
        this.alertRuleJpaRepository = alertRuleJpaRepository;
        this.alertTriggerHistoryJpaRepository = alertTriggerHistoryJpaRepository;
    }

    @Override
    public List<AlertDefinition> listActive() {
        try {
            return alertRuleJpaRepository.findByActiveTrueOrderByIdAsc().stream()
                    .flatMap(entity -> {
                        try {
                            return Stream.of(alertRuleMapper.toDomain(entity));
                        } catch (IllegalArgumentException e) {
                            log.warn("Skipping malformed alert rule {}: {}", entity.getId(), e.getMessage());
                            return Stream.empty();
                        }
                    })
                    .toList();
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Failed to list active alerts", e);
        }
    }

    @Override
    public boolean recordTrigger(Long alertId, Instant triggeredAt) {
        try {
            int updated = alertRuleJpaRepository.updateLastTriggeredAt(alertId, triggeredAt);
            if (updated == 0) {
                log.info("Alert {} no longer exists, trigger not recorded", alertId);
            }
            return updated > 0;
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Failed to record trigger for alert " + alertId, e);
        }
    }

    @Override
    public AlertTriggerHistory saveTriggerHistory(AlertTriggerHistory history) {
        try {
            return alertRuleMapper.toDomain(
                    alertTriggerHistoryJpaRepository.save(alertRuleMapper.toEntity(history)));
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException(
                    "Failed to save trigger history for alert " + history.getAlertId(), e);
        }
    }

    @Override
    public List<AlertTriggerHistory> findTriggerHistory(Long alertId) {
        try {
            return alertRuleMapper.toHistoryDomainList(
                    alertTriggerHistoryJpaRepository.findByAlertIdOrderByTriggeredAtDesc(alertId));
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Failed to load trigger history for alert " + alertId, e);
        }
    }

    @Override
    public boolean exists(Long alertId) {
        try {
            return alertRuleJpaRepository.existsById(alertId);
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Failed to look up alert " + alertId, e);
        }
    }
}
