package com.stockalerts.repository.jpa;

import com.stockalerts.entity.AlertTriggerHistoryEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the alert_trigger_history table.
 */
@Repository
public interface AlertTriggerHistoryJpaRepository extends JpaRepository<AlertTriggerHistoryEntity, Long> {

    List<AlertTriggerHistoryEntity> findByAlertIdOrderByTriggeredAtDesc(Long alertId);
}
