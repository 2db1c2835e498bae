package com.stockalerts.repository.jpa;

import com.stockalerts.entity.AlertRuleEntity;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the alert_rules table.
 */
@Repository
public interface AlertRuleJpaRepository extends JpaRepository<AlertRuleEntity, Long> {

    List<AlertRuleEntity> findByActiveTrueOrderByIdAsc();

    /** Returns the number of rows updated; 0 when the rule was deleted or deactivated. */
    @Modifying
    @Transactional
    @Query("UPDATE AlertRuleEntity a SET a.lastTriggeredAt = :triggeredAt WHERE a.id = :id AND a.active = true")
    int updateLastTriggeredAt(@Param("id") Long id, @Param("triggeredAt") Instant triggeredAt);
}
