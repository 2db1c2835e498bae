package com.stockalerts.mapper;

import com.stockalerts.domain.model.AlertDefinition;
import com.stockalerts.domain.model.AlertKind;
import com.stockalerts.domain.model.AlertTriggerHistory;
import com.stockalerts.entity.AlertRuleEntity;
import com.stockalerts.entity.AlertTriggerHistoryEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the alert domain models and their JPA entities.
 *
 * <p>The entity stores the alert kind as two columns (type and optional window minutes);
 * the domain model carries it as one {@code AlertKind} value.
 */
@Mapper(imports = AlertKind.class)
public interface AlertRuleMapper {

    // AlertDefinition
    @Mapping(target = "kind", expression = "java(AlertKind.of(entity.getKindType(), entity.getWindowMinutes()))")
    AlertDefinition toDomain(AlertRuleEntity entity);

    // AlertTriggerHistory
    AlertTriggerHistory toDomain(AlertTriggerHistoryEntity entity);

    AlertTriggerHistoryEntity toEntity(AlertTriggerHistory domain);

    List<AlertTriggerHistory> toHistoryDomainList(List<AlertTriggerHistoryEntity> entities);
}
