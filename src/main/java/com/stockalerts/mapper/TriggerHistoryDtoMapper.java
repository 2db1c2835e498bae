package com.stockalerts.mapper;

import com.stockalerts.api.dto.response.TriggerHistoryResponse;
import com.stockalerts.domain.model.AlertTriggerHistory;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * Maps trigger history domain records to API responses.
 */
@Mapper
public interface TriggerHistoryDtoMapper {

    TriggerHistoryResponse toResponse(AlertTriggerHistory history);

    List<TriggerHistoryResponse> toResponseList(List<AlertTriggerHistory> histories);
}
