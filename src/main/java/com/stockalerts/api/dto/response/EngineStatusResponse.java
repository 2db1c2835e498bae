package com.stockalerts.api.dto.response;

import com.stockalerts.domain.enums.CyclePhase;
import com.stockalerts.domain.enums.MarketPhase;
import com.stockalerts.engine.CycleReport;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class EngineStatusResponse {

    private final boolean schedulerRunning;
    private final MarketPhase marketPhase;
    private final LocalDate sessionDate;
    private final boolean sessionOpenWindow;
    private final Instant nextSessionOpen;
    private final CyclePhase cyclePhase;
    private final List<String> trackedSymbols;
    private final List<Long> trackedWindowMinutes;
    private final CycleReport lastCycle;
}
