package com.stockalerts.api.controller;

import com.stockalerts.api.dto.response.EngineStatusResponse;
import com.stockalerts.api.dto.response.TriggerHistoryResponse;
import com.stockalerts.calendar.MarketCalendar;
import com.stockalerts.domain.model.AlertTriggerHistory;
import com.stockalerts.engine.AlertEvaluationCycle;
import com.stockalerts.engine.CycleReport;
import com.stockalerts.engine.EvaluationScheduler;
import com.stockalerts.exception.ResourceNotFoundException;
import com.stockalerts.mapper.TriggerHistoryDtoMapper;
import com.stockalerts.repository.AlertRepository;
import com.stockalerts.timeseries.WindowTracker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operations endpoints for the alert engine.
 *
 * <ul>
 *   <li>GET /api/alert-engine/status - market phase, tracked symbols and the last cycle report</li>
 *   <li>POST /api/alert-engine/evaluate - run one cycle now (skipped if one is in progress)</li>
 *   <li>GET /api/alert-engine/alerts/{id}/history - trigger audit trail, newest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/alert-engine")
public class AlertEngineController {

    private static final Logger log = LoggerFactory.getLogger(AlertEngineController.class);

    private final AlertEvaluationCycle alertEvaluationCycle;
    private final EvaluationScheduler evaluationScheduler;
    private final MarketCalendar marketCalendar;
    private final WindowTracker windowTracker;
    private final AlertRepository alertRepository;
    private final Clock clock;
    private final TriggerHistoryDtoMapper triggerHistoryDtoMapper = Mappers.getMapper(TriggerHistoryDtoMapper.class);

    public AlertEngineController(
            AlertEvaluationCycle alertEvaluationCycle,
            EvaluationScheduler evaluationScheduler,
            MarketCalendar marketCalendar,
            WindowTracker windowTracker,
            AlertRepository alertRepository,
            Clock clock) {
        this.alertEvaluationCycle = alertEvaluationCycle;
        this.evaluationScheduler = evaluationScheduler;
        this.marketCalendar = marketCalendar;
        this.windowTracker = windowTracker;
        this.alertRepository = alertRepository;
        this.clock = clock;
    }

    @GetMapping("/status")
    public ResponseEntity<EngineStatusResponse> getStatus() {
        Instant now = clock.instant();
        EngineStatusResponse response = EngineStatusResponse.builder()
                .schedulerRunning(evaluationScheduler.isRunning())
                .marketPhase(marketCalendar.phase(now))
                .sessionDate(marketCalendar.sessionDate(now))
                .sessionOpenWindow(marketCalendar.isSessionOpenWindow(now))
                .nextSessionOpen(marketCalendar.nextSessionOpen(now))
                .cyclePhase(alertEvaluationCycle.getPhase())
                .trackedSymbols(windowTracker.getTrackedSymbols().stream().sorted().toList())
                .trackedWindowMinutes(windowTracker.getTrackedDurations().stream()
                        .map(Duration::toMinutes)
                        .sorted()
                        .toList())
                .lastCycle(alertEvaluationCycle.getLastReport().orElse(null))
                .build();
        return ResponseEntity.ok(response);
    }

    @PostMapping("/evaluate")
    public ResponseEntity<CycleReport> evaluate() {
        log.info("Manual evaluation cycle requested");
        return ResponseEntity.ok(alertEvaluationCycle.run(clock.instant()));
    }

    @GetMapping("/alerts/{id}/history")
    public ResponseEntity<List<TriggerHistoryResponse>> getHistory(@PathVariable Long id) {
        List<AlertTriggerHistory> history = alertRepository.findTriggerHistory(id);
        if (history.isEmpty() && !alertRepository.exists(id)) {
            throw new ResourceNotFoundException("Alert", String.valueOf(id));
        }
        return ResponseEntity.ok(triggerHistoryDtoMapper.toResponseList(history));
    }
}
