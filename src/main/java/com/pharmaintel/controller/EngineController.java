package com.pharmaintel.controller;

import com.pharmaintel.domain.AbcClassification;
import com.pharmaintel.domain.AnomalyFlag;
import com.pharmaintel.domain.ExpiryRiskScore;
import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.TimeSeries;
import com.pharmaintel.dto.AbcRequest;
import com.pharmaintel.dto.AggregateRequest;
import com.pharmaintel.dto.AnomalyRequest;
import com.pharmaintel.dto.AnomalyResponse;
import com.pharmaintel.dto.ExpiryRiskRequest;
import com.pharmaintel.dto.ExpiryRiskResponse;
import com.pharmaintel.dto.ForecastRequest;
import com.pharmaintel.dto.ReorderRequest;
import com.pharmaintel.dto.ReorderResponse;
import com.pharmaintel.engine.InventoryIntelligenceEngine;
import com.pharmaintel.service.ForecastingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class EngineController {

    private final InventoryIntelligenceEngine engine;
    private final ForecastingService forecastingService;

    @PostMapping("/series")
    public ResponseEntity<TimeSeries> series(@Valid @RequestBody AggregateRequest request) {
        log.info("POST /series | itemId={} | granularity={} | records={}",
                 request.getItemId(), request.getGranularity(), request.getRecords().size());
        return ResponseEntity.ok(engine.aggregate(request.getItemId(), request.getRecords(), request.getGranularity()));
    }

    @PostMapping("/forecasts")
    public ResponseEntity<ForecastResult> forecast(@Valid @RequestBody ForecastRequest request) {
        log.info("POST /forecasts | itemId={} | granularity={} | horizon={}",
                 request.getItemId(), request.getGranularity(), request.getHorizonPeriods());
        return ResponseEntity.status(HttpStatus.CREATED).body(forecastingService.forecast(request));
    }

    @PostMapping("/anomalies")
    public ResponseEntity<AnomalyResponse> anomalies(@Valid @RequestBody AnomalyRequest request) {
        TimeSeries series = request.getSeries();
        List<AnomalyFlag> flags = engine.detectAnomalies(series);
        AnomalyResponse.AnomalyResponseBuilder response = AnomalyResponse.builder()
            .itemId(series.getItemId())
            .periods(series.size())
            .flags(flags);
        if (request.getShiftWindow() != null) {
            response.shift(engine.detectShift(series, request.getShiftWindow()).orElse(null));
        }
        log.info("POST /anomalies | itemId={} | periods={} | flags={}", series.getItemId(), series.size(), flags.size());
        return ResponseEntity.ok(response.build());
    }

    @PostMapping("/reorders")
    public ResponseEntity<ReorderResponse> reorder(@Valid @RequestBody ReorderRequest request) {
        ReorderResponse response = engine.recommendReorder(request.getForecast(), request.getState(), request.getSuppliers())
            .map(s -> ReorderResponse.builder()
                .itemId(s.getItemId())
                .action(ReorderResponse.Action.REORDER)
                .suggestion(s)
                .build())
            .orElseGet(() -> ReorderResponse.builder()
                .itemId(request.getState().getItemId())
                .action(ReorderResponse.Action.NO_ACTION)
                .build());
        log.info("POST /reorders | itemId={} | action={}", response.getItemId(), response.getAction());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/expiry-risks")
    public ResponseEntity<ExpiryRiskResponse> expiryRisks(@Valid @RequestBody ExpiryRiskRequest request) {
        List<ExpiryRiskScore> scores = engine.scoreExpiryRisks(request.getForecast(), request.getBatches());
        double wastage = scores.stream().mapToDouble(ExpiryRiskScore::getProjectedWastageQuantity).sum();
        long atRisk = scores.stream()
            .filter(s -> s.getRiskProbability() >= engine.getSettings().getDiscountThreshold())
            .count();
        log.info("POST /expiry-risks | itemId={} | batches={} | atRisk={}",
                 request.getForecast().getItemId(), scores.size(), atRisk);
        return ResponseEntity.ok(ExpiryRiskResponse.builder()
            .itemId(request.getForecast().getItemId())
            .scores(scores)
            .totalProjectedWastage(wastage)
            .batchesAtRisk(atRisk)
            .build());
    }

    @PostMapping("/inventory/abc")
    public ResponseEntity<List<AbcClassification>> abc(@Valid @RequestBody AbcRequest request) {
        return ResponseEntity.ok(engine.classifyAbc(request.getStates()));
    }
}
