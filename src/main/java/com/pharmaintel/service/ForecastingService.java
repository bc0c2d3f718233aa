package com.pharmaintel.service;

import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.TimeSeries;
import com.pharmaintel.dto.ForecastRequest;
import com.pharmaintel.engine.InventoryIntelligenceEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastingService {

    private final InventoryIntelligenceEngine engine;
    private final ForecastCache forecastCache;

    public ForecastResult forecast(ForecastRequest request) {
        TimeSeries series = request.getSeries() != null
            ? request.getSeries()
            : engine.aggregate(request.getItemId(), request.getRecords(), request.getGranularity());
        return forecast(request.getItemId(), series, request.getHorizonPeriods());
    }

    public ForecastResult forecast(String itemId, TimeSeries series, int horizonPeriods) {
        ForecastResult result = forecastCache.getOrCompute(itemId, series, horizonPeriods, engine.getSettings(),
            () -> engine.forecast(itemId, series, horizonPeriods));
        log.info("Forecast ready | itemId={} | model={} | perPeriod={} | lowConfidence={}",
                 itemId, result.getModelName(), result.getPredictedQuantityPerPeriod(), result.isLowConfidence());
        return result;
    }
}
