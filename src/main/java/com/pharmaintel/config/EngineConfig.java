package com.pharmaintel.config;

import com.pharmaintel.engine.EngineSettings;
import com.pharmaintel.engine.InventoryIntelligenceEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Slf4j
@Configuration
public class EngineConfig {

    @Value("${engine.aggregation.min-periods:3}")
    private int minPeriods;

    @Value("${engine.aggregation.zone:UTC}")
    private String zone;

    @Value("${engine.forecast.holdout-fraction:0.2}")
    private double holdoutFraction;

    @Value("${engine.forecast.min-splittable-periods:6}")
    private int minSplittablePeriods;

    @Value("${engine.forecast.interval-z:1.28}")
    private double intervalZ;

    @Value("${engine.forecast.low-confidence-widening:2.0}")
    private double lowConfidenceWidening;

    @Value("${engine.forecast.lag-count:3}")
    private int lagCount;

    @Value("${engine.forecast.rolling-window:3}")
    private int rollingWindow;

    @Value("${engine.forecast.ensemble-trees:25}")
    private int ensembleTrees;

    @Value("${engine.forecast.ensemble-max-depth:4}")
    private int ensembleMaxDepth;

    @Value("${engine.forecast.ensemble-min-leaf:2}")
    private int ensembleMinLeaf;

    @Value("${engine.forecast.random-seed:42}")
    private long randomSeed;

    @Value("${engine.forecast.smoothing-alpha:0.3}")
    private double smoothingAlpha;

    @Value("${engine.anomaly.window:4}")
    private int anomalyWindow;

    @Value("${engine.anomaly.k:2.0}")
    private double anomalyK;

    @Value("${engine.anomaly.high-k:3.0}")
    private double anomalyHighK;

    @Value("${engine.anomaly.low-k:1.5}")
    private double anomalyLowK;

    @Value("${engine.anomaly.sigma-floor-ratio:0.05}")
    private double sigmaFloorRatio;

    @Value("${engine.anomaly.shift-ratio:1.5}")
    private double shiftRatio;

    @Value("${engine.reorder.service-level:0.95}")
    private double serviceLevel;

    @Value("${engine.reorder.replenishment-horizon-days:30}")
    private int replenishmentHorizonDays;

    @Value("${engine.expiry.scale:1.0}")
    private double expiryScale;

    @Value("${engine.expiry.return-threshold:0.7}")
    private double returnThreshold;

    @Value("${engine.expiry.discount-threshold:0.3}")
    private double discountThreshold;

    @Value("${engine.interactions.similarity-threshold:0.8}")
    private double similarityThreshold;

    @Bean
    public EngineSettings engineSettings() {
        EngineSettings settings = EngineSettings.builder()
            .minPeriods(minPeriods)
            .zone(ZoneId.of(zone))
            .holdoutFraction(holdoutFraction)
            .minSplittablePeriods(minSplittablePeriods)
            .intervalZ(intervalZ)
            .lowConfidenceWidening(lowConfidenceWidening)
            .lagCount(lagCount)
            .rollingWindow(rollingWindow)
            .ensembleTrees(ensembleTrees)
            .ensembleMaxDepth(ensembleMaxDepth)
            .ensembleMinLeaf(ensembleMinLeaf)
            .randomSeed(randomSeed)
            .smoothingAlpha(smoothingAlpha)
            .anomalyWindow(anomalyWindow)
            .anomalyK(anomalyK)
            .anomalyHighK(anomalyHighK)
            .anomalyLowK(anomalyLowK)
            .sigmaFloorRatio(sigmaFloorRatio)
            .shiftRatio(shiftRatio)
            .serviceLevel(serviceLevel)
            .replenishmentHorizonDays(replenishmentHorizonDays)
            .expiryScale(expiryScale)
            .returnThreshold(returnThreshold)
            .discountThreshold(discountThreshold)
            .similarityThreshold(similarityThreshold)
            .build();
        log.info("Engine settings loaded | serviceLevel={} | holdoutFraction={} | anomalyWindow={} | similarityThreshold={}",
                 serviceLevel, holdoutFraction, anomalyWindow, similarityThreshold);
        return settings;
    }

    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public InventoryIntelligenceEngine inventoryIntelligenceEngine(EngineSettings engineSettings, Clock engineClock) {
        return new InventoryIntelligenceEngine(engineSettings, engineClock);
    }
}
