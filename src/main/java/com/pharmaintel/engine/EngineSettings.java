package com.pharmaintel.engine;

import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;

@Value
@Builder(toBuilder = true)
public class EngineSettings {

    // aggregation
    @Builder.Default int minPeriods = 3;
    @Builder.Default ZoneId zone = ZoneId.of("UTC");

    // forecasting
    @Builder.Default double holdoutFraction = 0.2;
    @Builder.Default int minSplittablePeriods = 6;
    @Builder.Default double intervalZ = 1.28;
    @Builder.Default double lowConfidenceWidening = 2.0;
    @Builder.Default int lagCount = 3;
    @Builder.Default int rollingWindow = 3;
    @Builder.Default int ensembleTrees = 25;
    @Builder.Default int ensembleMaxDepth = 4;
    @Builder.Default int ensembleMinLeaf = 2;
    @Builder.Default long randomSeed = 42L;
    @Builder.Default double smoothingAlpha = 0.3;

    // anomalies
    @Builder.Default int anomalyWindow = 4;
    @Builder.Default double anomalyK = 2.0;
    @Builder.Default double anomalyHighK = 3.0;
    @Builder.Default double anomalyLowK = 1.5;
    @Builder.Default double sigmaFloorRatio = 0.05;
    @Builder.Default double shiftRatio = 1.5;

    // reorder
    @Builder.Default double serviceLevel = 0.95;
    @Builder.Default int replenishmentHorizonDays = 30;

    // expiry
    @Builder.Default double expiryScale = 1.0;
    @Builder.Default double returnThreshold = 0.7;
    @Builder.Default double discountThreshold = 0.3;

    // interactions
    @Builder.Default double similarityThreshold = 0.8;

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }
}
