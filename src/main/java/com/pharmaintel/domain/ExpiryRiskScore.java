package com.pharmaintel.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExpiryRiskScore {
    String batchId;
    String itemId;
    double riskProbability;
    double projectedWastageQuantity;
    ExpiryAction recommendedAction;
    Long daysUntilExpiry;
    double expectedConsumption;
}
