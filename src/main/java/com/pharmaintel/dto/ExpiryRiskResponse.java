package com.pharmaintel.dto;

import com.pharmaintel.domain.ExpiryRiskScore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ExpiryRiskResponse {
    String itemId;
    List<ExpiryRiskScore> scores;
    double totalProjectedWastage;
    long batchesAtRisk;
}
