package com.pharmaintel.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pharmaintel.domain.AnomalyFlag;
import com.pharmaintel.domain.ConsumptionShift;
import com.pharmaintel.domain.ExpiryRiskScore;
import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.ReorderSuggestion;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ItemRunResult {
    String itemId;
    ItemRunStatus status;
    ForecastResult forecast;
    List<AnomalyFlag> anomalies;
    ConsumptionShift shift;
    ReorderSuggestion reorder;
    List<ExpiryRiskScore> expiryRisks;
    String errorCode;
    String message;
}
