package com.pharmaintel.dto;

import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.InventoryState;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ExpiryRiskRequest {

    @NotNull(message = "forecast is required")
    @Valid
    ForecastResult forecast;

    @NotEmpty(message = "batches must not be empty")
    List<@Valid InventoryState> batches;
}
