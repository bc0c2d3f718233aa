package com.pharmaintel.dto;

import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.InventoryState;
import com.pharmaintel.domain.SupplierQuote;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ReorderRequest {

    @NotNull(message = "forecast is required")
    @Valid
    ForecastResult forecast;

    @NotNull(message = "state is required")
    @Valid
    InventoryState state;

    @Builder.Default
    List<@Valid SupplierQuote> suppliers = List.of();
}
