package com.pharmaintel.dto;

import com.pharmaintel.domain.ConsumptionRecord;
import com.pharmaintel.domain.Granularity;
import com.pharmaintel.domain.InventoryState;
import com.pharmaintel.domain.SupplierQuote;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class BatchRunRequest {

    @Builder.Default
    Granularity granularity = Granularity.DAY;

    @Min(value = 1, message = "horizonPeriods must be >= 1")
    @Max(value = 365, message = "horizonPeriods must be <= 365")
    @Builder.Default
    int horizonPeriods = 30;

    @Builder.Default
    List<@Valid ConsumptionRecord> records = List.of();

    @NotEmpty(message = "inventory must not be empty")
    List<@Valid InventoryState> inventory;

    @Builder.Default
    List<@Valid SupplierQuote> suppliers = List.of();
}
