package com.pharmaintel.dto;

import com.pharmaintel.domain.ConsumptionRecord;
import com.pharmaintel.domain.Granularity;
import com.pharmaintel.domain.TimeSeries;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ForecastRequest {

    @NotBlank(message = "itemId is required")
    String itemId;

    @Builder.Default
    Granularity granularity = Granularity.DAY;

    @Min(value = 1, message = "horizonPeriods must be >= 1")
    @Max(value = 365, message = "horizonPeriods must be <= 365")
    @Builder.Default
    int horizonPeriods = 30;

    List<@Valid ConsumptionRecord> records;

    @Valid
    TimeSeries series;

    @AssertTrue(message = "exactly one of records or series is required")
    public boolean isSingleSource() {
        boolean hasRecords = records != null && !records.isEmpty();
        return hasRecords ^ (series != null);
    }
}
