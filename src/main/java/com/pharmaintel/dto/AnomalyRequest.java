package com.pharmaintel.dto;

import com.pharmaintel.domain.TimeSeries;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AnomalyRequest {

    @NotNull(message = "series is required")
    @Valid
    TimeSeries series;

    @Min(value = 1, message = "shiftWindow must be >= 1")
    Integer shiftWindow;
}
