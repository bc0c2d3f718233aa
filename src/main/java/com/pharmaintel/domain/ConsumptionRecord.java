package com.pharmaintel.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class ConsumptionRecord {

    @NotBlank(message = "itemId is required")
    String itemId;

    @NotNull(message = "timestamp is required")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;

    @DecimalMin(value = "0.0", message = "quantityConsumed must be >= 0")
    double quantityConsumed;
}
