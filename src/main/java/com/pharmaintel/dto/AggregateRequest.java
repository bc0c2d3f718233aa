package com.pharmaintel.dto;

import com.pharmaintel.domain.ConsumptionRecord;
import com.pharmaintel.domain.Granularity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class AggregateRequest {

    @NotBlank(message = "itemId is required")
    String itemId;

    @Builder.Default
    Granularity granularity = Granularity.DAY;

    @NotEmpty(message = "records must not be empty")
    List<@Valid ConsumptionRecord> records;
}
