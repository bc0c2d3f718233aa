package com.pharmaintel.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pharmaintel.domain.AnomalyFlag;
import com.pharmaintel.domain.ConsumptionShift;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyResponse {
    String itemId;
    int periods;
    List<AnomalyFlag> flags;
    ConsumptionShift shift;
}
