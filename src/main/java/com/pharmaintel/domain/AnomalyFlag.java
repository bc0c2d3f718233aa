package com.pharmaintel.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class AnomalyFlag {
    String itemId;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate period;
    double observed;
    double expected;
    double sigma;
    double deviationScore;
    AnomalySeverity severity;
}
