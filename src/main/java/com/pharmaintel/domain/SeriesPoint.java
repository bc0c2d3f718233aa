package com.pharmaintel.domain;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;

public record SeriesPoint(
    @JsonFormat(pattern = "yyyy-MM-dd") LocalDate period,
    double quantity
) {}
