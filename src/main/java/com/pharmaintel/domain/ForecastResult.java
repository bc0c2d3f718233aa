package com.pharmaintel.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class ForecastResult {

    @NotBlank(message = "forecast.itemId is required")
    String itemId;

    String modelName;

    @NotNull(message = "forecast.granularity is required")
    Granularity granularity;

    @DecimalMin(value = "0.0", message = "forecast.predictedQuantityPerPeriod must be >= 0")
    double predictedQuantityPerPeriod;

    List<Double> predictions;

    ConfidenceInterval confidenceInterval;

    Double errorMetric;

    String errorMetricName;

    @DecimalMin(value = "0.0", message = "forecast.forecastStdDev must be >= 0")
    double forecastStdDev;

    boolean lowConfidence;

    Map<String, Double> candidateErrors;

    List<String> rationale;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;

    public double dailyRate() {
        return predictedQuantityPerPeriod / granularity.averageDays();
    }

    // Assumes independent days.
    public double dailyStdDev() {
        return forecastStdDev / Math.sqrt(granularity.averageDays());
    }
}
