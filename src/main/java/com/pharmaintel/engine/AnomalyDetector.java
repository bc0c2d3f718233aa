package com.pharmaintel.engine;

import com.pharmaintel.domain.AnomalyFlag;
import com.pharmaintel.domain.AnomalySeverity;
import com.pharmaintel.domain.ConsumptionShift;
import com.pharmaintel.domain.SeriesPoint;
import com.pharmaintel.domain.TimeSeries;
import com.pharmaintel.exception.InvalidEngineInputException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public class AnomalyDetector {

    private static final double MIN_SIGMA = 1e-9;

    private final EngineSettings settings;

    public AnomalyDetector(EngineSettings settings) {
        if (settings.getAnomalyWindow() < 2) {
            throw new IllegalArgumentException("anomaly window must be >= 2");
        }
        this.settings = settings;
    }

    public List<AnomalyFlag> detectAnomalies(TimeSeries series) {
        int window = settings.getAnomalyWindow();
        if (series == null || series.size() < window + 1) {
            return List.of();
        }
        double[] values = series.values();
        List<AnomalyFlag> flags = new ArrayList<>();
        for (int i = window; i < values.length; i++) {
            double[] trailing = Arrays.copyOfRange(values, i - window, i);
            double expected = EngineMath.mean(trailing);
            double sigma = EngineMath.sampleStd(trailing);
            // a perfectly flat window would flag any wobble
            double effectiveSigma = Math.max(Math.max(sigma, settings.getSigmaFloorRatio() * Math.abs(expected)), MIN_SIGMA);
            double score = Math.abs(values[i] - expected) / effectiveSigma;
            AnomalySeverity severity = severityOf(score);
            if (severity == null) {
                continue;
            }
            SeriesPoint point = series.getPoints().get(i);
            flags.add(AnomalyFlag.builder()
                .itemId(series.getItemId())
                .period(point.period())
                .observed(point.quantity())
                .expected(EngineMath.round(expected))
                .sigma(EngineMath.round(effectiveSigma))
                .deviationScore(EngineMath.round(score))
                .severity(severity)
                .build());
        }
        return List.copyOf(flags);
    }

    public Optional<ConsumptionShift> detectShift(TimeSeries series, int window) {
        if (window < 1) {
            throw new InvalidEngineInputException("shift window must be >= 1");
        }
        if (series == null || series.size() < 2 * window) {
            return Optional.empty();
        }
        double[] values = series.values();
        int n = values.length;
        double previous = EngineMath.mean(Arrays.copyOfRange(values, n - 2 * window, n - window));
        double recent = EngineMath.mean(Arrays.copyOfRange(values, n - window, n));
        if (previous <= 0.0) {
            return Optional.empty();
        }
        double ratio = recent / previous;
        ConsumptionShift.Direction direction;
        if (ratio > settings.getShiftRatio()) {
            direction = ConsumptionShift.Direction.INCREASE;
        } else if (ratio < 1.0 / settings.getShiftRatio()) {
            direction = ConsumptionShift.Direction.DECREASE;
        } else {
            return Optional.empty();
        }
        return Optional.of(ConsumptionShift.builder()
            .itemId(series.getItemId())
            .direction(direction)
            .window(window)
            .previousMean(EngineMath.round(previous))
            .recentMean(EngineMath.round(recent))
            .changeRatio(EngineMath.round(ratio))
            .build());
    }

    private AnomalySeverity severityOf(double score) {
        if (score > settings.getAnomalyHighK()) {
            return AnomalySeverity.HIGH;
        }
        if (score > settings.getAnomalyK()) {
            return AnomalySeverity.MEDIUM;
        }
        if (score > settings.getAnomalyLowK()) {
            return AnomalySeverity.LOW;
        }
        return null;
    }
}
