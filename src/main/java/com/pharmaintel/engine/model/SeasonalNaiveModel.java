package com.pharmaintel.engine.model;

import com.pharmaintel.domain.TimeSeries;
import com.pharmaintel.engine.EngineMath;
import com.pharmaintel.exception.ComputationException;

import java.util.Arrays;

public class SeasonalNaiveModel implements ForecastModel {

    public static final String NAME = "seasonal_naive";
    public static final String SMOOTHING_NAME = "exponential_smoothing";
    public static final String MEAN_NAME = "seasonal_naive_mean";

    private final double alpha;

    public SeasonalNaiveModel(double alpha) {
        if (alpha <= 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("smoothing alpha must be in (0, 1]");
        }
        this.alpha = alpha;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FittedModel fit(TimeSeries series) {
        double[] values = series.values();
        if (values.length == 0) {
            throw new ComputationException("seasonal naive needs at least 1 period");
        }
        int season = series.getGranularity().seasonLength();
        if (values.length > season) {
            double[] lastSeason = Arrays.copyOfRange(values, values.length - season, values.length);
            return new Repeating(NAME, lastSeason);
        }
        double level = values[0];
        for (int i = 1; i < values.length; i++) {
            level = alpha * values[i] + (1.0 - alpha) * level;
        }
        return new Repeating(SMOOTHING_NAME, new double[] {level});
    }

    public static FittedModel meanOf(TimeSeries series) {
        return new Repeating(MEAN_NAME, new double[] {EngineMath.mean(series.values())});
    }

    private record Repeating(String modelName, double[] cycle) implements FittedModel {

        @Override
        public double[] predict(int horizon) {
            double[] out = new double[horizon];
            for (int k = 0; k < horizon; k++) {
                out[k] = cycle[k % cycle.length];
            }
            return ForecastErrors.clipNonNegative(out);
        }
    }
}
