package com.pharmaintel.engine.model;

import com.pharmaintel.domain.TimeSeries;
import com.pharmaintel.exception.ComputationException;
import org.apache.commons.math3.stat.regression.SimpleRegression;

public class LinearTrendModel implements ForecastModel {

    public static final String NAME = "linear_trend";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FittedModel fit(TimeSeries series) {
        double[] values = series.values();
        if (values.length < 2) {
            throw new ComputationException("linear trend needs at least 2 periods, got " + values.length);
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }
        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        if (!Double.isFinite(slope) || !Double.isFinite(intercept)) {
            throw new ComputationException("linear trend regression did not converge");
        }
        return new Fitted(intercept, slope, values.length);
    }

    private record Fitted(double intercept, double slope, int length) implements FittedModel {

        @Override
        public String modelName() {
            return NAME;
        }

        @Override
        public double[] predict(int horizon) {
            double[] out = new double[horizon];
            for (int k = 0; k < horizon; k++) {
                out[k] = intercept + slope * (length + k);
            }
            return ForecastErrors.clipNonNegative(out);
        }
    }
}
