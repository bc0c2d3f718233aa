package com.pharmaintel.engine.model;

import com.pharmaintel.exception.ComputationException;

// MAPE is undefined on a zero actual, so MAE then scores the whole holdout.
public final class ForecastErrors {

    public static final String MAPE = "MAPE";
    public static final String MAE = "MAE";

    private ForecastErrors() {
    }

    public static String metricFor(double[] actual) {
        for (double a : actual) {
            if (a == 0.0d) {
                return MAE;
            }
        }
        return MAPE;
    }

    public static ErrorScore score(double[] actual, double[] predicted) {
        if (actual.length != predicted.length || actual.length == 0) {
            throw new ComputationException("holdout and prediction lengths differ");
        }
        requireFinite(predicted, "prediction");
        String metric = metricFor(actual);
        double sum = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double err = Math.abs(actual[i] - predicted[i]);
            sum += MAPE.equals(metric) ? err / Math.abs(actual[i]) : err;
        }
        double value = sum / actual.length;
        return new ErrorScore(metric, MAPE.equals(metric) ? value * 100.0 : value);
    }

    public static void requireFinite(double[] values, String what) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new ComputationException(what + " is not finite");
            }
        }
    }

    static double[] clipNonNegative(double[] values) {
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.max(0.0, values[i]);
        }
        return values;
    }

    public record ErrorScore(String metric, double value) {}
}
