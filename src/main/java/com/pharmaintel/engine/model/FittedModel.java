package com.pharmaintel.engine.model;

public interface FittedModel {

    String modelName();

    /**
     * Predictions for the {@code horizon} periods following the fitted series, never negative.
     */
    double[] predict(int horizon);

    default double validationError(double[] holdout) {
        return ForecastErrors.score(holdout, predict(holdout.length)).value();
    }
}
