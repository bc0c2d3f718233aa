package com.pharmaintel.engine.model;

import com.pharmaintel.domain.TimeSeries;

/**
 * A forecasting candidate. Candidates are compared on a trailing holdout, so every implementation
 * must be deterministic for identical input.
 */
public interface ForecastModel {

    /**
     * Stable candidate name, reported in forecast diagnostics.
     */
    String name();

    /**
     * Fits the candidate to the series.
     *
     * @throws com.pharmaintel.exception.ComputationException when the series cannot support the model
     */
    FittedModel fit(TimeSeries series);
}
