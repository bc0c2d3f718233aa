package com.pharmaintel.engine;

import com.pharmaintel.domain.ConfidenceInterval;
import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.TimeSeries;
import com.pharmaintel.engine.model.FittedModel;
import com.pharmaintel.engine.model.ForecastErrors;
import com.pharmaintel.engine.model.ForecastModel;
import com.pharmaintel.engine.model.LinearTrendModel;
import com.pharmaintel.engine.model.SeasonalNaiveModel;
import com.pharmaintel.engine.model.TreeEnsembleModel;
import com.pharmaintel.exception.ComputationException;
import com.pharmaintel.exception.InsufficientDataException;
import com.pharmaintel.exception.InvalidEngineInputException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// On equal holdout error the earlier candidate wins.
@Slf4j
public class ForecastSelector {

    private static final double TIE_TOLERANCE = 1e-9;
    private static final double SHORT_SERIES_SIGMA_FLOOR = 0.25;

    private final EngineSettings settings;
    private final Clock clock;
    private final List<ForecastModel> candidates;

    public ForecastSelector(EngineSettings settings, Clock clock) {
        this(settings, clock, List.of(
            new LinearTrendModel(),
            new TreeEnsembleModel(settings.getEnsembleTrees(), settings.getEnsembleMaxDepth(),
                settings.getEnsembleMinLeaf(), settings.getRandomSeed(),
                settings.getLagCount(), settings.getRollingWindow()),
            new SeasonalNaiveModel(settings.getSmoothingAlpha())));
    }

    public ForecastSelector(EngineSettings settings, Clock clock, List<ForecastModel> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("at least one forecast candidate is required");
        }
        this.settings = settings;
        this.clock = clock;
        this.candidates = List.copyOf(candidates);
    }

    public List<String> candidateNames() {
        return candidates.stream().map(ForecastModel::name).toList();
    }

    public ForecastResult forecast(String itemId, TimeSeries series, int horizonPeriods) {
        validate(series, horizonPeriods);
        int n = series.size();
        if (n < settings.getMinPeriods()) {
            throw new InsufficientDataException(itemId, n, settings.getMinPeriods());
        }
        List<String> rationale = new ArrayList<>();
        if (n < settings.getMinSplittablePeriods()) {
            rationale.add("series_too_short_for_selection:" + n);
            FittedModel fitted = shortSeriesModel(series, rationale);
            return lowConfidenceResult(itemId, series, fitted, horizonPeriods, rationale);
        }

        int holdout = Math.max(1, (int) Math.floor(n * settings.getHoldoutFraction()));
        TimeSeries train = series.head(n - holdout);
        double[] actual = Arrays.copyOfRange(series.values(), n - holdout, n);
        String metric = ForecastErrors.metricFor(actual);

        List<Evaluation> evaluations = new ArrayList<>();
        Map<String, Double> candidateErrors = new LinkedHashMap<>();
        for (int priority = 0; priority < candidates.size(); priority++) {
            ForecastModel candidate = candidates.get(priority);
            try {
                double[] predicted = candidate.fit(train).predict(holdout);
                double error = ForecastErrors.score(actual, predicted).value();
                evaluations.add(new Evaluation(candidate, priority, error, residuals(actual, predicted)));
                candidateErrors.put(candidate.name(), EngineMath.round(error));
            } catch (ComputationException ex) {
                rationale.add("skipped " + candidate.name() + ": " + ex.getMessage());
                log.debug("Candidate skipped | itemId={} | model={} | reason={}", itemId, candidate.name(), ex.getMessage());
            }
        }

        evaluations.sort(Comparator.comparingInt(Evaluation::priority));
        List<Evaluation> ranked = rank(evaluations);
        for (Evaluation winner : ranked) {
            try {
                FittedModel fitted = winner.model().fit(series);
                double[] predictions = fitted.predict(horizonPeriods);
                ForecastErrors.requireFinite(predictions, "forecast");
                rationale.add("selected " + fitted.modelName() + " by lowest " + metric);
                double sigma = EngineMath.rootMeanSquare(winner.residuals());
                return result(itemId, series, fitted.modelName(), predictions, sigma, 1.0, false,
                    EngineMath.round(winner.error()), metric, candidateErrors, rationale);
            } catch (ComputationException ex) {
                rationale.add("refit failed " + winner.model().name() + ": " + ex.getMessage());
                log.warn("Refit failed | itemId={} | model={} | reason={}", itemId, winner.model().name(), ex.getMessage());
            }
        }

        log.warn("All forecast candidates failed | itemId={} | periods={} | fallback={}",
                 itemId, n, SeasonalNaiveModel.MEAN_NAME);
        rationale.add("all_candidates_failed");
        return lowConfidenceResult(itemId, series, SeasonalNaiveModel.meanOf(series), horizonPeriods, rationale);
    }

    private FittedModel shortSeriesModel(TimeSeries series, List<String> rationale) {
        try {
            return new SeasonalNaiveModel(settings.getSmoothingAlpha()).fit(series);
        } catch (ComputationException ex) {
            rationale.add("skipped " + SeasonalNaiveModel.NAME + ": " + ex.getMessage());
            return SeasonalNaiveModel.meanOf(series);
        }
    }

    private ForecastResult lowConfidenceResult(String itemId, TimeSeries series, FittedModel fitted,
                                               int horizon, List<String> rationale) {
        double[] values = series.values();
        double sigma = Math.max(EngineMath.sampleStd(values), SHORT_SERIES_SIGMA_FLOOR * EngineMath.mean(values));
        return result(itemId, series, fitted.modelName(), fitted.predict(horizon), sigma,
            settings.getLowConfidenceWidening(), true, null, null, Map.of(), rationale);
    }

    private ForecastResult result(String itemId, TimeSeries series, String modelName, double[] predictions,
                                  double sigma, double widening, boolean lowConfidence, Double error,
                                  String metric, Map<String, Double> candidateErrors, List<String> rationale) {
        List<Double> clipped = Arrays.stream(predictions).map(p -> Math.max(0.0, p)).boxed().toList();
        double point = clipped.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double halfWidth = settings.getIntervalZ() * sigma * widening;
        return ForecastResult.builder()
            .itemId(itemId)
            .modelName(modelName)
            .granularity(series.getGranularity())
            .predictedQuantityPerPeriod(point)
            .predictions(clipped)
            .confidenceInterval(new ConfidenceInterval(Math.max(0.0, point - halfWidth), point + halfWidth))
            .errorMetric(error)
            .errorMetricName(metric)
            .forecastStdDev(sigma)
            .lowConfidence(lowConfidence)
            .candidateErrors(Map.copyOf(candidateErrors))
            .rationale(List.copyOf(rationale))
            .generatedAt(clock.instant())
            .build();
    }

    // Stable ranking: a later candidate displaces an earlier one only when strictly better.
    private static List<Evaluation> rank(List<Evaluation> byPriority) {
        List<Evaluation> ranked = new ArrayList<>();
        for (Evaluation e : byPriority) {
            int at = 0;
            while (at < ranked.size() && ranked.get(at).error() <= e.error() + TIE_TOLERANCE) {
                at++;
            }
            ranked.add(at, e);
        }
        return ranked;
    }

    private static double[] residuals(double[] actual, double[] predicted) {
        double[] out = new double[actual.length];
        for (int i = 0; i < actual.length; i++) {
            out[i] = actual[i] - predicted[i];
        }
        return out;
    }

    private static void validate(TimeSeries series, int horizonPeriods) {
        if (horizonPeriods < 1) {
            throw new InvalidEngineInputException("horizonPeriods must be >= 1");
        }
        if (series == null || series.getGranularity() == null || series.getPoints() == null) {
            throw new InvalidEngineInputException("series with granularity and points is required");
        }
        if (!series.isContiguous()) {
            throw new InvalidEngineInputException("series periods must be contiguous");
        }
        for (double v : series.values()) {
            if (!Double.isFinite(v) || v < 0.0) {
                throw new InvalidEngineInputException("series quantities must be finite and >= 0");
            }
        }
    }

    private record Evaluation(ForecastModel model, int priority, double error, double[] residuals) {}
}
