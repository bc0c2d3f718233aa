package com.pharmaintel.engine.model;

import com.pharmaintel.domain.Granularity;
import com.pharmaintel.domain.SeriesPoint;
import com.pharmaintel.domain.TimeSeries;
import com.pharmaintel.exception.ComputationException;
import org.apache.commons.math3.random.MersenneTwister;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

// Bootstrap generator is reseeded per fit: the same series gives the same forest.
public class TreeEnsembleModel implements ForecastModel {

    public static final String NAME = "tree_ensemble";

    private final int trees;
    private final int maxDepth;
    private final int minLeaf;
    private final long seed;
    private final int lagCount;
    private final int rollingWindow;

    public TreeEnsembleModel(int trees, int maxDepth, int minLeaf, long seed, int lagCount, int rollingWindow) {
        if (trees < 1 || maxDepth < 1) {
            throw new IllegalArgumentException("trees and maxDepth must be >= 1");
        }
        this.trees = trees;
        this.maxDepth = maxDepth;
        this.minLeaf = minLeaf;
        this.seed = seed;
        this.lagCount = lagCount;
        this.rollingWindow = rollingWindow;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FittedModel fit(TimeSeries series) {
        LagFeatures features = new LagFeatures(lagCount, rollingWindow, series.getGranularity());
        List<Double> history = new ArrayList<>(series.size());
        for (SeriesPoint p : series.getPoints()) {
            history.add(p.quantity());
        }
        int rows = history.size() - features.warmup();
        if (rows < 2 * Math.max(1, minLeaf)) {
            throw new ComputationException("tree ensemble needs " + (features.warmup() + 2 * Math.max(1, minLeaf))
                + " periods, got " + history.size());
        }

        double[][] x = new double[rows][];
        double[] y = new double[rows];
        for (int r = 0; r < rows; r++) {
            int t = r + features.warmup();
            x[r] = features.row(history, t, series.getPoints().get(t).period());
            y[r] = history.get(t);
        }

        MersenneTwister rng = new MersenneTwister(seed);
        List<RegressionTree> forest = new ArrayList<>(trees);
        for (int b = 0; b < trees; b++) {
            int[] sample = new int[rows];
            for (int i = 0; i < rows; i++) {
                sample[i] = rng.nextInt(rows);
            }
            forest.add(RegressionTree.fit(x, y, sample, maxDepth, minLeaf));
        }
        return new Fitted(forest, features, List.copyOf(history), series.lastPeriod(), series.getGranularity());
    }

    private record Fitted(List<RegressionTree> forest, LagFeatures features, List<Double> history,
                          LocalDate lastPeriod, Granularity granularity) implements FittedModel {

        @Override
        public String modelName() {
            return NAME;
        }

        @Override
        public double[] predict(int horizon) {
            List<Double> extended = new ArrayList<>(history);
            LocalDate period = lastPeriod;
            double[] out = new double[horizon];
            for (int k = 0; k < horizon; k++) {
                period = granularity.next(period);
                double[] row = features.row(extended, extended.size(), period);
                double sum = 0.0;
                for (RegressionTree tree : forest) {
                    sum += tree.predict(row);
                }
                double prediction = Math.max(0.0, sum / forest.size());
                out[k] = prediction;
                extended.add(prediction);
            }
            return out;
        }
    }
}
