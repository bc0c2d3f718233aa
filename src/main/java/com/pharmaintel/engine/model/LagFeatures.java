package com.pharmaintel.engine.model;

import com.pharmaintel.domain.Granularity;

import java.time.LocalDate;
import java.util.List;

final class LagFeatures {

    private final int lagCount;
    private final int rollingWindow;
    private final Granularity granularity;

    LagFeatures(int lagCount, int rollingWindow, Granularity granularity) {
        if (lagCount < 1 || rollingWindow < 1) {
            throw new IllegalArgumentException("lagCount and rollingWindow must be >= 1");
        }
        this.lagCount = lagCount;
        this.rollingWindow = rollingWindow;
        this.granularity = granularity;
    }

    int warmup() {
        return Math.max(lagCount, rollingWindow);
    }

    int width() {
        return lagCount + 3;
    }

    double[] row(List<Double> history, int t, LocalDate period) {
        double[] x = new double[width()];
        for (int k = 1; k <= lagCount; k++) {
            x[k - 1] = history.get(t - k);
        }
        double sum = 0.0;
        for (int k = 1; k <= rollingWindow; k++) {
            sum += history.get(t - k);
        }
        x[lagCount] = sum / rollingWindow;
        x[lagCount + 1] = granularity.seasonIndex(period);
        x[lagCount + 2] = t;
        return x;
    }
}
