package com.pharmaintel.engine;

import com.pharmaintel.exception.InvalidEngineInputException;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

public final class EngineMath {

    private EngineMath() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return new DescriptiveStatistics(values).getMean();
    }

    public static double sampleStd(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return new DescriptiveStatistics(values).getStandardDeviation();
    }

    public static double rootMeanSquare(double[] residuals) {
        if (residuals.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double r : residuals) {
            sum += r * r;
        }
        return Math.sqrt(sum / residuals.length);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }

    // Acklam's inverse normal CDF approximation.
    public static double inverseStandardNormal(double p) {
        if (p <= 0.0 || p >= 1.0) {
            throw new InvalidEngineInputException("serviceLevel must be strictly between 0 and 1");
        }

        double[] a = {-3.969683028665376e+01, 2.209460984245205e+02, -2.759285104469687e+02,
            1.383577518672690e+02, -3.066479806614716e+01, 2.506628277459239e+00};
        double[] b = {-5.447609879822406e+01, 1.615858368580409e+02, -1.556989798598866e+02,
            6.680131188771972e+01, -1.328068155288572e+01};
        double[] c = {-7.784894002430293e-03, -3.223964580411365e-01, -2.400758277161838e+00,
            -2.549732539343734e+00, 4.374664141464968e+00, 2.938163982698783e+00};
        double[] d = {7.784695709041462e-03, 3.224671290700398e-01, 2.445134137142996e+00, 3.754408661907416e+00};

        double q, r;
        if (p < 0.02425) {
            q = Math.sqrt(-2.0 * Math.log(p));
            return (((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5]) /
                ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1.0);
        } else if (p > 1.0 - 0.02425) {
            q = Math.sqrt(-2.0 * Math.log(1.0 - p));
            return -(((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5]) /
                ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1.0);
        }

        q = p - 0.5;
        r = q * q;
        return (((((a[0] * r + a[1]) * r + a[2]) * r + a[3]) * r + a[4]) * r + a[5]) * q /
            (((((b[0] * r + b[1]) * r + b[2]) * r + b[3]) * r + b[4]) * r + 1.0);
    }
}
