package com.ridershipforecast.forecasting;

import com.ridershipforecast.model.SeasonalOrder;

/**
 * Ordinary and seasonal differencing of plain value arrays.
 */
public final class Differencing {

    private Differencing() {
    }

    /** {@code out[i] = x[i + lag] - x[i]}; the result is {@code lag} elements shorter. */
    public static double[] difference(double[] x, int lag) {
        if (lag >= x.length) {
            return new double[0];
        }
        double[] out = new double[x.length - lag];
        for (int i = lag; i < x.length; i++) {
            out[i - lag] = x[i] - x[i - lag];
        }
        return out;
    }

    public static double[] difference(double[] x, int lag, int times) {
        double[] out = x;
        for (int i = 0; i < times; i++) {
            out = difference(out, lag);
        }
        return out;
    }

    /** Applies {@code d} ordinary then {@code D} seasonal differences. */
    public static double[] apply(double[] x, SeasonalOrder order) {
        return difference(difference(x, 1, order.d()), order.period(), order.seasonalD());
    }

    /**
     * Coefficients of {@code (1 - B)^d (1 - B^m)^D} in ascending powers of the backshift operator.
     */
    public static double[] operator(SeasonalOrder order) {
        double[] poly = {1.0};
        for (int i = 0; i < order.d(); i++) {
            poly = Polynomials.multiply(poly, new double[] {1.0, -1.0});
        }
        double[] seasonal = new double[order.period() + 1];
        seasonal[0] = 1.0;
        seasonal[order.period()] = -1.0;
        for (int i = 0; i < order.seasonalD(); i++) {
            poly = Polynomials.multiply(poly, seasonal);
        }
        return poly;
    }

    public static double variance(double[] x) {
        if (x.length == 0) {
            return 0.0;
        }
        double mean = mean(x);
        double sum = 0.0;
        for (double v : x) {
            sum += (v - mean) * (v - mean);
        }
        return sum / x.length;
    }

    public static double mean(double[] x) {
        if (x.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : x) {
            sum += v;
        }
        return sum / x.length;
    }
}
