package com.ridershipforecast.forecasting;

/**
 * Sample autocorrelation and partial autocorrelation.
 */
public final class Autocorrelation {

    private Autocorrelation() {
    }

    /**
     * Sample autocorrelation at {@code lag}, normalised by the full-sample variance.
     * Zero for a constant series or when the lag does not fit in the series.
     */
    public static double acf(double[] x, int lag) {
        int n = x.length;
        if (lag <= 0) {
            return lag == 0 && n > 0 ? 1.0 : 0.0;
        }
        if (lag >= n) {
            return 0.0;
        }
        double mean = Differencing.mean(x);
        double denominator = 0.0;
        for (double v : x) {
            denominator += (v - mean) * (v - mean);
        }
        if (denominator == 0.0) {
            return 0.0;
        }
        double numerator = 0.0;
        for (int t = lag; t < n; t++) {
            numerator += (x[t] - mean) * (x[t - lag] - mean);
        }
        return numerator / denominator;
    }

    /**
     * Partial autocorrelations for lags {@code 1..maxLag} by the Durbin-Levinson recursion.
     * Index {@code k - 1} of the result holds lag {@code k}.
     */
    public static double[] pacf(double[] x, int maxLag) {
        double[] rho = new double[maxLag + 1];
        for (int k = 0; k <= maxLag; k++) {
            rho[k] = acf(x, k);
        }
        double[] result = new double[maxLag];
        double[] phi = new double[maxLag + 1];
        double[] previous = new double[maxLag + 1];
        double error = 1.0;
        for (int k = 1; k <= maxLag; k++) {
            double numerator = rho[k];
            for (int j = 1; j < k; j++) {
                numerator -= previous[j] * rho[k - j];
            }
            double reflection = error > 0.0 ? numerator / error : 0.0;
            phi[k] = reflection;
            for (int j = 1; j < k; j++) {
                phi[j] = previous[j] - reflection * previous[k - j];
            }
            error *= 1.0 - reflection * reflection;
            System.arraycopy(phi, 0, previous, 0, k + 1);
            result[k - 1] = reflection;
        }
        return result;
    }

    /** Two-sided significance bound {@code z / sqrt(n)}. */
    public static double significanceBound(int n, double z) {
        return n > 0 ? z / Math.sqrt(n) : Double.POSITIVE_INFINITY;
    }
}
