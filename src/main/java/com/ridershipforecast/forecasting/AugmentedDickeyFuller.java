package com.ridershipforecast.forecasting;

import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * Augmented Dickey-Fuller unit-root test with a constant term.
 * <p>
 * Regresses {@code dy_t} on a constant, {@code y_(t-1)} and {@code k} lagged differences,
 * with {@code k} from Schwert's rule, and compares the t-statistic of the {@code y_(t-1)}
 * coefficient with MacKinnon's 5% response-surface critical value.
 */
public final class AugmentedDickeyFuller {

    private static final double TAU_INF = -2.86154;
    private static final double TAU_1 = -2.8903;
    private static final double TAU_2 = -4.234;

    private AugmentedDickeyFuller() {
    }

    public record Result(double statistic, double criticalValue, int lags, boolean rejectsUnitRoot) {
    }

    public static Result test(double[] y) {
        int n = y.length;
        if (Differencing.variance(y) == 0.0) {
            // a constant is trivially stationary
            return new Result(Double.NEGATIVE_INFINITY, criticalValue(n), 0, true);
        }
        if (Differencing.variance(Differencing.difference(y, 1)) == 0.0) {
            // constant increments: an exact trend that one difference removes
            return new Result(Double.NaN, criticalValue(n), 0, false);
        }
        int lags = lags(n);
        while (true) {
            int observations = n - 1 - lags;
            // constant, level and lag regressors need spare degrees of freedom
            if (observations < lags + 4) {
                if (lags == 0) {
                    return new Result(Double.NaN, criticalValue(n), 0, false);
                }
                lags--;
                continue;
            }
            double[] dy = Differencing.difference(y, 1);
            double[] response = new double[observations];
            double[][] regressors = new double[observations][lags + 1];
            for (int i = 0; i < observations; i++) {
                int t = i + lags;
                response[i] = dy[t];
                regressors[i][0] = y[t];
                for (int j = 1; j <= lags; j++) {
                    regressors[i][j] = dy[t - j];
                }
            }
            double critical = criticalValue(observations);
            try {
                OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
                ols.newSampleData(response, regressors);
                double gamma = ols.estimateRegressionParameters()[1];
                double se = ols.estimateRegressionParametersStandardErrors()[1];
                if (!(se > 0.0) || !Double.isFinite(se)) {
                    return new Result(Double.NaN, critical, lags, false);
                }
                double statistic = gamma / se;
                return new Result(statistic, critical, lags, statistic < critical);
            } catch (SingularMatrixException e) {
                // collinear regressors, e.g. an exact linear trend: no evidence against a unit root
                return new Result(Double.NaN, critical, lags, false);
            }
        }
    }

    static int lags(int n) {
        return (int) Math.floor(12.0 * Math.pow(n / 100.0, 0.25));
    }

    static double criticalValue(int observations) {
        double t = Math.max(observations, 1);
        return TAU_INF + TAU_1 / t + TAU_2 / (t * t);
    }
}
