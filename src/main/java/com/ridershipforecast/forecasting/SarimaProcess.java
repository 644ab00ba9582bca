package com.ridershipforecast.forecasting;

import com.ridershipforecast.model.FittedModel;
import com.ridershipforecast.model.SeasonalOrder;

import java.util.Arrays;

/**
 * Lag polynomials and innovations of a multiplicative SARIMA model.
 * {@code ar} is {@code phi(B) PHI(B^m)} with {@code ar[0] = 1}, {@code ma} is
 * {@code theta(B) THETA(B^m)} with {@code ma[0] = 1}.
 */
final class SarimaProcess {

    private final SeasonalOrder order;
    private final double[] ar;
    private final double[] ma;

    SarimaProcess(SeasonalOrder order, double[] arCoefficients, double[] maCoefficients,
                  double[] seasonalArCoefficients, double[] seasonalMaCoefficients) {
        this.order = order;
        this.ar = Polynomials.autoregressive(arCoefficients, seasonalArCoefficients, order.period());
        this.ma = Polynomials.movingAverage(maCoefficients, seasonalMaCoefficients, order.period());
    }

    static SarimaProcess of(FittedModel model) {
        return new SarimaProcess(model.getOrder(), model.getArCoefficients(), model.getMaCoefficients(),
            model.getSeasonalArCoefficients(), model.getSeasonalMaCoefficients());
    }

    /** Coefficients packed as {@code [ar..., ma..., seasonal ar..., seasonal ma...]}. */
    static SarimaProcess of(SeasonalOrder order, double[] packed) {
        int p = order.p();
        int q = order.q();
        int sp = order.seasonalP();
        int sq = order.seasonalQ();
        return new SarimaProcess(order,
            Arrays.copyOfRange(packed, 0, p),
            Arrays.copyOfRange(packed, p, p + q),
            Arrays.copyOfRange(packed, p + q, p + q + sp),
            Arrays.copyOfRange(packed, p + q + sp, p + q + sp + sq));
    }

    /** Observations needed before the first innovation can be computed. */
    int conditioningLags() {
        return ar.length - 1;
    }

    double[] ma() {
        return ma;
    }

    /** AR polynomial of the levels, including the differencing operator. */
    double[] integratedAr() {
        return Polynomials.multiply(ar, Differencing.operator(order));
    }

    /**
     * Innovations of the stationary series {@code x}; entries before
     * {@link #conditioningLags()} are zero.
     */
    double[] innovations(double[] x) {
        int start = conditioningLags();
        double[] e = new double[x.length];
        for (int t = start; t < x.length; t++) {
            double value = 0.0;
            for (int i = 0; i < ar.length; i++) {
                value += ar[i] * x[t - i];
            }
            for (int j = 1; j < ma.length && j <= t; j++) {
                value -= ma[j] * e[t - j];
            }
            e[t] = value;
        }
        return e;
    }

    double sumOfSquares(double[] x) {
        double[] e = innovations(x);
        double sum = 0.0;
        for (int t = conditioningLags(); t < e.length; t++) {
            sum += e[t] * e[t];
        }
        return sum;
    }

    /** Psi weights {@code psi_0..psi_(count-1)} of the integrated model. */
    double[] psiWeights(int count) {
        double[] full = integratedAr();
        double[] psi = new double[count];
        for (int j = 0; j < count; j++) {
            double value = j == 0 ? 1.0 : (j < ma.length ? ma[j] : 0.0);
            for (int i = 1; i <= j && i < full.length; i++) {
                value -= full[i] * psi[j - i];
            }
            psi[j] = value;
        }
        return psi;
    }
}
