package com.ridershipforecast.forecasting;

/**
 * Lag polynomials stored as coefficient arrays in ascending powers of {@code B}.
 */
final class Polynomials {

    private Polynomials() {
    }

    static double[] multiply(double[] a, double[] b) {
        double[] out = new double[a.length + b.length - 1];
        for (int i = 0; i < a.length; i++) {
            if (a[i] == 0.0) {
                continue;
            }
            for (int j = 0; j < b.length; j++) {
                out[i + j] += a[i] * b[j];
            }
        }
        return out;
    }

    /** {@code 1 + sign * (c1 B^step + c2 B^(2 step) + ...)}. */
    static double[] lagPolynomial(double[] coefficients, int step, double sign) {
        double[] poly = new double[coefficients.length * step + 1];
        poly[0] = 1.0;
        for (int i = 0; i < coefficients.length; i++) {
            poly[(i + 1) * step] = sign * coefficients[i];
        }
        return poly;
    }

    /** {@code phi(B) PHI(B^m)} with the AR sign convention {@code 1 - phi1 B - ...}. */
    static double[] autoregressive(double[] ar, double[] seasonalAr, int period) {
        return multiply(lagPolynomial(ar, 1, -1.0), lagPolynomial(seasonalAr, period, -1.0));
    }

    /** {@code theta(B) THETA(B^m)} with the MA sign convention {@code 1 + theta1 B + ...}. */
    static double[] movingAverage(double[] ma, double[] seasonalMa, int period) {
        return multiply(lagPolynomial(ma, 1, 1.0), lagPolynomial(seasonalMa, period, 1.0));
    }
}
