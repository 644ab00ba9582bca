package com.ridershipforecast.forecasting;

import com.ridershipforecast.model.FittedModel;
import com.ridershipforecast.model.Forecast;
import com.ridershipforecast.model.ForecastPoint;
import com.ridershipforecast.model.TimeSeries;
import org.apache.commons.math3.distribution.NormalDistribution;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Multi-step point forecasts and normal prediction intervals from a fitted model.
 * Future innovations are taken as zero, values and bounds are clipped at zero.
 */
public class Forecaster {

    private final int horizon;
    private final double intervalQuantile;

    public Forecaster(int horizon, double intervalLevel) {
        if (horizon < 1) {
            throw new IllegalArgumentException("Horizon must be positive, was " + horizon);
        }
        if (!(intervalLevel > 0.0 && intervalLevel < 1.0)) {
            throw new IllegalArgumentException("Interval level must be in (0, 1), was " + intervalLevel);
        }
        this.horizon = horizon;
        this.intervalQuantile = new NormalDistribution(0.0, 1.0)
            .inverseCumulativeProbability(0.5 + intervalLevel / 2.0);
    }

    public int getHorizon() {
        return horizon;
    }

    public Forecast forecast(FittedModel model) {
        return forecast(model, horizon);
    }

    /** Forecasts {@code steps} days following the last day of {@link FittedModel#getSeries()}. */
    public Forecast forecast(FittedModel model, int steps) {
        TimeSeries series = model.getSeries();
        SarimaProcess process = SarimaProcess.of(model);
        double[] y = series.values();
        int n = y.length;
        double mean = model.getMean();

        double[] w = Differencing.apply(y, model.getOrder());
        double[] x = new double[w.length];
        for (int i = 0; i < w.length; i++) {
            x[i] = w[i] - mean;
        }
        double[] innovations = process.innovations(x);
        int offset = model.getOrder().differencingLoss();

        double[] e = new double[n + steps];
        System.arraycopy(innovations, 0, e, offset, innovations.length);
        double[] u = new double[n + steps];
        for (int t = 0; t < n; t++) {
            u[t] = y[t] - mean;
        }

        double[] ar = process.integratedAr();
        double[] ma = process.ma();
        for (int t = n; t < n + steps; t++) {
            double value = 0.0;
            for (int i = 1; i < ar.length && i <= t; i++) {
                value -= ar[i] * u[t - i];
            }
            for (int j = 1; j < ma.length && j <= t; j++) {
                value += ma[j] * e[t - j];
            }
            u[t] = value;
        }

        double[] psi = process.psiWeights(steps);
        double cumulative = 0.0;
        LocalDate start = series.endDate().plusDays(1);
        List<ForecastPoint> points = new ArrayList<>(steps);
        for (int h = 0; h < steps; h++) {
            cumulative += psi[h] * psi[h];
            double raw = u[n + h] + mean;
            double halfWidth = intervalQuantile * Math.sqrt(model.getInnovationVariance() * cumulative);
            points.add(new ForecastPoint(start.plusDays(h),
                clip(raw), clip(raw - halfWidth), clip(raw + halfWidth)));
        }
        return new Forecast(series.service(), points);
    }

    private static double clip(double value) {
        return Double.isFinite(value) ? Math.max(0.0, value) : 0.0;
    }
}
