package com.ridershipforecast.forecasting;

import com.ridershipforecast.exception.ConvergenceException;
import com.ridershipforecast.exception.InsufficientDataException;
import com.ridershipforecast.model.FittedModel;
import com.ridershipforecast.model.SeasonalOrder;
import com.ridershipforecast.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses a {@link SeasonalOrder} for a series. Deterministic for a given series and settings.
 * <ol>
 *   <li>{@code d}: difference while the ADF test cannot reject a unit root, at most
 *       {@code maxDifferencing} times.</li>
 *   <li>{@code m}: the candidate period with the strongest autocorrelation at its own lag.</li>
 *   <li>{@code D = 1} when that autocorrelation is significant; seasonal terms are dropped when
 *       the differenced series is shorter than two periods.</li>
 *   <li>{@code p, q, P, Q}: leading significant PACF/ACF lags at {@code 1, 2} and {@code m, 2m}.</li>
 * </ol>
 */
@Slf4j
public final class OrderSelector {

    private OrderSelector() {
    }

    public static SeasonalOrder select(TimeSeries series, SelectionSettings settings, SarimaFitter fitter) {
        SeasonalOrder heuristic = heuristic(series, settings);
        if (settings.strategy() == SelectionStrategy.AIC_GRID) {
            return aicGrid(series, heuristic, settings, fitter);
        }
        return heuristic;
    }

    public static SeasonalOrder heuristic(TimeSeries series, SelectionSettings settings) {
        double[] y = series.values();
        int defaultPeriod = settings.candidatePeriods().get(0);
        if (Differencing.variance(y) == 0.0) {
            return new SeasonalOrder(0, 0, 0, 0, 0, 0, defaultPeriod);
        }

        int d = 0;
        double[] z = y;
        while (d < settings.maxDifferencing() && !AugmentedDickeyFuller.test(z).rejectsUnitRoot()) {
            z = Differencing.difference(z, 1);
            d++;
        }

        int m = strongestPeriod(z, settings);
        double bound = Autocorrelation.significanceBound(z.length, settings.significanceZ());
        boolean seasonal = admitsSeasonalTerms(z, m);

        int seasonalD = 0;
        double[] w = z;
        if (seasonal && Math.abs(Autocorrelation.acf(z, m)) > bound) {
            seasonalD = 1;
            w = Differencing.difference(z, m);
        }

        int maxLag = Math.max(settings.maxOrder(), seasonal ? settings.maxOrder() * m : 0);
        maxLag = Math.min(maxLag, w.length - 1);
        if (maxLag < 1 || Differencing.variance(w) == 0.0) {
            return new SeasonalOrder(0, d, 0, 0, seasonalD, 0, m);
        }
        double[] pacf = Autocorrelation.pacf(w, maxLag);
        double[] acf = new double[maxLag];
        for (int k = 1; k <= maxLag; k++) {
            acf[k - 1] = Autocorrelation.acf(w, k);
        }
        double wBound = Autocorrelation.significanceBound(w.length, settings.significanceZ());

        int p = leadingSignificant(pacf, 1, settings.maxOrder(), wBound);
        int q = leadingSignificant(acf, 1, settings.maxOrder(), wBound);
        int seasonalP = 0;
        int seasonalQ = 0;
        if (seasonal) {
            seasonalP = leadingSignificant(pacf, m, settings.maxOrder(), wBound);
            seasonalQ = leadingSignificant(acf, m, settings.maxOrder(), wBound);
        }
        SeasonalOrder order = new SeasonalOrder(p, d, q, seasonalP, seasonalD, seasonalQ, m);
        log.debug("Heuristic order | service={} | order={}", series.service(), order);
        return order;
    }

    /**
     * Keeps {@code d}, {@code D} and {@code m} and searches {@code p, q, P, Q} in
     * {@code 0..maxOrder} for the lowest AIC. Orders that fail to fit are passed over; if none
     * fits, the heuristic order is returned unchanged.
     */
    static SeasonalOrder aicGrid(TimeSeries series, SeasonalOrder base, SelectionSettings settings,
                                 SarimaFitter fitter) {
        int seasonalMax = admitsSeasonalTerms(Differencing.difference(series.values(), 1, base.d()), base.period())
            ? settings.maxOrder() : 0;
        SeasonalOrder best = null;
        double bestAic = Double.POSITIVE_INFINITY;
        for (int p = 0; p <= settings.maxOrder(); p++) {
            for (int q = 0; q <= settings.maxOrder(); q++) {
                for (int sp = 0; sp <= seasonalMax; sp++) {
                    for (int sq = 0; sq <= seasonalMax; sq++) {
                        SeasonalOrder candidate = new SeasonalOrder(p, base.d(), q, sp, base.seasonalD(), sq, base.period());
                        try {
                            FittedModel model = fitter.fit(series, candidate);
                            if (model.getAic() < bestAic) {
                                bestAic = model.getAic();
                                best = candidate;
                            }
                        } catch (ConvergenceException | InsufficientDataException e) {
                            log.debug("Grid candidate skipped | order={} | reason={}", candidate, e.getMessage());
                        }
                    }
                }
            }
        }
        return best != null ? best : base;
    }

    static int strongestPeriod(double[] z, SelectionSettings settings) {
        int best = settings.candidatePeriods().get(0);
        double bestStrength = -1.0;
        for (int m : settings.candidatePeriods()) {
            double strength = m < z.length ? Math.abs(Autocorrelation.acf(z, m)) : 0.0;
            if (strength > bestStrength) {
                bestStrength = strength;
                best = m;
            }
        }
        return best;
    }

    /** Seasonal terms need two full periods of the series after ordinary differencing. */
    static boolean admitsSeasonalTerms(double[] differenced, int period) {
        return differenced.length >= 2 * period;
    }

    /** Counts consecutive significant values at lags {@code step, 2 step, ...}, up to {@code max}. */
    private static int leadingSignificant(double[] correlations, int step, int max, double bound) {
        int count = 0;
        for (int k = 1; k <= max; k++) {
            int lag = k * step;
            if (lag > correlations.length || Math.abs(correlations[lag - 1]) <= bound) {
                break;
            }
            count++;
        }
        return count;
    }
}
