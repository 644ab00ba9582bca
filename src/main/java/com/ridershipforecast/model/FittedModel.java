package com.ridershipforecast.model;

import lombok.Builder;
import lombok.Getter;

import java.util.Objects;

/**
 * Estimated SARIMA model. The coefficients were estimated on {@link #getTrainingSeries()};
 * forecasts continue from the end of {@link #getSeries()}, which starts with the training
 * series and may extend past it.
 */
@Getter
public final class FittedModel {

    private final SeasonalOrder order;
    private final TimeSeries trainingSeries;
    private final TimeSeries series;
    private final double[] arCoefficients;
    private final double[] maCoefficients;
    private final double[] seasonalArCoefficients;
    private final double[] seasonalMaCoefficients;
    private final double mean;
    private final double innovationVariance;
    private final double logLikelihood;
    private final double aic;
    private final int iterations;

    @Builder
    private FittedModel(SeasonalOrder order, TimeSeries trainingSeries, TimeSeries series,
                        double[] arCoefficients, double[] maCoefficients,
                        double[] seasonalArCoefficients, double[] seasonalMaCoefficients,
                        double mean, double innovationVariance, double logLikelihood,
                        double aic, int iterations) {
        this.order = Objects.requireNonNull(order, "order");
        this.trainingSeries = Objects.requireNonNull(trainingSeries, "trainingSeries");
        this.series = series != null ? series : trainingSeries;
        this.arCoefficients = checkLength(arCoefficients, order.p(), "AR");
        this.maCoefficients = checkLength(maCoefficients, order.q(), "MA");
        this.seasonalArCoefficients = checkLength(seasonalArCoefficients, order.seasonalP(), "seasonal AR");
        this.seasonalMaCoefficients = checkLength(seasonalMaCoefficients, order.seasonalQ(), "seasonal MA");
        this.mean = mean;
        this.innovationVariance = innovationVariance;
        this.logLikelihood = logLikelihood;
        this.aic = aic;
        this.iterations = iterations;
    }

    private static double[] checkLength(double[] coefficients, int expected, String name) {
        double[] copy = coefficients != null ? coefficients.clone() : new double[0];
        if (copy.length != expected) {
            throw new IllegalArgumentException(
                name + " coefficient count " + copy.length + " does not match order " + expected);
        }
        return copy;
    }

    /**
     * Same coefficients conditioned on a longer series, used to forecast past held-out days
     * without estimating the model again.
     */
    public FittedModel extend(TimeSeries extended) {
        if (!trainingSeries.isPrefixOf(extended)) {
            throw new IllegalArgumentException(
                "Series " + extended + " does not start with the training series " + trainingSeries);
        }
        return new FittedModel(order, trainingSeries, extended, arCoefficients, maCoefficients,
            seasonalArCoefficients, seasonalMaCoefficients, mean, innovationVariance,
            logLikelihood, aic, iterations);
    }

    public double[] getArCoefficients() {
        return arCoefficients.clone();
    }

    public double[] getMaCoefficients() {
        return maCoefficients.clone();
    }

    public double[] getSeasonalArCoefficients() {
        return seasonalArCoefficients.clone();
    }

    public double[] getSeasonalMaCoefficients() {
        return seasonalMaCoefficients.clone();
    }

    public String getService() {
        return trainingSeries.service();
    }
}
