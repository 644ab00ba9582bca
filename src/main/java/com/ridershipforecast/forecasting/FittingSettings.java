package com.ridershipforecast.forecasting;

/**
 * Budget of the likelihood optimizer.
 *
 * @param minObservations shortest training series accepted
 * @param maxIterations   simplex iterations before giving up
 * @param maxEvaluations  objective evaluations before giving up
 */
public record FittingSettings(int minObservations, int maxIterations, int maxEvaluations) {

    public FittingSettings {
        if (minObservations < 1 || maxIterations < 1 || maxEvaluations < 1) {
            throw new IllegalArgumentException("Fitting limits must be positive");
        }
    }

    public static FittingSettings defaults() {
        return new FittingSettings(30, 10_000, 40_000);
    }
}
