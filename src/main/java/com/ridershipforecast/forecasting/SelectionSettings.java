package com.ridershipforecast.forecasting;

import java.util.List;

/**
 * Thresholds of order selection.
 *
 * @param candidatePeriods seasonal periods to choose from, in order of preference on ties
 * @param maxDifferencing  upper bound on {@code d}
 * @param maxOrder         upper bound on each of {@code p, q, P, Q}
 * @param significanceZ    normal quantile of the correlation significance bound
 * @param strategy         how ARMA orders are chosen
 */
public record SelectionSettings(List<Integer> candidatePeriods, int maxDifferencing, int maxOrder,
                                double significanceZ, SelectionStrategy strategy) {

    public SelectionSettings {
        candidatePeriods = List.copyOf(candidatePeriods);
        if (candidatePeriods.isEmpty() || candidatePeriods.stream().anyMatch(m -> m < 2)) {
            throw new IllegalArgumentException("Candidate periods must be non-empty and greater than 1");
        }
        if (maxDifferencing < 0 || maxOrder < 0) {
            throw new IllegalArgumentException("Order bounds must be non-negative");
        }
    }

    public static SelectionSettings defaults() {
        return new SelectionSettings(List.of(7, 12), 2, 2, 1.96, SelectionStrategy.HEURISTIC);
    }

    public SelectionSettings withStrategy(SelectionStrategy other) {
        return new SelectionSettings(candidatePeriods, maxDifferencing, maxOrder, significanceZ, other);
    }
}
