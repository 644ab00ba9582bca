package com.ridershipforecast.model;

/**
 * SARIMA order {@code (p, d, q)(P, D, Q)[m]}.
 */
public record SeasonalOrder(int p, int d, int q, int seasonalP, int seasonalD, int seasonalQ, int period) {

    public SeasonalOrder {
        if (p < 0 || d < 0 || q < 0 || seasonalP < 0 || seasonalD < 0 || seasonalQ < 0) {
            throw new IllegalArgumentException("Order components must be non-negative");
        }
        if (period < 1) {
            throw new IllegalArgumentException("Seasonal period must be positive, was " + period);
        }
        if (period == 1 && (seasonalP > 0 || seasonalD > 0 || seasonalQ > 0)) {
            throw new IllegalArgumentException("Seasonal terms require a period greater than 1");
        }
    }

    public static SeasonalOrder nonSeasonal(int p, int d, int q) {
        return new SeasonalOrder(p, d, q, 0, 0, 0, 1);
    }

    public boolean hasSeasonalTerms() {
        return seasonalP > 0 || seasonalD > 0 || seasonalQ > 0;
    }

    public SeasonalOrder withoutSeasonal() {
        return new SeasonalOrder(p, d, q, 0, 0, 0, period);
    }

    public SeasonalOrder withoutDifferencing() {
        return new SeasonalOrder(p, 0, q, seasonalP, 0, seasonalQ, period);
    }

    /** Number of leading observations consumed by differencing. */
    public int differencingLoss() {
        return d + seasonalD * period;
    }

    public int armaParameterCount() {
        return p + q + seasonalP + seasonalQ;
    }

    @Override
    public String toString() {
        return "SARIMA(" + p + "," + d + "," + q + ")(" + seasonalP + "," + seasonalD + "," + seasonalQ + ")[" + period + "]";
    }
}
