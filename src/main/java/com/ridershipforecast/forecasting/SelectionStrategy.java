package com.ridershipforecast.forecasting;

public enum SelectionStrategy {
    /** ACF/PACF cut-off inspection at low and seasonal lags. */
    HEURISTIC,
    /** Heuristic differencing and period, then the lowest-AIC ARMA orders within the same bounds. */
    AIC_GRID
}
