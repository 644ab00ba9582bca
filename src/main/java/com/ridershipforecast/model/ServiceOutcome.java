package com.ridershipforecast.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of processing one service: a forecast with its backtest evaluation, or a skip
 * carrying the error code that stopped it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ServiceOutcome {
    String service;
    OutcomeStatus status;
    SeasonalOrder order;
    Forecast forecast;
    Forecast backtest;
    TimeSeries holdout;
    EvaluationResult evaluation;
    String skipReason;
    String message;

    public static ServiceOutcome forecast(String service, SeasonalOrder order, Forecast forecast,
                                          Forecast backtest, TimeSeries holdout, EvaluationResult evaluation) {
        return new ServiceOutcome(service, OutcomeStatus.FORECAST, order, forecast, backtest, holdout,
            evaluation, null, null);
    }

    public static ServiceOutcome skipped(String service, String skipReason, String message) {
        return new ServiceOutcome(service, OutcomeStatus.SKIPPED, null, null, null, null, null,
            skipReason, message);
    }

    public boolean isSkipped() {
        return status == OutcomeStatus.SKIPPED;
    }
}
