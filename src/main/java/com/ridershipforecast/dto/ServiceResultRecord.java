package com.ridershipforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.ridershipforecast.model.EvaluationResult;
import com.ridershipforecast.model.Forecast;
import com.ridershipforecast.model.ForecastPoint;
import com.ridershipforecast.model.Observation;
import com.ridershipforecast.model.OutcomeStatus;
import com.ridershipforecast.model.ServiceOutcome;

import java.time.LocalDate;
import java.util.List;

/**
 * Per-service output consumed by reporting. Skip records carry {@code skipReason} and
 * {@code message} instead of forecast fields.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceResultRecord(
    String service,
    @JsonFormat(pattern = "yyyy-MM-dd") LocalDate runDate,
    OutcomeStatus status,
    String order,
    List<LocalDate> forecastDates,
    List<Double> forecastValues,
    List<Double> forecastLower,
    List<Double> forecastUpper,
    List<LocalDate> backtestDates,
    List<Double> backtestValues,
    List<Double> backtestActuals,
    Double mae,
    Double rmse,
    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonSerialize(nullsUsing = NotApplicableJson.NullSerializer.class)
    @JsonDeserialize(using = NotApplicableJson.DoubleDeserializer.class)
    Double mape,
    String skipReason,
    String message) {

    public static ServiceResultRecord from(LocalDate runDate, ServiceOutcome outcome) {
        if (outcome.isSkipped()) {
            return new ServiceResultRecord(outcome.getService(), runDate, OutcomeStatus.SKIPPED, null,
                null, null, null, null, null, null, null, null, null, null,
                outcome.getSkipReason(), outcome.getMessage());
        }
        Forecast forecast = outcome.getForecast();
        Forecast backtest = outcome.getBacktest();
        EvaluationResult evaluation = outcome.getEvaluation();
        return new ServiceResultRecord(outcome.getService(), runDate, OutcomeStatus.FORECAST,
            outcome.getOrder().toString(),
            forecast.dates(),
            forecast.points().stream().map(ForecastPoint::value).toList(),
            forecast.points().stream().map(ForecastPoint::lower).toList(),
            forecast.points().stream().map(ForecastPoint::upper).toList(),
            backtest.dates(),
            backtest.points().stream().map(ForecastPoint::value).toList(),
            outcome.getHoldout().observations().stream().map(Observation::value).toList(),
            evaluation.mae(), evaluation.rmse(), evaluation.mape(),
            null, null);
    }

    public boolean skipped() {
        return status == OutcomeStatus.SKIPPED;
    }
}
