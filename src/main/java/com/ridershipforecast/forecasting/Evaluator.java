package com.ridershipforecast.forecasting;

import com.ridershipforecast.exception.AlignmentException;
import com.ridershipforecast.model.EvaluationResult;
import com.ridershipforecast.model.Forecast;
import com.ridershipforecast.model.ForecastPoint;
import com.ridershipforecast.model.Observation;
import com.ridershipforecast.model.TimeSeries;

import java.util.List;

/**
 * MAE, RMSE and MAPE of a forecast against the observed values of the same days.
 */
public final class Evaluator {

    private Evaluator() {
    }

    public static EvaluationResult evaluate(Forecast forecast, TimeSeries actual) {
        List<ForecastPoint> predicted = forecast.points();
        List<Observation> observed = actual.observations();
        if (predicted.size() != observed.size()) {
            throw new AlignmentException("Forecast has " + predicted.size()
                + " points but the ground truth has " + observed.size());
        }
        if (predicted.isEmpty()) {
            throw new AlignmentException("Cannot evaluate an empty window");
        }

        double absErrorSum = 0.0;
        double squaredErrorSum = 0.0;
        double apeSum = 0.0;
        int apeCount = 0;
        for (int i = 0; i < predicted.size(); i++) {
            ForecastPoint point = predicted.get(i);
            Observation truth = observed.get(i);
            if (!point.date().equals(truth.date())) {
                throw new AlignmentException("Forecast date " + point.date()
                    + " does not match ground-truth date " + truth.date() + " at position " + i);
            }
            double error = point.value() - truth.value();
            absErrorSum += Math.abs(error);
            squaredErrorSum += error * error;
            if (truth.value() != 0.0d) {
                apeSum += Math.abs(error / truth.value());
                apeCount++;
            }
        }

        double n = predicted.size();
        double mae = absErrorSum / n;
        // rounding can put the root of equal squared errors a hair below their mean
        double rmse = Math.max(Math.sqrt(squaredErrorSum / n), mae);
        Double mape = apeCount > 0 ? (apeSum / apeCount) * 100.0 : null;
        return new EvaluationResult(mae, rmse, mape, predicted.size(), apeCount);
    }
}
