package com.ridershipforecast.model;

/**
 * Accuracy of one forecast window. {@code mape} is a percentage and is {@code null}
 * when every true value in the window was zero.
 */
public record EvaluationResult(double mae, double rmse, Double mape, int sampleCount, int mapeSampleCount) {

    public boolean mapeApplicable() {
        return mape != null;
    }
}
