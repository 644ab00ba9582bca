package com.ridershipforecast.exception;

import com.ridershipforecast.model.SeasonalOrder;

public class ConvergenceException extends ForecastPipelineException {
    public static final String CODE = "CONVERGENCE_ERROR";

    public ConvergenceException(SeasonalOrder order, String reason) {
        super(CODE, "Fitting " + order + " did not converge: " + reason);
    }
    public ConvergenceException(SeasonalOrder order, String reason, Throwable cause) {
        super(CODE, "Fitting " + order + " did not converge: " + reason, cause);
    }
}
