package com.ridershipforecast.exception;

import java.time.LocalDate;

public class ResultNotFoundException extends ForecastPipelineException {
    public ResultNotFoundException(LocalDate runDate, String service) {
        super("RESULT_NOT_FOUND", "No result stored for service '" + service + "' on " + runDate + ".");
    }
}
