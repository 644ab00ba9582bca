package com.ridershipforecast.exception;

public class InsufficientDataException extends ForecastPipelineException {
    public static final String CODE = "INSUFFICIENT_DATA";

    public InsufficientDataException(String service, int observations, int required) {
        super(CODE, "Series '" + service + "' has " + observations
              + " observations, at least " + required + " are required.");
    }
}
