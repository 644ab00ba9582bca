package com.ridershipforecast.exception;

public class AlignmentException extends ForecastPipelineException {
    public static final String CODE = "ALIGNMENT_ERROR";

    public AlignmentException(String message) {
        super(CODE, message);
    }
}
