package com.ridershipforecast.exception;

public class ResultSinkException extends ForecastPipelineException {
    public static final String CODE = "RESULT_SINK_ERROR";

    public ResultSinkException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
