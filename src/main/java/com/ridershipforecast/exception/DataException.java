package com.ridershipforecast.exception;

/**
 * Malformed or unparsable input: unreadable table, bad or duplicate dates, missing service column.
 */
public class DataException extends ForecastPipelineException {
    public static final String CODE = "DATA_ERROR";

    public DataException(String message) {
        super(CODE, message);
    }
    public DataException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
