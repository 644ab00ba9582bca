package com.ridershipforecast.model;

public enum OutcomeStatus {
    FORECAST,
    SKIPPED
}
