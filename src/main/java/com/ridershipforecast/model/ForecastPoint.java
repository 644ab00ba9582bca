package com.ridershipforecast.model;

import java.time.LocalDate;

public record ForecastPoint(LocalDate date, double value, double lower, double upper) {
}
