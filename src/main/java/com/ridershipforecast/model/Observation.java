package com.ridershipforecast.model;

import java.time.LocalDate;

public record Observation(LocalDate date, double value) {
}
