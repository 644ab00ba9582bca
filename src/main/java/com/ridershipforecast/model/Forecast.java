package com.ridershipforecast.model;

import java.time.LocalDate;
import java.util.List;

public record Forecast(String service, List<ForecastPoint> points) {

    public Forecast {
        points = List.copyOf(points);
    }

    public int horizon() {
        return points.size();
    }

    public List<LocalDate> dates() {
        return points.stream().map(ForecastPoint::date).toList();
    }

    public double[] values() {
        return points.stream().mapToDouble(ForecastPoint::value).toArray();
    }
}
