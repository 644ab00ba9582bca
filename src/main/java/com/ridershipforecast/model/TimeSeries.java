package com.ridershipforecast.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Daily counts of one service. Dates are strictly increasing with exactly one
 * observation per calendar day and values are never negative.
 */
public final class TimeSeries {

    private final String service;
    private final List<Observation> observations;

    public TimeSeries(String service, List<Observation> observations) {
        this.service = Objects.requireNonNull(service, "service");
        this.observations = List.copyOf(observations);
        for (int i = 0; i < this.observations.size(); i++) {
            Observation o = this.observations.get(i);
            if (o.value() < 0 || Double.isNaN(o.value())) {
                throw new IllegalArgumentException("Negative or NaN value " + o.value() + " on " + o.date());
            }
            if (i > 0) {
                LocalDate expected = this.observations.get(i - 1).date().plusDays(1);
                if (!o.date().equals(expected)) {
                    throw new IllegalArgumentException(
                        "Date index is not contiguous: expected " + expected + " but found " + o.date());
                }
            }
        }
    }

    public static TimeSeries of(String service, LocalDate start, double... values) {
        Observation[] points = new Observation[values.length];
        for (int i = 0; i < values.length; i++) {
            points[i] = new Observation(start.plusDays(i), values[i]);
        }
        return new TimeSeries(service, List.of(points));
    }

    public String service() {
        return service;
    }

    public List<Observation> observations() {
        return observations;
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public LocalDate startDate() {
        return observations.get(0).date();
    }

    public LocalDate endDate() {
        return observations.get(observations.size() - 1).date();
    }

    public double[] values() {
        return observations.stream().mapToDouble(Observation::value).toArray();
    }

    public TimeSeries head(int count) {
        return slice(0, count);
    }

    public TimeSeries tail(int count) {
        return slice(observations.size() - count, observations.size());
    }

    /** Sub-series over {@code [from, to)} positions. */
    public TimeSeries slice(int from, int to) {
        return new TimeSeries(service, observations.subList(from, to));
    }

    /** True when {@code other} covers the same leading days as this series with the same values. */
    public boolean isPrefixOf(TimeSeries other) {
        if (!service.equals(other.service) || other.size() < size()) {
            return false;
        }
        return observations.equals(other.observations.subList(0, size()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeries that)) return false;
        return service.equals(that.service) && observations.equals(that.observations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, observations);
    }

    @Override
    public String toString() {
        return isEmpty()
            ? "TimeSeries[" + service + ", empty]"
            : "TimeSeries[" + service + ", " + startDate() + ".." + endDate() + ", n=" + size() + "]";
    }
}
