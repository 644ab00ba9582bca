package com.ridershipforecast.forecasting;

import com.ridershipforecast.exception.DataException;
import com.ridershipforecast.model.Observation;
import com.ridershipforecast.model.RidershipTable;
import com.ridershipforecast.model.TimeSeries;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * Pulls one service's column out of the wide table onto a contiguous daily index.
 * Days without a row and empty cells become zero riders.
 */
public final class SeriesExtractor {

    private SeriesExtractor() {
    }

    public static TimeSeries extract(RidershipTable table, String service) {
        if (!table.hasService(service)) {
            throw new DataException("Service column '" + service + "' is not present in the table");
        }
        if (table.rows().isEmpty()) {
            throw new DataException("The table has no rows");
        }

        TreeMap<LocalDate, Double> counts = new TreeMap<>();
        for (RidershipTable.Row row : table.rows()) {
            Double value = row.count(service);
            if (counts.put(row.date(), value != null ? value : 0.0) != null) {
                throw new DataException("Duplicate date " + row.date() + " in the table");
            }
        }

        LocalDate first = counts.firstKey();
        LocalDate last = counts.lastKey();
        List<Observation> observations = new ArrayList<>();
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            double value = counts.getOrDefault(day, 0.0);
            if (value < 0 || !Double.isFinite(value)) {
                throw new DataException("Invalid count " + value + " for '" + service + "' on " + day);
            }
            observations.add(new Observation(day, value));
        }
        return new TimeSeries(service, observations);
    }

    /** Calendar days between the first and last date of the table that have no row. */
    public static long missingDays(RidershipTable table) {
        Set<LocalDate> dates = table.dates();
        if (dates.isEmpty()) {
            return 0;
        }
        LocalDate first = Collections.min(dates);
        LocalDate last = Collections.max(dates);
        return ChronoUnit.DAYS.between(first, last) + 1 - dates.size();
    }
}
