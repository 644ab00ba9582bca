package com.ridershipforecast.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wide daily table as loaded: one row per date, one nullable count per service column.
 * Rows are sorted by date; missing cells are {@code null}.
 */
public record RidershipTable(List<String> services, List<Row> rows) {

    public RidershipTable {
        services = List.copyOf(services);
        rows = List.copyOf(rows);
    }

    public boolean hasService(String service) {
        return services.contains(service);
    }

    public Set<LocalDate> dates() {
        Set<LocalDate> dates = new LinkedHashSet<>();
        rows.forEach(r -> dates.add(r.date()));
        return dates;
    }

    public record Row(LocalDate date, Map<String, Double> counts) {
        public Row {
            counts = Collections.unmodifiableMap(new HashMap<>(counts));
        }

        public Double count(String service) {
            return counts.get(service);
        }
    }
}
