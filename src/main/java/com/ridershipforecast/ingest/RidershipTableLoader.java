package com.ridershipforecast.ingest;

import com.ridershipforecast.config.ForecastProperties;
import com.ridershipforecast.exception.DataException;
import com.ridershipforecast.model.RidershipTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the wide daily CSV: a header row, one date column and one count column per service.
 * Any problem with the file or its dates fails the whole load. Count cells that are not numbers
 * are kept as missing values of their own column, so they only affect that service.
 * <p>
 * Exception messages never quote file contents; they may reach HTTP clients.
 */
@Slf4j
@Component
public class RidershipTableLoader {

    private static final Set<String> MISSING_MARKERS = Set.of("", "na", "n/a", "nan", "null");

    private final String dateColumn;
    private final List<DateTimeFormatter> dateFormats;

    @Autowired
    public RidershipTableLoader(ForecastProperties properties) {
        this(properties.getDateColumn(), properties.getDatePatterns());
    }

    public RidershipTableLoader(String dateColumn, List<String> datePatterns) {
        this.dateColumn = dateColumn;
        this.dateFormats = datePatterns.stream().map(DateTimeFormatter::ofPattern).toList();
    }

    public RidershipTable load(Path path) {
        if (path == null || !Files.isReadable(path)) {
            throw new DataException("Dataset " + path + " does not exist or is not readable");
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreHeaderCase(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            RidershipTable table = read(parser);
            log.info("Dataset loaded | path={} | rows={} | services={}", path, table.rows().size(), table.services());
            return table;
        } catch (IOException | UncheckedIOException e) {
            log.warn("Dataset read failed | path={} | reason={}", path, e.getMessage());
            throw new DataException("Failed to read dataset " + path, e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("Dataset is not valid CSV | path={} | reason={}", path, e.getMessage());
            throw new DataException("Malformed CSV in " + path, e);
        }
    }

    private RidershipTable read(CSVParser parser) {
        List<String> headers = parser.getHeaderNames();
        String dateHeader = headers.stream()
            .filter(h -> h.equalsIgnoreCase(dateColumn))
            .findFirst()
            .orElseThrow(() -> new DataException("Date column '" + dateColumn + "' not found in the header"));
        List<String> services = headers.stream()
            .filter(h -> !h.equals(dateHeader) && !h.isBlank())
            .toList();

        List<RidershipTable.Row> rows = new ArrayList<>();
        Set<LocalDate> seen = new HashSet<>();
        Map<String, Integer> unparsable = new LinkedHashMap<>();
        for (CSVRecord record : parser) {
            LocalDate date = parseDate(cell(record, dateHeader), record.getRecordNumber());
            if (!seen.add(date)) {
                throw new DataException("Duplicate date " + date + " at record " + record.getRecordNumber());
            }
            Map<String, Double> counts = new HashMap<>();
            for (String service : services) {
                Double count = parseCount(cell(record, service));
                if (count == null && !isMissing(cell(record, service))) {
                    unparsable.merge(service, 1, Integer::sum);
                }
                counts.put(service, count);
            }
            rows.add(new RidershipTable.Row(date, counts));
        }
        unparsable.forEach((service, cells) ->
            log.warn("Non-numeric counts treated as missing | service={} | cells={}", service, cells));
        rows.sort(Comparator.comparing(RidershipTable.Row::date));
        return new RidershipTable(services, rows);
    }

    private static String cell(CSVRecord record, String column) {
        return record.isMapped(column) && record.isSet(column) ? record.get(column) : "";
    }

    LocalDate parseDate(String text, long recordNumber) {
        for (DateTimeFormatter format : dateFormats) {
            try {
                return LocalDate.parse(text, format);
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match {}", text, format);
            }
        }
        throw new DataException("Unparsable date at record " + recordNumber);
    }

    /** The count in {@code text}, or {@code null} for a missing marker or a value that is not a number. */
    static Double parseCount(String text) {
        if (isMissing(text)) {
            return null;
        }
        try {
            return Double.valueOf(text.replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isMissing(String text) {
        return MISSING_MARKERS.contains(text.toLowerCase());
    }
}
