package com.ridershipforecast.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridershipforecast.config.ForecastProperties;
import com.ridershipforecast.dto.NotApplicableJson;
import com.ridershipforecast.dto.ServiceResultRecord;
import com.ridershipforecast.exception.ResultSinkException;
import com.ridershipforecast.model.ForecastPoint;
import com.ridershipforecast.model.ServiceOutcome;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Flat-file sink. Layout under the output directory:
 * <pre>
 * &lt;runDate&gt;/&lt;service-key&gt;.json
 * &lt;runDate&gt;/&lt;service-key&gt;/next_7_days_forecast.csv
 * &lt;runDate&gt;/forecast_summary.csv
 * &lt;runDate&gt;/run-summary.json
 * </pre>
 */
@Slf4j
@Component
public class FileResultSink implements ResultSink {

    static final String FORECAST_CSV = "next_7_days_forecast.csv";
    static final String SUMMARY_CSV = "forecast_summary.csv";
    static final String SUMMARY_JSON = "run-summary.json";

    private final ObjectMapper mapper;
    private final Path outputDir;

    @Autowired
    public FileResultSink(ObjectMapper mapper, ForecastProperties properties) {
        this(mapper, properties.getOutputDir());
    }

    public FileResultSink(ObjectMapper mapper, Path outputDir) {
        this.mapper = mapper;
        this.outputDir = outputDir;
    }

    @Override
    public ServiceResultRecord write(LocalDate runDate, ServiceOutcome outcome) {
        ServiceResultRecord record = ServiceResultRecord.from(runDate, outcome);
        Path runDir = location(runDate);
        String key = key(outcome.getService());
        try {
            Files.createDirectories(runDir);
            replace(runDir.resolve(key + ".json"), mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record));
            Path csvDir = runDir.resolve(key);
            if (outcome.isSkipped()) {
                Files.deleteIfExists(csvDir.resolve(FORECAST_CSV));
            } else {
                Files.createDirectories(csvDir);
                writeForecastCsv(csvDir.resolve(FORECAST_CSV), outcome.getForecast().points());
            }
        } catch (IOException e) {
            throw new ResultSinkException("Failed to write result for '" + outcome.getService() + "' to " + runDir, e);
        }
        log.debug("Result written | service={} | runDate={} | status={}", outcome.getService(), runDate, record.status());
        return record;
    }

    @Override
    public void writeSummary(LocalDate runDate, List<ServiceOutcome> outcomes) {
        Path runDir = location(runDate);
        List<ServiceResultRecord> records = outcomes.stream()
            .map(o -> ServiceResultRecord.from(runDate, o))
            .toList();
        try {
            Files.createDirectories(runDir);
            replace(runDir.resolve(SUMMARY_JSON), mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(records));
            Path tmp = Files.createTempFile(runDir, SUMMARY_CSV, ".tmp");
            CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader("Service", "Status", "Order", "MAE", "RMSE", "MAPE", "SkipReason")
                .build();
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                for (ServiceResultRecord r : records) {
                    printer.printRecord(r.service(), r.status(), r.order(), r.mae(), r.rmse(),
                        r.mape() != null ? r.mape() : (r.skipped() ? null : NotApplicableJson.NOT_APPLICABLE),
                        r.skipReason());
                }
            }
            move(tmp, runDir.resolve(SUMMARY_CSV));
        } catch (IOException e) {
            throw new ResultSinkException("Failed to write run summary to " + runDir, e);
        }
        log.info("Run summary written | runDate={} | services={} | dir={}", runDate, records.size(), runDir);
    }

    @Override
    public Optional<ServiceResultRecord> read(LocalDate runDate, String service) {
        Path file = location(runDate).resolve(key(service) + ".json");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            ServiceResultRecord record = mapper.readValue(file.toFile(), ServiceResultRecord.class);
            if (!service.equals(record.service())) {
                log.warn("Stored result belongs to another service | requested={} | stored={} | file={}",
                    service, record.service(), file);
                return Optional.empty();
            }
            return Optional.of(record);
        } catch (IOException e) {
            throw new ResultSinkException("Failed to read result " + file, e);
        }
    }

    @Override
    public Path location(LocalDate runDate) {
        return outputDir.resolve(runDate.toString());
    }

    /**
     * File-system safe name of a service column: the name with unsafe characters replaced, plus a
     * digest of the exact name, e.g. {@code "Local Route"} becomes {@code Local_Route-<8 hex>}.
     * Names that sanitise alike ({@code "Local Route"}, {@code "Local_Route"}) get distinct keys.
     */
    static String key(String service) {
        String readable = service.trim().replaceAll("[^A-Za-z0-9._-]+", "_");
        String digest = DigestUtils.md5DigestAsHex(service.getBytes(StandardCharsets.UTF_8)).substring(0, 8);
        return (readable.isEmpty() ? "_" : readable) + "-" + digest;
    }

    private void writeForecastCsv(Path file, List<ForecastPoint> points) throws IOException {
        Path tmp = Files.createTempFile(file.getParent(), FORECAST_CSV, ".tmp");
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader("Date", "Forecast", "Lower", "Upper")
            .build();
        try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (ForecastPoint point : points) {
                printer.printRecord(point.date(), point.value(), point.lower(), point.upper());
            }
        }
        move(tmp, file);
    }

    private static void replace(Path target, byte[] content) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        Files.write(tmp, content);
        move(tmp, target);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
