package com.ridershipforecast.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ridershipforecast.dto.ServiceResultRecord;
import com.ridershipforecast.exception.DataException;
import com.ridershipforecast.model.EvaluationResult;
import com.ridershipforecast.model.Forecast;
import com.ridershipforecast.model.ForecastPoint;
import com.ridershipforecast.model.OutcomeStatus;
import com.ridershipforecast.model.SeasonalOrder;
import com.ridershipforecast.model.ServiceOutcome;
import com.ridershipforecast.model.TimeSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FileResultSinkTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2024, 5, 1);
    private static final LocalDate HOLDOUT_START = LocalDate.of(2024, 4, 24);

    @TempDir
    Path dir;

    private ObjectMapper mapper;
    private FileResultSink sink;

    @BeforeEach
    void setUp() {
        mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
        sink = new FileResultSink(mapper, dir);
    }

    @Test
    void write_thenRead_returnsTheSameRecord() {
        ServiceOutcome outcome = forecastOutcome("Local Route", 1000.0, new EvaluationResult(12.5, 15.25, 1.3, 7, 7));

        ServiceResultRecord written = sink.write(RUN_DATE, outcome);
        ServiceResultRecord read = sink.read(RUN_DATE, "Local Route").orElseThrow();

        assertThat(read).isEqualTo(written);
        assertThat(read.status()).isEqualTo(OutcomeStatus.FORECAST);
        assertThat(read.order()).isEqualTo("SARIMA(1,0,1)(0,1,1)[7]");
        assertThat(read.forecastDates()).hasSize(7).first().isEqualTo(LocalDate.of(2024, 5, 1));
        assertThat(read.forecastValues()).hasSize(7);
        assertThat(read.backtestActuals()).hasSize(7);
        assertThat(read.mae()).isCloseTo(12.5, within(1e-9));
        assertThat(read.mape()).isCloseTo(1.3, within(1e-9));
        assertThat(dir.resolve("2024-05-01").resolve(FileResultSink.key("Local Route")).resolve("next_7_days_forecast.csv")).exists();
    }

    @Test
    void undefinedMape_isWrittenAsNotApplicable() throws IOException {
        sink.write(RUN_DATE, forecastOutcome("School", 0.0, new EvaluationResult(0.0, 0.0, null, 7, 0)));

        JsonNode json = mapper.readTree(dir.resolve("2024-05-01").resolve(FileResultSink.key("School") + ".json").toFile());

        assertThat(json.get("mape").asText()).isEqualTo("n/a");
        assertThat(json.has("forecast_values")).isTrue();
        assertThat(json.has("skip_reason")).isFalse();
        assertThat(sink.read(RUN_DATE, "School").orElseThrow().mape()).isNull();
    }

    @Test
    void skippedService_recordsReasonAndDropsStaleForecastCsv() {
        sink.write(RUN_DATE, forecastOutcome("Light Rail", 300.0, new EvaluationResult(1, 1, 1.0, 7, 7)));

        ServiceResultRecord record = sink.write(RUN_DATE,
            ServiceOutcome.skipped("Light Rail", DataException.CODE, "Service column 'Light Rail' is not present"));

        assertThat(record.skipped()).isTrue();
        assertThat(sink.read(RUN_DATE, "Light Rail")).contains(record);
        assertThat(record.forecastValues()).isNull();
        assertThat(dir.resolve("2024-05-01").resolve(FileResultSink.key("Light Rail")).resolve("next_7_days_forecast.csv")).doesNotExist();
    }

    @Test
    void writeSummary_writesCsvAndJson() throws IOException {
        List<ServiceOutcome> outcomes = List.of(
            forecastOutcome("Local Route", 900.0, new EvaluationResult(10, 11, 2.0, 7, 7)),
            forecastOutcome("School", 0.0, new EvaluationResult(0, 0, null, 7, 0)),
            ServiceOutcome.skipped("Other", "INSUFFICIENT_DATA", "too short"));

        sink.writeSummary(RUN_DATE, outcomes);

        List<String> lines = Files.readAllLines(dir.resolve("2024-05-01/forecast_summary.csv"));
        assertThat(lines).hasSize(4);
        assertThat(lines.get(0)).isEqualTo("Service,Status,Order,MAE,RMSE,MAPE,SkipReason");
        assertThat(lines.get(2)).contains("School", "n/a");
        assertThat(lines.get(3)).contains("Other", "SKIPPED", "INSUFFICIENT_DATA");
        JsonNode summary = mapper.readTree(dir.resolve("2024-05-01/run-summary.json").toFile());
        assertThat(summary.isArray()).isTrue();
        assertThat(summary.size()).isEqualTo(3);
    }

    @Test
    void unknownResult_isEmpty() {
        assertThat(sink.read(RUN_DATE, "Nope")).isEmpty();
        assertThat(sink.location(RUN_DATE)).isEqualTo(dir.resolve("2024-05-01"));
    }

    @Test
    void key_replacesUnsafeCharactersAndKeepsNamesApart() {
        assertThat(FileResultSink.key("Local Route")).matches("Local_Route-[0-9a-f]{8}");
        assertThat(FileResultSink.key("A/B: night")).startsWith("A_B_night-");
        assertThat(FileResultSink.key("  ")).startsWith("_-");
        assertThat(FileResultSink.key("Local Route")).isNotEqualTo(FileResultSink.key("Local_Route"));
        assertThat(FileResultSink.key("Local Route")).isEqualTo(FileResultSink.key("Local Route"));
    }

    @Test
    void servicesThatSanitiseAlike_keepSeparateRecords() {
        sink.write(RUN_DATE, forecastOutcome("Local Route", 100.0, new EvaluationResult(1, 1, 1.0, 7, 7)));
        sink.write(RUN_DATE, forecastOutcome("Local_Route", 200.0, new EvaluationResult(2, 2, 2.0, 7, 7)));

        assertThat(sink.read(RUN_DATE, "Local Route").orElseThrow().forecastValues().get(0)).isEqualTo(100.0);
        assertThat(sink.read(RUN_DATE, "Local_Route").orElseThrow().forecastValues().get(0)).isEqualTo(200.0);
    }

    @Test
    void read_recordOfAnotherService_isEmpty() throws IOException {
        sink.write(RUN_DATE, forecastOutcome("Ferry", 50.0, new EvaluationResult(1, 1, 1.0, 7, 7)));
        Path runDir = dir.resolve("2024-05-01");
        Files.copy(runDir.resolve(FileResultSink.key("Ferry") + ".json"), runDir.resolve(FileResultSink.key("Tram") + ".json"));

        assertThat(sink.read(RUN_DATE, "Tram")).isEmpty();
        assertThat(sink.read(RUN_DATE, "Ferry")).isPresent();
    }

    private static ServiceOutcome forecastOutcome(String service, double level, EvaluationResult evaluation) {
        double[] actuals = new double[7];
        Arrays.fill(actuals, level);
        TimeSeries holdout = TimeSeries.of(service, HOLDOUT_START, actuals);
        return ServiceOutcome.forecast(service, new SeasonalOrder(1, 0, 1, 0, 1, 1, 7),
            forecast(service, RUN_DATE, level), forecast(service, HOLDOUT_START, level), holdout, evaluation);
    }

    private static Forecast forecast(String service, LocalDate start, double level) {
        List<ForecastPoint> points = new ArrayList<>();
        for (int h = 0; h < 7; h++) {
            points.add(new ForecastPoint(start.plusDays(h), level + h, Math.max(0, level + h - 50), level + h + 50));
        }
        return new Forecast(service, points);
    }
}
