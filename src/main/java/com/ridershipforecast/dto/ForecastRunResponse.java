package com.ridershipforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class ForecastRunResponse {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate runDate;
    String datasetPath;
    String outputDirectory;
    int requested;
    int forecasted;
    int skipped;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant completedAt;
    List<ServiceResultRecord> results;
}
