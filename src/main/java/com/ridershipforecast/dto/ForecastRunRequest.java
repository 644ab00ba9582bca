package com.ridershipforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * Every field is optional; missing ones fall back to the {@code forecast.*} configuration
 * and today's date.
 */
@Value
@Builder
@Jacksonized
public class ForecastRunRequest {
    String datasetPath;

    List<@NotBlank(message = "service names must not be blank") String> services;

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate runDate;
}
