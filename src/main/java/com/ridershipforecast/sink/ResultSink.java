package com.ridershipforecast.sink;

import com.ridershipforecast.dto.ServiceResultRecord;
import com.ridershipforecast.model.ServiceOutcome;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Structured store of per-service results keyed by service name and run date.
 * Writing the same key again replaces the earlier result.
 */
public interface ResultSink {

    ServiceResultRecord write(LocalDate runDate, ServiceOutcome outcome);

    void writeSummary(LocalDate runDate, List<ServiceOutcome> outcomes);

    Optional<ServiceResultRecord> read(LocalDate runDate, String service);

    Path location(LocalDate runDate);
}
