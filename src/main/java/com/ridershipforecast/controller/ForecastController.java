package com.ridershipforecast.controller;

import com.ridershipforecast.dto.AsyncJobResponse;
import com.ridershipforecast.dto.ForecastRunRequest;
import com.ridershipforecast.dto.ForecastRunResponse;
import com.ridershipforecast.dto.ServiceResultRecord;
import com.ridershipforecast.exception.ResultNotFoundException;
import com.ridershipforecast.service.AsyncJobService;
import com.ridershipforecast.service.ForecastPipelineService;
import com.ridershipforecast.sink.ResultSink;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ForecastController {

    private final ForecastPipelineService pipelineService;
    private final AsyncJobService         asyncJobService;
    private final ResultSink              resultSink;

    @PostMapping("/forecast-runs")
    public ResponseEntity<AsyncJobResponse> startRun(
            @Valid @RequestBody(required = false) ForecastRunRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        ForecastRunRequest body = request != null ? request : ForecastRunRequest.builder().build();
        log.info("POST /forecast-runs | dataset={} | services={} | requestId={}",
                 body.getDatasetPath(), body.getServices(), requestId);
        UUID jobId = asyncJobService.submit(body, requestId);
        return ResponseEntity.accepted()
            .header("X-Request-ID", requestId)
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }

    @PostMapping("/forecast-runs/sync")
    public ResponseEntity<ForecastRunResponse> runNow(
            @Valid @RequestBody(required = false) ForecastRunRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /forecast-runs/sync | requestId={}", requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(pipelineService.run(request));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    @GetMapping("/results/{runDate}/{service}")
    public ResponseEntity<ServiceResultRecord> result(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate runDate,
            @PathVariable String service) {
        return ResponseEntity.ok(resultSink.read(runDate, service)
            .orElseThrow(() -> new ResultNotFoundException(runDate, service)));
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
