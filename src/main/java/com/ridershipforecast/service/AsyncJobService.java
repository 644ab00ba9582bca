package com.ridershipforecast.service;

import com.ridershipforecast.config.ForecastProperties;
import com.ridershipforecast.dto.AsyncJobResponse;
import com.ridershipforecast.dto.AsyncJobStatus;
import com.ridershipforecast.dto.ForecastRunRequest;
import com.ridershipforecast.dto.ForecastRunResponse;
import com.ridershipforecast.exception.ForecastPipelineException;
import com.ridershipforecast.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Background forecast runs with an in-memory job table. Finished jobs beyond
 * {@code forecast.jobs.max-retained} are evicted oldest first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AsyncJobService {

    private final ForecastPipelineService pipelineService;
    private final ForecastProperties      properties;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(properties.getJobs().getPoolSize());
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public UUID submit(ForecastRunRequest request, String requestId) {
        UUID jobId = UUID.randomUUID();
        JobState state = new JobState(jobId, requestId, Instant.now());
        jobs.put(jobId, state);
        cleanupIfNeeded();

        CompletableFuture.runAsync(() -> execute(state, request), executor);
        log.info("Forecast job queued | jobId={} | requestId={}", jobId, requestId);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state.toResponse();
    }

    private void execute(JobState state, ForecastRunRequest request) {
        state.markRunning();
        try {
            ForecastRunResponse result = pipelineService.run(request,
                (outcome, completed, total) -> state.markProgress(completed, total));
            state.markCompleted(result);
            log.info("Forecast job completed | jobId={} | forecasted={} | skipped={}",
                state.jobId, result.getForecasted(), result.getSkipped());
        } catch (ForecastPipelineException ex) {
            log.error("Forecast job failed | jobId={} | errorCode={} | message={}",
                state.jobId, ex.getErrorCode(), ex.getMessage());
            state.markFailed(ex.getErrorCode(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Forecast job failed | jobId={}", state.jobId, ex);
            state.markFailed("INTERNAL_ERROR", ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }

    private void cleanupIfNeeded() {
        int maxRetained = properties.getJobs().getMaxRetained();
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().status == AsyncJobStatus.COMPLETED || e.getValue().status == AsyncJobStatus.FAILED)
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final String requestId;
        private final Instant createdAt;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private volatile Integer servicesCompleted;
        private volatile Integer servicesTotal;
        private volatile String message = "Queued";
        private volatile String errorCode;
        private volatile ForecastRunResponse result;

        private JobState(UUID jobId, String requestId, Instant createdAt) {
            this.jobId = jobId;
            this.requestId = requestId;
            this.createdAt = createdAt;
        }

        private synchronized void markRunning() {
            this.startedAt = Instant.now();
            this.status = AsyncJobStatus.RUNNING;
            this.message = "Loading dataset";
        }

        private synchronized void markProgress(int completed, int total) {
            this.servicesCompleted = completed;
            this.servicesTotal = total;
            this.message = "Processed " + completed + " of " + total + " services";
        }

        private synchronized void markCompleted(ForecastRunResponse result) {
            this.completedAt = Instant.now();
            this.status = AsyncJobStatus.COMPLETED;
            this.result = result;
            this.servicesCompleted = result.getRequested();
            this.servicesTotal = result.getRequested();
            this.message = "Forecast run completed";
        }

        private synchronized void markFailed(String errorCode, String message) {
            this.completedAt = Instant.now();
            this.status = AsyncJobStatus.FAILED;
            this.errorCode = errorCode;
            this.message = message;
        }

        private synchronized AsyncJobResponse toResponse() {
            int progress;
            if (status == AsyncJobStatus.COMPLETED || status == AsyncJobStatus.FAILED) {
                progress = 100;
            } else if (servicesTotal != null && servicesTotal > 0) {
                progress = (int) Math.round(100.0 * servicesCompleted / servicesTotal);
            } else {
                progress = 0;
            }
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .servicesCompleted(servicesCompleted)
                .servicesTotal(servicesTotal)
                .progressPercent(progress)
                .message(message)
                .errorCode(errorCode)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}
