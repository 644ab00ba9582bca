package com.ridershipforecast.service;

import com.ridershipforecast.config.ForecastProperties;
import com.ridershipforecast.dto.ForecastRunRequest;
import com.ridershipforecast.dto.ForecastRunResponse;
import com.ridershipforecast.dto.ServiceResultRecord;
import com.ridershipforecast.exception.AlignmentException;
import com.ridershipforecast.exception.ConvergenceException;
import com.ridershipforecast.exception.DataException;
import com.ridershipforecast.exception.ForecastPipelineException;
import com.ridershipforecast.exception.InsufficientDataException;
import com.ridershipforecast.exception.ResultSinkException;
import com.ridershipforecast.forecasting.Evaluator;
import com.ridershipforecast.forecasting.Forecaster;
import com.ridershipforecast.forecasting.OrderSelector;
import com.ridershipforecast.forecasting.SarimaFitter;
import com.ridershipforecast.forecasting.SelectionSettings;
import com.ridershipforecast.forecasting.SeriesExtractor;
import com.ridershipforecast.ingest.RidershipTableLoader;
import com.ridershipforecast.model.EvaluationResult;
import com.ridershipforecast.model.FittedModel;
import com.ridershipforecast.model.Forecast;
import com.ridershipforecast.model.RidershipTable;
import com.ridershipforecast.model.SeasonalOrder;
import com.ridershipforecast.model.ServiceOutcome;
import com.ridershipforecast.model.TimeSeries;
import com.ridershipforecast.sink.ResultSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs extract, select, fit, forecast, evaluate and sink for every requested service.
 * <p>
 * The last {@code holdout-days} of each series are held out: the model is fit on the rest,
 * its forecast over the held-out days is scored, and the published forecast continues from
 * the end of the full series with the same coefficients. A failure in one service becomes a
 * skip record for that service only; a failure to load the table fails the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastPipelineService {

    private final RidershipTableLoader loader;
    private final ResultSink           sink;
    private final SarimaFitter         fitter;
    private final Forecaster           forecaster;
    private final SelectionSettings    selectionSettings;
    private final ForecastProperties   properties;
    private final Clock                clock;

    public ForecastRunResponse run(ForecastRunRequest request) {
        return run(request, RunProgressListener.NONE);
    }

    public ForecastRunResponse run(ForecastRunRequest request, RunProgressListener listener) {
        if (request == null) {
            request = ForecastRunRequest.builder().build();
        }
        Instant startedAt = clock.instant();
        Path dataset = resolveDataset(request);
        LocalDate runDate = request.getRunDate() != null ? request.getRunDate() : LocalDate.now(clock);

        RidershipTable table = loader.load(dataset);
        long gaps = SeriesExtractor.missingDays(table);
        if (gaps > 0) {
            log.warn("Dataset has {} missing days, filled with zero | path={}", gaps, dataset);
        }
        List<String> services = resolveServices(request, table);
        log.info("Forecast run started | runDate={} | services={} | parallelism={}",
            runDate, services, properties.getParallelism());

        Map<String, ServiceOutcome> outcomes = properties.getParallelism() > 1 && services.size() > 1
            ? runParallel(table, services, runDate, listener)
            : runSequential(table, services, runDate, listener);

        List<ServiceOutcome> ordered = new ArrayList<>(outcomes.values());
        sink.writeSummary(runDate, ordered);

        List<ServiceResultRecord> records = ordered.stream()
            .map(o -> ServiceResultRecord.from(runDate, o))
            .toList();
        int skipped = (int) ordered.stream().filter(ServiceOutcome::isSkipped).count();
        log.info("Forecast run finished | runDate={} | forecasted={} | skipped={}",
            runDate, ordered.size() - skipped, skipped);
        return ForecastRunResponse.builder()
            .runDate(runDate)
            .datasetPath(dataset.toString())
            .outputDirectory(sink.location(runDate).toString())
            .requested(services.size())
            .forecasted(ordered.size() - skipped)
            .skipped(skipped)
            .startedAt(startedAt)
            .completedAt(clock.instant())
            .results(records)
            .build();
    }

    /**
     * Processes one service and writes its result. Never throws for a problem specific to the
     * service; those come back as a skipped outcome. A failed write of the result also becomes a
     * skip with {@code RESULT_SINK_ERROR}; failing to write the run summary stays fatal.
     */
    public ServiceOutcome process(RidershipTable table, String service, LocalDate runDate) {
        ServiceOutcome outcome = forecastService(table, service);
        try {
            sink.write(runDate, outcome);
            return outcome;
        } catch (ResultSinkException e) {
            return skip(service, e);
        }
    }

    ServiceOutcome forecastService(RidershipTable table, String service) {
        try {
            TimeSeries series = SeriesExtractor.extract(table, service);
            int holdoutDays = properties.getHoldoutDays();
            int minObservations = properties.getFitting().getMinObservations();
            if (series.size() - holdoutDays < minObservations) {
                throw new InsufficientDataException(service, series.size(), minObservations + holdoutDays);
            }
            TimeSeries training = series.head(series.size() - holdoutDays);
            TimeSeries holdout = series.tail(holdoutDays);

            SeasonalOrder selected = OrderSelector.select(training, selectionSettings, fitter);
            FittedModel model = fitWithFallback(training, selected);

            Forecast backtest = forecaster.forecast(model, holdoutDays);
            EvaluationResult evaluation = Evaluator.evaluate(backtest, holdout);
            Forecast forecast = forecaster.forecast(model.extend(series));

            log.info("Service forecast | service={} | order={} | mae={} | rmse={} | mape={}",
                service, model.getOrder(), round(evaluation.mae()), round(evaluation.rmse()),
                evaluation.mapeApplicable() ? round(evaluation.mape()) : "n/a");
            return ServiceOutcome.forecast(service, model.getOrder(), forecast, backtest, holdout, evaluation);
        } catch (DataException | InsufficientDataException | ConvergenceException | AlignmentException e) {
            return skip(service, e);
        }
    }

    /**
     * Fits the selected order, then the order without seasonal terms, then without any
     * differencing. The last failure is rethrown when none of them fits.
     */
    FittedModel fitWithFallback(TimeSeries training, SeasonalOrder selected) {
        LinkedHashSet<SeasonalOrder> chain = new LinkedHashSet<>();
        chain.add(selected);
        chain.add(selected.withoutSeasonal());
        chain.add(selected.withoutSeasonal().withoutDifferencing());

        ForecastPipelineException last = null;
        for (SeasonalOrder order : chain) {
            try {
                return fitter.fit(training, order);
            } catch (ConvergenceException | InsufficientDataException e) {
                log.warn("Fit failed, falling back | service={} | order={} | reason={}",
                    training.service(), order, e.getMessage());
                last = e;
            }
        }
        throw last;
    }

    private Map<String, ServiceOutcome> runSequential(RidershipTable table, List<String> services,
                                                      LocalDate runDate, RunProgressListener listener) {
        Map<String, ServiceOutcome> outcomes = new LinkedHashMap<>();
        for (String service : services) {
            ServiceOutcome outcome = process(table, service, runDate);
            outcomes.put(service, outcome);
            listener.serviceCompleted(outcome, outcomes.size(), services.size());
        }
        return outcomes;
    }

    private Map<String, ServiceOutcome> runParallel(RidershipTable table, List<String> services,
                                                    LocalDate runDate, RunProgressListener listener) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(properties.getParallelism(), services.size()));
        AtomicInteger completed = new AtomicInteger();
        try {
            Map<String, Future<ServiceOutcome>> futures = new LinkedHashMap<>();
            for (String service : services) {
                futures.put(service, executor.submit(() -> {
                    ServiceOutcome outcome = process(table, service, runDate);
                    listener.serviceCompleted(outcome, completed.incrementAndGet(), services.size());
                    return outcome;
                }));
            }
            Map<String, ServiceOutcome> outcomes = new LinkedHashMap<>();
            for (Map.Entry<String, Future<ServiceOutcome>> entry : futures.entrySet()) {
                outcomes.put(entry.getKey(), await(entry.getValue()));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private static ServiceOutcome await(Future<ServiceOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for service forecasts", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    /**
     * A dataset named in the request is resolved against {@code forecast.data-root} and must stay
     * inside it; the configured {@code forecast.dataset} is used as is.
     */
    Path resolveDataset(ForecastRunRequest request) {
        if (request.getDatasetPath() != null && !request.getDatasetPath().isBlank()) {
            Path root = properties.getDataRoot().toAbsolutePath().normalize();
            Path dataset;
            try {
                dataset = root.resolve(request.getDatasetPath()).normalize();
            } catch (InvalidPathException e) {
                throw new DataException("Dataset path is not a valid path", e);
            }
            if (!dataset.startsWith(root)) {
                log.warn("Dataset outside the data root rejected | requested={} | root={}",
                    request.getDatasetPath(), root);
                throw new DataException("Dataset path must stay inside the data directory");
            }
            return dataset;
        }
        if (properties.getDataset() == null) {
            throw new DataException("No dataset given in the request and forecast.dataset is not configured");
        }
        return properties.getDataset();
    }

    private List<String> resolveServices(ForecastRunRequest request, RidershipTable table) {
        List<String> requested = request.getServices() != null && !request.getServices().isEmpty()
            ? request.getServices()
            : properties.getServices();
        List<String> services = requested.isEmpty() ? table.services() : requested;
        return List.copyOf(new LinkedHashSet<>(services));
    }

    private static ServiceOutcome skip(String service, ForecastPipelineException e) {
        log.warn("Service skipped | service={} | reason={} | message={}", service, e.getErrorCode(), e.getMessage());
        return ServiceOutcome.skipped(service, e.getErrorCode(), e.getMessage());
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
