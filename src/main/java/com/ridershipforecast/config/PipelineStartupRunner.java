package com.ridershipforecast.config;

import com.ridershipforecast.dto.ForecastRunRequest;
import com.ridershipforecast.dto.ForecastRunResponse;
import com.ridershipforecast.service.ForecastPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once over the configured dataset when {@code forecast.run-on-startup} is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "forecast", name = "run-on-startup", havingValue = "true")
public class PipelineStartupRunner implements CommandLineRunner {

    private final ForecastPipelineService pipelineService;

    @Override
    public void run(String... args) {
        log.info("Startup forecast run requested");
        ForecastRunResponse response = pipelineService.run(ForecastRunRequest.builder().build());
        log.info("Startup forecast run finished | runDate={} | forecasted={} | skipped={}",
            response.getRunDate(), response.getForecasted(), response.getSkipped());
    }
}
