package com.ridershipforecast.config;

import com.ridershipforecast.forecasting.Forecaster;
import com.ridershipforecast.forecasting.SarimaFitter;
import com.ridershipforecast.forecasting.SelectionSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * The forecasting components are plain objects; their thresholds come from
 * {@link ForecastProperties} here rather than from global state.
 */
@Configuration
public class ForecastingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SelectionSettings selectionSettings(ForecastProperties properties) {
        return properties.getSelection().toSettings();
    }

    @Bean
    public SarimaFitter sarimaFitter(ForecastProperties properties) {
        return new SarimaFitter(properties.getFitting().toSettings());
    }

    @Bean
    public Forecaster forecaster(ForecastProperties properties) {
        return new Forecaster(properties.getHorizon(), properties.getIntervalLevel());
    }
}
