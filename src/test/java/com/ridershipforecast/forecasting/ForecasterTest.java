package com.ridershipforecast.forecasting;

import com.ridershipforecast.model.FittedModel;
import com.ridershipforecast.model.Forecast;
import com.ridershipforecast.model.ForecastPoint;
import com.ridershipforecast.model.SeasonalOrder;
import com.ridershipforecast.model.TimeSeries;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ForecasterTest {

    private final SarimaFitter fitter = new SarimaFitter(FittingSettings.defaults());
    private final Forecaster forecaster = new Forecaster(7, 0.95);

    @Test
    void constantSeries_forecastsTheConstantForSevenContiguousDays() {
        TimeSeries series = SeriesFixtures.constant("Flat", 640, 45);
        FittedModel model = fitter.fit(series, new SeasonalOrder(0, 0, 0, 0, 0, 0, 7));

        Forecast forecast = forecaster.forecast(model);

        assertThat(forecast.horizon()).isEqualTo(7);
        assertThat(forecast.values()).containsOnly(640.0);
        for (int h = 0; h < 7; h++) {
            ForecastPoint point = forecast.points().get(h);
            assertThat(point.date()).isEqualTo(series.endDate().plusDays(h + 1L));
            assertThat(point.lower()).isEqualTo(640.0);
            assertThat(point.upper()).isEqualTo(640.0);
        }
    }

    @Test
    void seasonalNaive_repeatsTheLastWeek() {
        double[] week = {120, 130, 125, 140, 150, 60, 40};
        double[] values = new double[35];
        for (int t = 0; t < values.length; t++) {
            values[t] = week[t % 7];
        }
        TimeSeries series = TimeSeries.of("Weekly", SeriesFixtures.START, values);
        FittedModel model = fitter.fit(series, new SeasonalOrder(0, 0, 0, 0, 1, 0, 7));

        Forecast forecast = forecaster.forecast(model);

        for (int h = 0; h < 7; h++) {
            assertThat(forecast.values()[h]).isCloseTo(week[(35 + h) % 7], within(1e-9));
        }
    }

    @Test
    void randomWalk_forecastsLastValueWithWideningInterval() {
        double[] values = new double[40];
        for (int t = 0; t < values.length; t++) {
            values[t] = 10 + 2 * t;
        }
        TimeSeries series = TimeSeries.of("Trend", SeriesFixtures.START, values);
        FittedModel model = fitter.fit(series, SeasonalOrder.nonSeasonal(0, 1, 0));

        List<ForecastPoint> points = forecaster.forecast(model).points();

        assertThat(points).extracting(ForecastPoint::value).containsOnly(88.0);
        for (int h = 1; h < points.size(); h++) {
            double previousWidth = points.get(h - 1).upper() - points.get(h - 1).lower();
            double width = points.get(h).upper() - points.get(h).lower();
            assertThat(width).isGreaterThan(previousWidth);
        }
    }

    @Test
    void negativePredictions_areClippedAtZero() {
        double[] values = new double[30];
        for (int t = 0; t < values.length; t++) {
            values[t] = 300 - 10 * t;
        }
        TimeSeries series = TimeSeries.of("Declining", SeriesFixtures.START, values);
        FittedModel model = fitter.fit(series, SeasonalOrder.nonSeasonal(0, 2, 0));

        Forecast forecast = forecaster.forecast(model);

        assertThat(forecast.values()).containsOnly(0.0);
        assertThat(forecast.points()).allSatisfy(p -> assertThat(p.lower()).isGreaterThanOrEqualTo(0.0));
    }

    @Test
    void intervalsBracketThePointForecast() {
        TimeSeries series = SeriesFixtures.ar1(23, 300, 0.5, 200, 10);
        FittedModel model = fitter.fit(series, new SeasonalOrder(1, 0, 0, 0, 0, 0, 7));

        Forecast forecast = forecaster.forecast(model, 10);

        assertThat(forecast.horizon()).isEqualTo(10);
        assertThat(forecast.points()).allSatisfy(p -> {
            assertThat(p.value()).isGreaterThanOrEqualTo(0.0);
            assertThat(p.lower()).isLessThanOrEqualTo(p.value());
            assertThat(p.upper()).isGreaterThanOrEqualTo(p.value());
        });
    }

    @Test
    void extendedModel_forecastsFromTheEndOfTheLongerSeries() {
        TimeSeries full = SeriesFixtures.weekly(31, 140, 900, 250, 25);
        FittedModel model = fitter.fit(full.head(133), new SeasonalOrder(1, 0, 0, 0, 1, 1, 7));

        Forecast backtest = forecaster.forecast(model);
        Forecast future = forecaster.forecast(model.extend(full));

        assertThat(backtest.dates().get(0)).isEqualTo(full.tail(7).startDate());
        assertThat(future.dates().get(0)).isEqualTo(full.endDate().plusDays(1));
    }

    @Test
    void forecast_isDeterministic() {
        FittedModel model = fitter.fit(SeriesFixtures.weekly(37, 100, 400, 80, 15), new SeasonalOrder(1, 0, 1, 0, 1, 0, 7));

        assertThat(forecaster.forecast(model)).isEqualTo(forecaster.forecast(model));
    }

    @Test
    void invalidConfiguration_rejected() {
        assertThatThrownBy(() -> new Forecaster(0, 0.95)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Forecaster(7, 1.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
