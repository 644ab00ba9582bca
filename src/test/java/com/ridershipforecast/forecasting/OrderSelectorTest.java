package com.ridershipforecast.forecasting;

import com.ridershipforecast.model.SeasonalOrder;
import com.ridershipforecast.model.TimeSeries;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OrderSelectorTest {

    private final SelectionSettings settings = SelectionSettings.defaults();

    @Test
    void constantSeries_selectsWhiteNoiseWithoutDifferencing() {
        SeasonalOrder order = OrderSelector.heuristic(SeriesFixtures.constant("Flat", 420, 60), settings);

        assertThat(order).isEqualTo(new SeasonalOrder(0, 0, 0, 0, 0, 0, 7));
    }

    @Test
    void weeklyPattern_picksPeriodSevenWithSeasonalDifference() {
        TimeSeries series = SeriesFixtures.weekly(5, 210, 1000, 300, 30);

        SeasonalOrder order = OrderSelector.heuristic(series, settings);

        assertThat(order.period()).isEqualTo(7);
        assertThat(order.seasonalD()).isEqualTo(1);
        assertBounded(order);
    }

    @Test
    void twelveDayCycle_picksPeriodTwelve() {
        SeasonalOrder order = OrderSelector.heuristic(SeriesFixtures.twelveDay(9, 240), settings);

        assertThat(order.period()).isEqualTo(12);
        assertBounded(order);
    }

    @Test
    void seriesShorterThanTwoPeriods_hasNoSeasonalTerms() {
        TimeSeries series = TimeSeries.of("Short", SeriesFixtures.START, 5, 9, 4, 8, 6, 7, 3, 9, 5, 8, 4, 7, 6);

        SeasonalOrder order = OrderSelector.heuristic(series, settings);

        assertThat(order.hasSeasonalTerms()).isFalse();
        assertBounded(order);
    }

    @Test
    void seasonalTerms_needTwoPeriodsOfTheDifferencedSeries() {
        assertThat(OrderSelector.admitsSeasonalTerms(new double[14], 7)).isTrue();
        assertThat(OrderSelector.admitsSeasonalTerms(new double[13], 7)).isFalse();
        // 14 levels leave 13 first differences
        assertThat(OrderSelector.admitsSeasonalTerms(Differencing.difference(new double[14], 1), 7)).isFalse();
    }

    @Test
    void ar1Series_getsAutoregressiveTerm() {
        SeasonalOrder order = OrderSelector.heuristic(SeriesFixtures.ar1(21, 500, 0.6, 300, 5), settings);

        assertThat(order.p()).isGreaterThanOrEqualTo(1);
        assertThat(order.d()).isZero();
        assertBounded(order);
    }

    @Test
    void selection_isDeterministic() {
        TimeSeries series = SeriesFixtures.weekly(13, 180, 800, 200, 40);

        assertThat(OrderSelector.heuristic(series, settings)).isEqualTo(OrderSelector.heuristic(series, settings));
    }

    @Test
    void strongestPeriod_tieGoesToFirstCandidate() {
        SelectionSettings reversed = new SelectionSettings(List.of(12, 7), 2, 2, 1.96, SelectionStrategy.HEURISTIC);

        assertThat(OrderSelector.strongestPeriod(new double[] {1, 1, 1, 1}, reversed)).isEqualTo(12);
    }

    @Test
    void aicGrid_keepsDifferencingAndFindsArmaTerms() {
        SelectionSettings grid = new SelectionSettings(List.of(7, 12), 2, 1, 1.96, SelectionStrategy.AIC_GRID);
        TimeSeries series = SeriesFixtures.ar1(4, 300, 0.7, 500, 5);
        SeasonalOrder heuristic = OrderSelector.heuristic(series, grid);

        SeasonalOrder order = OrderSelector.select(series, grid, new SarimaFitter(FittingSettings.defaults()));

        assertThat(order.d()).isEqualTo(heuristic.d());
        assertThat(order.seasonalD()).isEqualTo(heuristic.seasonalD());
        assertThat(order.period()).isEqualTo(heuristic.period());
        assertThat(order.p() + order.q()).isPositive();
        assertThat(order.p()).isLessThanOrEqualTo(1);
        assertThat(order.q()).isLessThanOrEqualTo(1);
    }

    private static void assertBounded(SeasonalOrder order) {
        assertThat(order.d()).isBetween(0, 2);
        assertThat(order.p()).isBetween(0, 2);
        assertThat(order.q()).isBetween(0, 2);
        assertThat(order.seasonalP()).isBetween(0, 2);
        assertThat(order.seasonalQ()).isBetween(0, 2);
        assertThat(order.seasonalD()).isBetween(0, 1);
    }
}
