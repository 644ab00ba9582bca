package com.ridershipforecast.config;

import com.ridershipforecast.forecasting.FittingSettings;
import com.ridershipforecast.forecasting.SelectionSettings;
import com.ridershipforecast.forecasting.SelectionStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "forecast")
public class ForecastProperties {

    /** CSV with one date column and one count column per service. */
    private Path dataset;

    /** Directory that dataset paths given in run requests are resolved against and confined to. */
    @NotNull
    private Path dataRoot = Path.of("data");

    @NotBlank
    private String dateColumn = "Date";

    @NotEmpty
    private List<String> datePatterns = new ArrayList<>(List.of("yyyy-MM-dd", "dd/MM/yyyy", "d/M/yyyy", "dd-MM-yyyy"));

    /** Services to forecast; every non-date column when empty. */
    private List<String> services = new ArrayList<>();

    @NotNull
    private Path outputDir = Path.of("reports", "forecast");

    @Min(1)
    private int horizon = 7;

    @Min(1)
    private int holdoutDays = 7;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private double intervalLevel = 0.95;

    @Min(1)
    private int parallelism = 1;

    private boolean runOnStartup = false;

    @Valid
    private Selection selection = new Selection();

    @Valid
    private Fitting fitting = new Fitting();

    @Valid
    private Jobs jobs = new Jobs();

    @Data
    public static class Selection {
        @NotEmpty
        private List<@Min(2) Integer> candidatePeriods = new ArrayList<>(List.of(7, 12));
        @Min(0)
        private int maxDifferencing = 2;
        @Min(0)
        private int maxOrder = 2;
        @DecimalMin(value = "0.0", inclusive = false)
        private double significanceZ = 1.96;
        @NotNull
        private SelectionStrategy strategy = SelectionStrategy.HEURISTIC;

        public SelectionSettings toSettings() {
            return new SelectionSettings(candidatePeriods, maxDifferencing, maxOrder, significanceZ, strategy);
        }
    }

    @Data
    public static class Fitting {
        @Min(1)
        private int minObservations = 30;
        @Min(1)
        private int maxIterations = 10_000;
        @Min(1)
        private int maxEvaluations = 40_000;

        public FittingSettings toSettings() {
            return new FittingSettings(minObservations, maxIterations, maxEvaluations);
        }
    }

    @Data
    public static class Jobs {
        @Min(1)
        private int poolSize = 2;
        @Min(1)
        private int maxRetained = 100;
    }
}
