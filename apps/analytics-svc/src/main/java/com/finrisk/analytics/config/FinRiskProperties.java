package com.finrisk.analytics.config;

import com.finrisk.analytics.anomaly.AnomalySettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "finrisk")
public record FinRiskProperties(
        @Valid Anomaly anomaly,
        @Valid Data data,
        Output output,
        Runner runner
) {

    @ConstructorBinding
    public FinRiskProperties {
        // every section is optional; missing ones fall back to the documented defaults
        if (anomaly == null) {
            anomaly = new Anomaly(null, null, null, null, null, null);
        }
        if (data == null) {
            data = new Data(null, null);
        }
        if (output == null) {
            output = new Output(null);
        }
        if (runner == null) {
            runner = new Runner(null);
        }
    }

    public record Anomaly(
            @DecimalMin(value = "0.0", inclusive = false) Double threshold,
            @Min(2) Integer windowCap,
            @Min(1) Integer topN,
            Boolean parallel,
            List<String> kpiMetrics,
            @Min(1) Integer workerThreads
    ) {
        public static final int DEFAULT_WORKER_THREADS = 3;

        public Anomaly {
            if (threshold == null) {
                threshold = AnomalySettings.DEFAULT_THRESHOLD;
            }
            if (windowCap == null) {
                windowCap = AnomalySettings.DEFAULT_WINDOW_CAP;
            }
            if (topN == null) {
                topN = AnomalySettings.DEFAULT_TOP_N;
            }
            if (kpiMetrics == null || kpiMetrics.isEmpty()) {
                kpiMetrics = AnomalySettings.DEFAULT_KPI_METRICS;
            }
            if (workerThreads == null) {
                workerThreads = DEFAULT_WORKER_THREADS;
            }
        }

        public boolean parallelFlag() {
            return parallel != null && parallel;
        }

        public AnomalySettings toSettings() {
            return new AnomalySettings(threshold, windowCap, topN, parallelFlag(), kpiMetrics);
        }
    }

    public record Data(String source, String inputDir) {
        public static final String SOURCE_CSV = "csv";
        public static final String SOURCE_JDBC = "jdbc";

        public Data {
            source = source == null || source.isBlank() ? SOURCE_CSV : source.trim().toLowerCase(Locale.ROOT);
            if (!SOURCE_CSV.equals(source) && !SOURCE_JDBC.equals(source)) {
                throw new IllegalArgumentException("data.source must be 'csv' or 'jdbc' but was '" + source + "'");
            }
            if (inputDir == null || inputDir.isBlank()) {
                inputDir = "data_generation/output";
            }
        }
    }

    public record Output(String dir) {
        public Output {
            if (dir == null || dir.isBlank()) {
                dir = "analytics/outputs";
            }
        }
    }

    public record Runner(Boolean enabled) {
        public boolean enabledFlag() {
            return enabled != null && enabled;
        }
    }
}
