package com.finrisk.analytics.anomaly;

import java.util.List;

/**
 * Tunables for one detection run.
 *
 * @param threshold  absolute score above which a value is anomalous, in standard deviations
 * @param windowCap  upper bound of the rolling window used for KPI series
 * @param topN       findings kept per category in the combined table
 * @param parallel   run independent categories concurrently
 * @param kpiMetrics KPI columns scanned by the time-series detector, in report order
 */
public record AnomalySettings(
        double threshold,
        int windowCap,
        int topN,
        boolean parallel,
        List<String> kpiMetrics
) {

    public static final double DEFAULT_THRESHOLD = 3.0d;
    public static final int DEFAULT_WINDOW_CAP = 3;
    public static final int DEFAULT_TOP_N = 10;
    public static final List<String> DEFAULT_KPI_METRICS =
            List.of("total_revenue", "actual_amount", "profit", "variance_pct");
    public static final String KPI_PERIOD_COLUMN = "month";

    public static final AnomalySettings DEFAULTS = new AnomalySettings(
            DEFAULT_THRESHOLD, DEFAULT_WINDOW_CAP, DEFAULT_TOP_N, false, DEFAULT_KPI_METRICS);

    public AnomalySettings {
        if (Double.isNaN(threshold) || Double.isInfinite(threshold) || threshold <= 0) {
            throw new IllegalArgumentException("threshold must be a positive number");
        }
        if (windowCap < 2) {
            throw new IllegalArgumentException("windowCap must be at least 2");
        }
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be positive");
        }
        kpiMetrics = kpiMetrics == null ? DEFAULT_KPI_METRICS : List.copyOf(kpiMetrics);
    }

    public AnomalySettings withThreshold(double value) {
        return new AnomalySettings(value, windowCap, topN, parallel, kpiMetrics);
    }

    public AnomalySettings withTopN(int value) {
        return new AnomalySettings(threshold, windowCap, value, parallel, kpiMetrics);
    }
}
