package com.finrisk.analytics.anomaly;

import com.finrisk.analytics.model.AnomalyReport.KpiAnomaly;
import com.finrisk.analytics.model.DataRow;
import com.finrisk.analytics.model.DataTable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flags points of a chronological series that break away from a short trailing
 * baseline.
 *
 * <p>The baseline of point {@code i} is the {@code W} points immediately before it,
 * where {@code W = min(windowCap, n - 1)}. The first {@code W} points have no full
 * baseline and are never flagged. A zero-spread baseline leaves the score undefined
 * (not flagged) when the point matches it, and infinite in the direction of the move
 * when the point departs from it.
 *
 * <p>Any nonzero departure from a perfectly flat baseline is flagged, however small:
 * a move of {@code 0.0001} after a run of zeros scores {@code +Infinity} and is
 * reported as such, including as the severity of the resulting {@link KpiAnomaly}.
 * A flat run that is only nearly constant keeps a finite spread and scores normally.
 */
@Component
public class TimeSeriesDetector {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesDetector.class);

    public static final String ROLLING_MEAN_COLUMN = "rolling_mean";
    public static final String ROLLING_STD_COLUMN = "rolling_std";
    public static final String ROLLING_Z_SCORE_COLUMN = "rolling_z_score";

    private static final int MIN_WINDOW = 2;

    public static int windowSize(int points, int windowCap) {
        return Math.min(windowCap, points - 1);
    }

    public DataTable detect(DataTable series, String valueColumn, String periodColumn, double threshold, int windowCap) {
        Objects.requireNonNull(series, "series must not be null");
        series.requireColumns(List.of(periodColumn, valueColumn));
        List<String> columns = series.columnsWith(List.of(ROLLING_MEAN_COLUMN, ROLLING_STD_COLUMN, ROLLING_Z_SCORE_COLUMN));

        int window = windowSize(series.size(), windowCap);
        if (window < MIN_WINDOW) {
            log.debug("time_series metric={} points={} skipped: not enough history for a rolling window",
                    valueColumn, series.size());
            return DataTable.empty(series.name(), columns);
        }

        List<DataRow> ordered = new ArrayList<>(series.rows());
        ordered.sort((left, right) -> comparePeriods(left.get(periodColumn), right.get(periodColumn)));
        double[] values = series.withRows(ordered).numericColumn(valueColumn);
        RollingStat[] stats = rollingStats(values, window);

        List<DataRow> flagged = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            RollingStat stat = stats[i];
            if (stat == null || Double.isNaN(stat.score()) || !(Math.abs(stat.score()) > threshold)) {
                continue;
            }
            flagged.add(ordered.get(i).withAll(Map.of(
                    ROLLING_MEAN_COLUMN, stat.mean(),
                    ROLLING_STD_COLUMN, stat.std(),
                    ROLLING_Z_SCORE_COLUMN, stat.score()
            )));
        }
        log.info("time_series metric={} points={} window={} flagged={}", valueColumn, values.length, window, flagged.size());
        return DataTable.of(series.name(), columns, flagged);
    }

    /**
     * Runs {@link #detect} for each tracked metric present in the series and concatenates
     * the results in metric order.
     */
    public List<KpiAnomaly> detectMetrics(DataTable series, List<String> metrics, String periodColumn,
                                          double threshold, int windowCap) {
        List<KpiAnomaly> anomalies = new ArrayList<>();
        for (String metric : metrics) {
            if (!series.hasColumn(metric)) {
                log.debug("time_series metric={} not present in {}, skipping", metric, series.name());
                continue;
            }
            DataTable flagged = detect(series, metric, periodColumn, threshold, windowCap);
            for (DataRow row : flagged.rows()) {
                anomalies.add(new KpiAnomaly(
                        row.getString(periodColumn),
                        metric,
                        row.getDouble(metric),
                        row.getDouble(ROLLING_MEAN_COLUMN),
                        row.getDouble(ROLLING_STD_COLUMN),
                        row.getDouble(ROLLING_Z_SCORE_COLUMN)
                ));
            }
        }
        return anomalies;
    }

    /**
     * Rolling scores for an already ordered series; {@code NaN} marks points that
     * cannot be evaluated.
     */
    public static double[] rollingScores(double[] values, int window) {
        RollingStat[] stats = rollingStats(values, window);
        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scores[i] = stats[i] == null ? Double.NaN : stats[i].score();
        }
        return scores;
    }

    static RollingStat[] rollingStats(double[] values, int window) {
        if (window < MIN_WINDOW) {
            throw new IllegalArgumentException("window must be at least " + MIN_WINDOW);
        }
        RollingStat[] stats = new RollingStat[values.length];
        for (int i = window; i < values.length; i++) {
            double[] baseline = Arrays.copyOfRange(values, i - window, i);
            if (ZScoreCalculator.isConstant(baseline)) {
                double level = baseline[0];
                double score = Double.compare(values[i], level) == 0
                        ? Double.NaN
                        : Math.copySign(Double.POSITIVE_INFINITY, values[i] - level);
                stats[i] = new RollingStat(level, 0d, score);
                continue;
            }
            double mean = ZScoreCalculator.mean(baseline);
            double std = ZScoreCalculator.sampleStdDev(baseline);
            stats[i] = new RollingStat(mean, std, (values[i] - mean) / std);
        }
        return stats;
    }

    @SuppressWarnings("unchecked")
    static int comparePeriods(Object left, Object right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("period key must not be null");
        }
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (left instanceof Comparable<?> && left.getClass() == right.getClass()) {
            return ((Comparable<Object>) left).compareTo(right);
        }
        return left.toString().compareTo(right.toString());
    }

    record RollingStat(double mean, double std, double score) {
    }
}
