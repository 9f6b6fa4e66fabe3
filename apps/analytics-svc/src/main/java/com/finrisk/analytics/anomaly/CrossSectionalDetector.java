package com.finrisk.analytics.anomaly;

import com.finrisk.analytics.model.DataRow;
import com.finrisk.analytics.model.DataTable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flags records whose score on any watched field exceeds the threshold. Each field is
 * scored against its own column across the whole population.
 */
@Component
public class CrossSectionalDetector {

    private static final Logger log = LoggerFactory.getLogger(CrossSectionalDetector.class);

    public static final String ANOMALY_TYPE_COLUMN = "anomaly_type";
    public static final String SEVERITY_COLUMN = "severity";

    public DataTable detect(DataTable dataset, DetectionProfile profile, double threshold) {
        return detect(dataset, dataset, profile, threshold);
    }

    /**
     * Scores {@code dataset} against the columns of {@code referencePopulation}.
     * The returned table holds only flagged rows, sorted by severity descending with
     * ties kept in input order.
     */
    public DataTable detect(DataTable dataset, DataTable referencePopulation, DetectionProfile profile, double threshold) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(referencePopulation, "referencePopulation must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        if (Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold must be a number");
        }
        dataset.requireColumns(profile.watchedColumns());
        if (referencePopulation != dataset) {
            referencePopulation.requireColumns(profile.watchedColumns());
        }

        List<String> columns = dataset.columnsWith(derivedColumns(profile));
        if (dataset.isEmpty()) {
            log.info("anomaly_detection category={} rows=0 flagged=0", profile.category());
            return DataTable.empty(dataset.name(), columns);
        }

        List<WatchedField> fields = profile.watchedFields();
        double[][] scores = new double[fields.size()][];
        for (int f = 0; f < fields.size(); f++) {
            String column = fields.get(f).column();
            scores[f] = ZScoreCalculator.scores(dataset.numericColumn(column), referencePopulation.numericColumn(column));
        }

        List<DataRow> flagged = new ArrayList<>();
        for (int i = 0; i < dataset.size(); i++) {
            Map<String, Object> derived = new LinkedHashMap<>();
            String label = null;
            double severity = 0d;
            for (int f = 0; f < fields.size(); f++) {
                WatchedField field = fields.get(f);
                double score = scores[f][i];
                double magnitude = Math.abs(score);
                derived.put(field.scoreColumn(), score);
                severity = Math.max(severity, magnitude);
                // first field over the threshold names the anomaly, even if a later one is larger
                if (label == null && magnitude > threshold) {
                    label = field.label();
                }
            }
            if (label != null) {
                derived.put(ANOMALY_TYPE_COLUMN, label);
                derived.put(SEVERITY_COLUMN, severity);
                flagged.add(dataset.row(i).withAll(derived));
            }
        }
        flagged.sort(Comparator.comparingDouble((DataRow row) -> row.getDouble(SEVERITY_COLUMN)).reversed());

        log.info("anomaly_detection category={} rows={} flagged={} threshold={}",
                profile.category(), dataset.size(), flagged.size(), threshold);
        return DataTable.of(dataset.name(), columns, flagged);
    }

    private List<String> derivedColumns(DetectionProfile profile) {
        List<String> derived = new ArrayList<>(profile.scoreColumns());
        derived.add(ANOMALY_TYPE_COLUMN);
        derived.add(SEVERITY_COLUMN);
        return derived;
    }
}
