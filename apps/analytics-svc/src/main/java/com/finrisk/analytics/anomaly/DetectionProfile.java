package com.finrisk.analytics.anomaly;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-category detection setup. The order of {@code watchedFields} is the labeling
 * priority: the first field over the threshold names the anomaly type.
 */
public record DetectionProfile(
        String category,
        String findingTag,
        String idColumn,
        String groupingColumn,
        String magnitudeColumn,
        List<WatchedField> watchedFields
) {

    public static final DetectionProfile COSTS = new DetectionProfile(
            "Costs",
            "Cost",
            "cost_id",
            "business_unit",
            "variance_amount",
            List.of(
                    new WatchedField("variance_pct", "variance_z_score", "High Variance"),
                    new WatchedField("actual_amount", "actual_z_score", "High Amount")
            )
    );

    public static final DetectionProfile LOANS = new DetectionProfile(
            "Loans",
            "Loan",
            "loan_id",
            "loan_type",
            "ecl",
            List.of(
                    new WatchedField("pd", "pd_z_score", "High PD"),
                    new WatchedField("ecl", "ecl_z_score", "High ECL"),
                    new WatchedField("ead", "ead_z_score", "High EAD")
            )
    );

    public DetectionProfile {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category must be provided");
        }
        if (watchedFields == null || watchedFields.isEmpty()) {
            throw new IllegalArgumentException("at least one watched field must be provided");
        }
        watchedFields = List.copyOf(watchedFields);
    }

    public List<String> watchedColumns() {
        return watchedFields.stream().map(WatchedField::column).toList();
    }

    public List<String> scoreColumns() {
        return watchedFields.stream().map(WatchedField::scoreColumn).toList();
    }

    /**
     * Watched columns plus the id, grouping and magnitude columns the report reads.
     */
    public List<String> reportColumns() {
        Set<String> columns = new LinkedHashSet<>();
        columns.add(idColumn);
        columns.add(groupingColumn);
        columns.add(magnitudeColumn);
        columns.addAll(watchedColumns());
        return new ArrayList<>(columns);
    }
}
