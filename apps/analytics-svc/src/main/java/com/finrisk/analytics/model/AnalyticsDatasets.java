package com.finrisk.analytics.model;

import java.util.Objects;

/**
 * Validated inputs handed to the anomaly engine by the data preparation stage.
 */
public record AnalyticsDatasets(DataTable costs, DataTable loans, DataTable monthlyKpis) {

    public AnalyticsDatasets {
        Objects.requireNonNull(costs, "costs must be provided");
        Objects.requireNonNull(loans, "loans must be provided");
        Objects.requireNonNull(monthlyKpis, "monthlyKpis must be provided");
    }
}
