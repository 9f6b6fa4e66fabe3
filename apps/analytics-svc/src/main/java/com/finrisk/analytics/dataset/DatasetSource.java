package com.finrisk.analytics.dataset;

import com.finrisk.analytics.model.AnalyticsDatasets;

/**
 * Supplies validated cost, loan and monthly KPI tables to the anomaly engine.
 */
public interface DatasetSource {

    AnalyticsDatasets load();

    String describe();
}
