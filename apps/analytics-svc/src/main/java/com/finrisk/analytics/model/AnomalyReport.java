package com.finrisk.analytics.model;

import java.util.List;

public record AnomalyReport(
        List<CategorySummary> summary,
        DataTable costAnomalies,
        DataTable loanAnomalies,
        List<KpiAnomaly> kpiAnomalies,
        List<Finding> combinedFindings,
        List<CategoryFailure> failures
) {
    public AnomalyReport {
        summary = List.copyOf(summary);
        kpiAnomalies = List.copyOf(kpiAnomalies);
        combinedFindings = List.copyOf(combinedFindings);
        failures = List.copyOf(failures);
    }

    public int totalAnomalies() {
        return costAnomalies.size() + loanAnomalies.size() + kpiAnomalies.size();
    }

    public boolean isPartial() {
        return !failures.isEmpty();
    }

    public record CategorySummary(
            String category,
            int anomalyCount,
            String topIssue,
            double maxSeverity,
            double aggregateMagnitude
    ) {
    }

    public record Finding(
            String category,
            String recordId,
            String groupKey,
            String anomalyType,
            double severity
    ) {
    }

    public record KpiAnomaly(
            String period,
            String kpiName,
            double value,
            double rollingMean,
            double rollingStd,
            double rollingZScore
    ) {
        public double severity() {
            return Math.abs(rollingZScore);
        }
    }

    public record CategoryFailure(String category, String reason) {
    }
}
