package com.finrisk.analytics.controller.dto;

import java.util.List;

public record AnomalyReportResponseDto(
        double threshold,
        int topN,
        Counts counts,
        List<CategorySummary> summary,
        List<Finding> findings,
        List<Failure> failures
) {
    public record Counts(int costs, int loans, int kpis, int total) {
    }

    public record CategorySummary(String category, int anomalyCount, String topIssue, double maxSeverity, double totalVariance) {
    }

    public record Finding(String category, String recordId, String groupKey, String anomalyType, double severity) {
    }

    public record Failure(String category, String reason) {
    }
}
