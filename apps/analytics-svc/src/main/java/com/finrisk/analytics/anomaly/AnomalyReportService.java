package com.finrisk.analytics.anomaly;

import com.finrisk.analytics.model.AnalyticsDatasets;
import com.finrisk.analytics.model.AnomalyReport;
import com.finrisk.analytics.model.AnomalyReport.CategoryFailure;
import com.finrisk.analytics.model.AnomalyReport.CategorySummary;
import com.finrisk.analytics.model.AnomalyReport.Finding;
import com.finrisk.analytics.model.AnomalyReport.KpiAnomaly;
import com.finrisk.analytics.model.DataRow;
import com.finrisk.analytics.model.DataTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the detectors over each dataset category and assembles the category summary
 * and the combined findings table. A failing category is reported and skipped; the
 * remaining categories still produce results.
 */
@Service
public class AnomalyReportService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyReportService.class);

    static final String KPI_CATEGORY = "KPIs";

    private final CrossSectionalDetector crossSectionalDetector;
    private final TimeSeriesDetector timeSeriesDetector;
    private final AnomalySettings defaultSettings;
    private final Executor detectionExecutor;

    public AnomalyReportService(
            CrossSectionalDetector crossSectionalDetector,
            TimeSeriesDetector timeSeriesDetector,
            AnomalySettings defaultSettings,
            @Qualifier("anomalyDetectionExecutor") Executor detectionExecutor
    ) {
        this.crossSectionalDetector = crossSectionalDetector;
        this.timeSeriesDetector = timeSeriesDetector;
        this.defaultSettings = defaultSettings;
        this.detectionExecutor = detectionExecutor;
    }

    public AnomalySettings defaultSettings() {
        return defaultSettings;
    }

    public AnomalyReport generateReport(AnalyticsDatasets datasets) {
        return generateReport(datasets, defaultSettings);
    }

    public AnomalyReport generateReport(AnalyticsDatasets datasets, AnomalySettings settings) {
        log.info("anomaly_report start threshold={} windowCap={} topN={} parallel={}",
                settings.threshold(), settings.windowCap(), settings.topN(), settings.parallel());

        Supplier<DataTable> costTask = () -> detectRecords(datasets.costs(), DetectionProfile.COSTS, settings);
        Supplier<DataTable> loanTask = () -> detectRecords(datasets.loans(), DetectionProfile.LOANS, settings);
        Supplier<List<KpiAnomaly>> kpiTask = () -> timeSeriesDetector.detectMetrics(
                datasets.monthlyKpis(),
                settings.kpiMetrics(),
                AnomalySettings.KPI_PERIOD_COLUMN,
                settings.threshold(),
                settings.windowCap());

        CategoryResult<DataTable> costs;
        CategoryResult<DataTable> loans;
        CategoryResult<List<KpiAnomaly>> kpis;
        if (settings.parallel()) {
            try {
                CompletableFuture<CategoryResult<DataTable>> costFuture = CompletableFuture.supplyAsync(
                        () -> runCategory(DetectionProfile.COSTS.category(), costTask), detectionExecutor);
                CompletableFuture<CategoryResult<DataTable>> loanFuture = CompletableFuture.supplyAsync(
                        () -> runCategory(DetectionProfile.LOANS.category(), loanTask), detectionExecutor);
                CompletableFuture<CategoryResult<List<KpiAnomaly>>> kpiFuture = CompletableFuture.supplyAsync(
                        () -> runCategory(KPI_CATEGORY, kpiTask), detectionExecutor);
                costs = costFuture.join();
                loans = loanFuture.join();
                kpis = kpiFuture.join();
            } catch (CompletionException ex) {
                throw new IllegalStateException("Anomaly detection worker failed", ex.getCause());
            }
        } else {
            costs = runCategory(DetectionProfile.COSTS.category(), costTask);
            loans = runCategory(DetectionProfile.LOANS.category(), loanTask);
            kpis = runCategory(KPI_CATEGORY, kpiTask);
        }

        DataTable costAnomalies = costs.value().orElseGet(() -> DataTable.empty(datasets.costs().name(), List.of()));
        DataTable loanAnomalies = loans.value().orElseGet(() -> DataTable.empty(datasets.loans().name(), List.of()));
        List<KpiAnomaly> kpiAnomalies = kpis.value().orElseGet(List::of);

        List<CategorySummary> summary = new ArrayList<>();
        summarizeRecords(costAnomalies, DetectionProfile.COSTS).ifPresent(summary::add);
        summarizeRecords(loanAnomalies, DetectionProfile.LOANS).ifPresent(summary::add);
        summarizeKpis(kpiAnomalies).ifPresent(summary::add);

        List<Finding> combined = new ArrayList<>();
        combined.addAll(topFindings(costAnomalies, DetectionProfile.COSTS, settings.topN()));
        combined.addAll(topFindings(loanAnomalies, DetectionProfile.LOANS, settings.topN()));

        List<CategoryFailure> failures = new ArrayList<>();
        costs.failure().ifPresent(failures::add);
        loans.failure().ifPresent(failures::add);
        kpis.failure().ifPresent(failures::add);

        AnomalyReport report = new AnomalyReport(summary, costAnomalies, loanAnomalies, kpiAnomalies, combined, failures);
        log.info("anomaly_report done costs={} loans={} kpis={} total={} failedCategories={}",
                costAnomalies.size(), loanAnomalies.size(), kpiAnomalies.size(), report.totalAnomalies(), failures.size());
        return report;
    }

    private DataTable detectRecords(DataTable dataset, DetectionProfile profile, AnomalySettings settings) {
        dataset.requireColumns(profile.reportColumns());
        // summed for the category summary, so it has to be numeric throughout
        dataset.numericColumn(profile.magnitudeColumn());
        return crossSectionalDetector.detect(dataset, profile, settings.threshold());
    }

    private <T> CategoryResult<T> runCategory(String category, Supplier<T> task) {
        try {
            return new CategoryResult<>(Optional.of(task.get()), Optional.empty());
        } catch (RuntimeException ex) {
            log.warn("anomaly_report category={} failed, omitting from summary: {}", category, ex.getMessage(), ex);
            String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            return new CategoryResult<>(Optional.empty(), Optional.of(new CategoryFailure(category, reason)));
        }
    }

    private Optional<CategorySummary> summarizeRecords(DataTable anomalies, DetectionProfile profile) {
        if (anomalies.isEmpty()) {
            return Optional.empty();
        }
        double maxSeverity = 0d;
        double magnitude = 0d;
        for (DataRow row : anomalies.rows()) {
            maxSeverity = Math.max(maxSeverity, row.getDouble(CrossSectionalDetector.SEVERITY_COLUMN));
            magnitude += row.getDouble(profile.magnitudeColumn());
        }
        return Optional.of(new CategorySummary(
                profile.category(),
                anomalies.size(),
                anomalies.row(0).getString(profile.groupingColumn()),
                maxSeverity,
                magnitude
        ));
    }

    private Optional<CategorySummary> summarizeKpis(List<KpiAnomaly> anomalies) {
        if (anomalies.isEmpty()) {
            return Optional.empty();
        }
        double maxSeverity = anomalies.stream().mapToDouble(KpiAnomaly::severity).max().orElse(0d);
        // heterogeneous metrics have no shared magnitude
        return Optional.of(new CategorySummary(KPI_CATEGORY, anomalies.size(), anomalies.get(0).kpiName(), maxSeverity, 0d));
    }

    private List<Finding> topFindings(DataTable anomalies, DetectionProfile profile, int topN) {
        return anomalies.rows().stream()
                .limit(topN)
                .map(row -> new Finding(
                        profile.findingTag(),
                        row.getString(profile.idColumn()),
                        row.getString(profile.groupingColumn()),
                        row.getString(CrossSectionalDetector.ANOMALY_TYPE_COLUMN),
                        row.getDouble(CrossSectionalDetector.SEVERITY_COLUMN)
                ))
                .toList();
    }

    private record CategoryResult<T>(Optional<T> value, Optional<CategoryFailure> failure) {
    }
}
