package com.finrisk.analytics.report;

import com.finrisk.analytics.anomaly.AnomalyReportService;
import com.finrisk.analytics.anomaly.AnomalySettings;
import com.finrisk.analytics.config.FinRiskProperties;
import com.finrisk.analytics.dataset.DatasetSource;
import com.finrisk.analytics.model.AnalyticsDatasets;
import com.finrisk.analytics.model.AnomalyReport;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Load, detect and (optionally) write: the glue around the anomaly engine.
 */
@Service
public class AnomalyPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnomalyPipeline.class);

    private final DatasetSource datasetSource;
    private final AnomalyReportService reportService;
    private final CsvReportWriter reportWriter;
    private final Path outputDir;

    public AnomalyPipeline(
            DatasetSource datasetSource,
            AnomalyReportService reportService,
            CsvReportWriter reportWriter,
            FinRiskProperties properties
    ) {
        this.datasetSource = datasetSource;
        this.reportService = reportService;
        this.reportWriter = reportWriter;
        this.outputDir = Path.of(properties.output().dir());
    }

    public AnomalySettings defaultSettings() {
        return reportService.defaultSettings();
    }

    public AnomalyReport run(AnomalySettings settings) {
        log.debug("pipeline_run source={} threshold={}", datasetSource.describe(), settings.threshold());
        AnalyticsDatasets datasets = datasetSource.load();
        return reportService.generateReport(datasets, settings);
    }

    public ExportResult export(AnomalySettings settings) {
        AnomalyReport report = run(settings);
        List<Path> files = reportWriter.write(report, outputDir);
        return new ExportResult(report, outputDir, files);
    }

    public record ExportResult(AnomalyReport report, Path outputDir, List<Path> files) {
    }
}
