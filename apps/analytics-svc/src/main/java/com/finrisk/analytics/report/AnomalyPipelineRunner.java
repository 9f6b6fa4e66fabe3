package com.finrisk.analytics.report;

import com.finrisk.analytics.model.AnomalyReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Batch entry point: runs the pipeline once at startup when
 * {@code finrisk.runner.enabled=true}. A load or write failure aborts startup.
 */
@Component
@ConditionalOnProperty(prefix = "finrisk.runner", name = "enabled", havingValue = "true")
public class AnomalyPipelineRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(AnomalyPipelineRunner.class);

    private final AnomalyPipeline pipeline;

    public AnomalyPipelineRunner(AnomalyPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public void run(String... args) {
        log.info("==== ANOMALY DETECTION ====");
        AnomalyPipeline.ExportResult result = pipeline.export(pipeline.defaultSettings());
        AnomalyReport report = result.report();
        for (AnomalyReport.CategorySummary summary : report.summary()) {
            log.info("category={} anomalies={} topIssue='{}' maxSeverity={}",
                    summary.category(), summary.anomalyCount(), summary.topIssue(), summary.maxSeverity());
        }
        for (AnomalyReport.CategoryFailure failure : report.failures()) {
            log.warn("category={} skipped: {}", failure.category(), failure.reason());
        }
        log.info("Total anomalies={} outputs={} dir={}", report.totalAnomalies(), result.files().size(), result.outputDir());
    }
}
