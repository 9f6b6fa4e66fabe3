package com.finrisk.analytics.controller;

import com.finrisk.analytics.anomaly.AnomalySettings;
import com.finrisk.analytics.controller.dto.AnomalyReportResponseDto;
import com.finrisk.analytics.controller.dto.ExportResponseDto;
import com.finrisk.analytics.controller.dto.KpiAnomalyResponseDto;
import com.finrisk.analytics.model.AnomalyReport;
import com.finrisk.analytics.model.DataRow;
import com.finrisk.analytics.model.DataTable;
import com.finrisk.analytics.report.AnomalyPipeline;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/anomalies")
public class AnomalyReportController {

    private final AnomalyPipeline pipeline;

    public AnomalyReportController(AnomalyPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @GetMapping("/report")
    public ResponseEntity<AnomalyReportResponseDto> getReport(
            @RequestParam(value = "threshold", required = false) Double threshold,
            @RequestParam(value = "topN", required = false) Integer topN
    ) {
        AnomalySettings settings = settingsFor(threshold, topN);
        AnomalyReport report = pipeline.run(settings);
        return ResponseEntity.ok(map(report, settings));
    }

    @GetMapping("/costs")
    public ResponseEntity<List<Map<String, Object>>> getCostAnomalies(
            @RequestParam(value = "threshold", required = false) Double threshold
    ) {
        AnomalyReport report = pipeline.run(settingsFor(threshold, null));
        return ResponseEntity.ok(rows(report.costAnomalies()));
    }

    @GetMapping("/loans")
    public ResponseEntity<List<Map<String, Object>>> getLoanAnomalies(
            @RequestParam(value = "threshold", required = false) Double threshold
    ) {
        AnomalyReport report = pipeline.run(settingsFor(threshold, null));
        return ResponseEntity.ok(rows(report.loanAnomalies()));
    }

    @GetMapping("/kpis")
    public ResponseEntity<List<KpiAnomalyResponseDto>> getKpiAnomalies(
            @RequestParam(value = "threshold", required = false) Double threshold
    ) {
        AnomalyReport report = pipeline.run(settingsFor(threshold, null));
        return ResponseEntity.ok(report.kpiAnomalies().stream()
                .map(kpi -> new KpiAnomalyResponseDto(
                        kpi.period(),
                        kpi.kpiName(),
                        kpi.value(),
                        kpi.rollingMean(),
                        kpi.rollingStd(),
                        kpi.rollingZScore()
                ))
                .toList());
    }

    @PostMapping("/report/export")
    public ResponseEntity<ExportResponseDto> export() {
        AnomalyPipeline.ExportResult result = pipeline.export(pipeline.defaultSettings());
        return ResponseEntity.ok(new ExportResponseDto(
                result.outputDir().toString(),
                result.files().stream().map(Path::getFileName).map(Path::toString).toList(),
                result.report().totalAnomalies(),
                result.report().failures().stream().map(AnomalyReport.CategoryFailure::category).toList()
        ));
    }

    private AnomalySettings settingsFor(Double threshold, Integer topN) {
        AnomalySettings settings = pipeline.defaultSettings();
        if (threshold != null) {
            settings = settings.withThreshold(threshold);
        }
        if (topN != null) {
            settings = settings.withTopN(topN);
        }
        return settings;
    }

    private List<Map<String, Object>> rows(DataTable table) {
        return table.rows().stream().map(DataRow::asMap).toList();
    }

    private AnomalyReportResponseDto map(AnomalyReport report, AnomalySettings settings) {
        return new AnomalyReportResponseDto(
                settings.threshold(),
                settings.topN(),
                new AnomalyReportResponseDto.Counts(
                        report.costAnomalies().size(),
                        report.loanAnomalies().size(),
                        report.kpiAnomalies().size(),
                        report.totalAnomalies()
                ),
                report.summary().stream()
                        .map(s -> new AnomalyReportResponseDto.CategorySummary(
                                s.category(), s.anomalyCount(), s.topIssue(), s.maxSeverity(), s.aggregateMagnitude()))
                        .toList(),
                report.combinedFindings().stream()
                        .map(f -> new AnomalyReportResponseDto.Finding(
                                f.category(), f.recordId(), f.groupKey(), f.anomalyType(), f.severity()))
                        .toList(),
                report.failures().stream()
                        .map(f -> new AnomalyReportResponseDto.Failure(f.category(), f.reason()))
                        .toList()
        );
    }
}
