package com.finrisk.analytics.report;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.finrisk.analytics.model.AnomalyReport;
import com.finrisk.analytics.model.DataRow;
import com.finrisk.analytics.model.DataTable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes a report as CSV files. Column order and number formatting are fixed, so the
 * same report always produces the same bytes.
 */
@Component
public class CsvReportWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvReportWriter.class);

    public static final String SUMMARY_FILE = "anomalies_summary.csv";
    public static final String COST_ANOMALIES_FILE = "cost_anomalies.csv";
    public static final String LOAN_ANOMALIES_FILE = "loan_anomalies.csv";
    public static final String KPI_ANOMALIES_FILE = "kpi_anomalies.csv";
    public static final String COMBINED_FILE = "anomalies.csv";

    static final List<String> SUMMARY_COLUMNS =
            List.of("category", "anomaly_count", "top_issue", "max_severity", "total_variance");
    static final List<String> KPI_COLUMNS =
            List.of("month", "kpi_name", "value", "rolling_mean", "rolling_std", "rolling_z_score");
    static final List<String> COMBINED_COLUMNS =
            List.of("record_id", "group_key", "anomaly_type", "severity", "category");

    // quote only values that contain separators, quotes or line breaks
    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    public List<Path> write(AnomalyReport report, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
            List<Path> written = new ArrayList<>();

            List<List<Object>> summaryRows = report.summary().stream()
                    .map(s -> Arrays.<Object>asList(s.category(), s.anomalyCount(), s.topIssue(), s.maxSeverity(), s.aggregateMagnitude()))
                    .toList();
            written.add(writeFile(outputDir.resolve(SUMMARY_FILE), SUMMARY_COLUMNS, summaryRows));
            written.add(writeTable(outputDir.resolve(COST_ANOMALIES_FILE), report.costAnomalies()));
            written.add(writeTable(outputDir.resolve(LOAN_ANOMALIES_FILE), report.loanAnomalies()));

            if (!report.kpiAnomalies().isEmpty()) {
                List<List<Object>> kpiRows = report.kpiAnomalies().stream()
                        .map(k -> Arrays.<Object>asList(k.period(), k.kpiName(), k.value(), k.rollingMean(), k.rollingStd(), k.rollingZScore()))
                        .toList();
                written.add(writeFile(outputDir.resolve(KPI_ANOMALIES_FILE), KPI_COLUMNS, kpiRows));
            }
            if (!report.combinedFindings().isEmpty()) {
                List<List<Object>> combinedRows = report.combinedFindings().stream()
                        .map(f -> Arrays.<Object>asList(f.recordId(), f.groupKey(), f.anomalyType(), f.severity(), f.category()))
                        .toList();
                written.add(writeFile(outputDir.resolve(COMBINED_FILE), COMBINED_COLUMNS, combinedRows));
            }
            log.info("report_written dir={} files={}", outputDir, written.size());
            return written;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write anomaly report to " + outputDir, ex);
        }
    }

    private Path writeTable(Path file, DataTable table) throws IOException {
        List<List<Object>> rows = new ArrayList<>();
        for (DataRow row : table.rows()) {
            List<Object> cells = new ArrayList<>();
            for (String column : table.columns()) {
                cells.add(row.get(column));
            }
            rows.add(cells);
        }
        return writeFile(file, table.columns(), rows);
    }

    private Path writeFile(Path file, List<String> columns, List<List<Object>> rows) throws IOException {
        CsvSchema.Builder builder = CsvSchema.builder();
        columns.forEach(builder::addColumn);
        // header is written as a plain row so it also appears when there are no records
        CsvSchema schema = builder.build().withoutHeader();
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             SequenceWriter sequence = mapper.writer(schema).writeValues(out)) {
            sequence.write(columns.toArray(String[]::new));
            for (List<Object> row : rows) {
                sequence.write(row.stream().map(CsvReportWriter::format).toArray(String[]::new));
            }
        }
        return file;
    }

    static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                return d.toString();
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }
}
