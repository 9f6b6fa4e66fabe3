package com.finrisk.analytics.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.finrisk.analytics.TestDatasets;
import com.finrisk.analytics.anomaly.AnomalyReportService;
import com.finrisk.analytics.model.AnomalyReport;
import com.finrisk.analytics.model.DataTable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvReportWriterTest {

    private final CsvReportWriter writer = new CsvReportWriter();

    @TempDir
    Path dir;

    private static AnomalyReport sampleReport() {
        AnomalyReportService service = TestDatasets.reportService();
        return service.generateReport(TestDatasets.datasets(
                TestDatasets.costsWithOneOverrun(),
                TestDatasets.uniformLoans(6),
                TestDatasets.monthlySeries("actual_amount", 100, 102, 98, 101, 99, 100, 400)));
    }

    @Test
    void writesSummaryAndPerCategoryFiles() throws IOException {
        List<Path> files = writer.write(sampleReport(), dir);

        assertThat(files).extracting(path -> path.getFileName().toString()).containsExactly(
                "anomalies_summary.csv", "cost_anomalies.csv", "loan_anomalies.csv", "kpi_anomalies.csv", "anomalies.csv");

        List<String> summary = Files.readAllLines(dir.resolve("anomalies_summary.csv"));
        assertThat(summary.get(0)).isEqualTo("category,anomaly_count,top_issue,max_severity,total_variance");
        assertThat(summary).hasSize(3);
        assertThat(summary.get(1)).startsWith("Costs,1,Operations,");
        assertThat(summary.get(2)).startsWith("KPIs,1,actual_amount,").endsWith(",0");

        List<String> combined = Files.readAllLines(dir.resolve("anomalies.csv"));
        assertThat(combined.get(0)).isEqualTo("record_id,group_key,anomaly_type,severity,category");
        assertThat(combined.get(1)).startsWith("7,Operations,High Variance,").endsWith(",Cost");

        List<String> kpis = Files.readAllLines(dir.resolve("kpi_anomalies.csv"));
        assertThat(kpis.get(0)).isEqualTo("month,kpi_name,value,rolling_mean,rolling_std,rolling_z_score");
        assertThat(kpis.get(1)).isEqualTo("2024-07,actual_amount,400,100,1,300");
    }

    @Test
    void emptyCategoryStillGetsHeaderOnlyFile() throws IOException {
        writer.write(sampleReport(), dir);

        List<String> loans = Files.readAllLines(dir.resolve("loan_anomalies.csv"));
        assertThat(loans).hasSize(1);
        assertThat(loans.get(0)).startsWith("loan_id,loan_type").endsWith("anomaly_type,severity");
    }

    @Test
    void skipsOptionalFilesWhenThereIsNothingToWrite() {
        AnomalyReport empty = new AnomalyReport(List.of(),
                DataTable.empty("costs", List.of("cost_id")),
                DataTable.empty("loans", List.of("loan_id")),
                List.of(), List.of(), List.of());

        List<Path> files = writer.write(empty, dir);

        assertThat(files).extracting(path -> path.getFileName().toString())
                .containsExactly("anomalies_summary.csv", "cost_anomalies.csv", "loan_anomalies.csv");
        assertThat(Files.exists(dir.resolve("kpi_anomalies.csv"))).isFalse();
        assertThat(Files.exists(dir.resolve("anomalies.csv"))).isFalse();
    }

    @Test
    void rerunProducesIdenticalBytes() throws IOException {
        Path first = dir.resolve("first");
        Path second = dir.resolve("second");

        writer.write(sampleReport(), first);
        writer.write(sampleReport(), second);

        for (String name : List.of("anomalies_summary.csv", "cost_anomalies.csv", "loan_anomalies.csv",
                "kpi_anomalies.csv", "anomalies.csv")) {
            assertThat(Files.readAllBytes(second.resolve(name))).isEqualTo(Files.readAllBytes(first.resolve(name)));
        }
    }

    @Test
    void formatsNumbersWithoutTrailingZeros() {
        assertThat(CsvReportWriter.format(null)).isEmpty();
        assertThat(CsvReportWriter.format(1200.50d)).isEqualTo("1200.5");
        assertThat(CsvReportWriter.format(3.0d)).isEqualTo("3");
        assertThat(CsvReportWriter.format(new java.math.BigDecimal("1050.00"))).isEqualTo("1050");
        assertThat(CsvReportWriter.format(Double.NEGATIVE_INFINITY)).isEqualTo("-Infinity");
        assertThat(CsvReportWriter.format(12L)).isEqualTo("12");
    }
}
