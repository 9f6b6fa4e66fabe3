package com.finrisk.analytics;

import com.finrisk.analytics.anomaly.AnomalyReportService;
import com.finrisk.analytics.anomaly.AnomalySettings;
import com.finrisk.analytics.anomaly.CrossSectionalDetector;
import com.finrisk.analytics.anomaly.TimeSeriesDetector;
import com.finrisk.analytics.dataset.DatasetSchemas;
import com.finrisk.analytics.model.AnalyticsDatasets;
import com.finrisk.analytics.model.DataRow;
import com.finrisk.analytics.model.DataTable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small in-memory tables shaped like the generator output.
 */
public final class TestDatasets {

    public static final List<String> BUSINESS_UNITS =
            List.of("Retail Banking", "Corporate Banking", "Operations", "Technology", "Risk Management");

    private TestDatasets() {
    }

    public static DataRow cost(long id, String businessUnit, double actual, double budget, double variancePct) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("cost_id", id);
        values.put("cost_date", LocalDate.of(2024, 1, 1).plusDays(id));
        values.put("business_unit", businessUnit);
        values.put("budget_amount", budget);
        values.put("actual_amount", actual);
        values.put("variance_amount", actual - budget);
        values.put("variance_pct", variancePct);
        return DataRow.of(values);
    }

    public static DataRow loan(long id, String loanType, double pd, double ead, double ecl) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("loan_id", id);
        values.put("loan_type", loanType);
        values.put("loan_status", "Current");
        values.put("days_past_due", 0L);
        values.put("pd", pd);
        values.put("lgd", 0.4d);
        values.put("ead", ead);
        values.put("ecl", ecl);
        return DataRow.of(values);
    }

    public static DataTable costs(List<DataRow> rows) {
        return DataTable.of("costs", DatasetSchemas.COST_COLUMNS, rows);
    }

    public static DataTable loans(List<DataRow> rows) {
        return DataTable.of("loans", DatasetSchemas.LOAN_COLUMNS, rows);
    }

    /**
     * Twenty cost records with identical amounts; record 7 overruns its budget by 90%.
     */
    public static DataTable costsWithOneOverrun() {
        List<DataRow> rows = new ArrayList<>();
        for (int i = 1; i <= 20; i++) {
            String unit = BUSINESS_UNITS.get(i % BUSINESS_UNITS.size());
            double variancePct = i == 7 ? 0.90d : 0.05d;
            rows.add(cost(i, unit, 1000d, 1000d / (1 + variancePct), variancePct));
        }
        return costs(rows);
    }

    /**
     * Loans that share every risk figure, so nothing stands out.
     */
    public static DataTable uniformLoans(int count) {
        List<DataRow> rows = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            rows.add(loan(i, "Personal", 0.02d, 10000d, 80d));
        }
        return loans(rows);
    }

    public static DataTable monthlySeries(String metric, double... values) {
        List<DataRow> rows = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("month", String.format("2024-%02d", i + 1));
            row.put(metric, values[i]);
            rows.add(DataRow.of(row));
        }
        return DataTable.of("monthly_kpis", List.of("month", metric), rows);
    }

    public static AnalyticsDatasets datasets(DataTable costs, DataTable loans, DataTable monthlyKpis) {
        return new AnalyticsDatasets(costs, loans, monthlyKpis);
    }

    /** Report service that runs parallel category tasks on the calling thread. */
    public static AnomalyReportService reportService() {
        return new AnomalyReportService(
                new CrossSectionalDetector(), new TimeSeriesDetector(), AnomalySettings.DEFAULTS, Runnable::run);
    }
}
