package com.finrisk.analytics.dataset;

import com.finrisk.analytics.model.DataRow;
import com.finrisk.analytics.model.DataTable;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Rolls cost and transaction records up into the monthly KPI series scanned by the
 * time-series detector. Revenue and profit are only produced when transactions are
 * available.
 */
@Component
public class MonthlyKpiAggregator {

    public static final String TABLE_NAME = "monthly_kpis";
    public static final Set<String> REVENUE_TRANSACTION_TYPES = Set.of("Credit", "Interest");

    public DataTable aggregate(DataTable costs) {
        return aggregate(costs, null);
    }

    public DataTable aggregate(DataTable costs, DataTable transactions) {
        costs.requireColumns(List.of("cost_date", "budget_amount", "actual_amount"));
        boolean withRevenue = transactions != null;
        if (withRevenue) {
            transactions.requireColumns(DatasetSchemas.TRANSACTION_COLUMNS);
        }

        Map<YearMonth, MonthTotals> months = new TreeMap<>();
        for (DataRow row : costs.rows()) {
            MonthTotals totals = months.computeIfAbsent(monthOf(row.get("cost_date")), m -> new MonthTotals());
            totals.actual += row.getDouble("actual_amount");
            totals.budget += row.getDouble("budget_amount");
        }
        if (withRevenue) {
            for (DataRow row : transactions.rows()) {
                if (!REVENUE_TRANSACTION_TYPES.contains(row.getString("transaction_type"))) {
                    continue;
                }
                MonthTotals totals = months.computeIfAbsent(monthOf(row.get("transaction_date")), m -> new MonthTotals());
                totals.revenue += row.getDouble("amount");
            }
        }

        List<String> columns = withRevenue
                ? List.of("month", "total_revenue", "actual_amount", "budget_amount", "profit", "variance_pct")
                : List.of("month", "actual_amount", "budget_amount", "variance_pct");
        List<DataRow> rows = new ArrayList<>();
        months.forEach((month, totals) -> {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("month", month.toString());
            if (withRevenue) {
                values.put("total_revenue", totals.revenue);
            }
            values.put("actual_amount", totals.actual);
            values.put("budget_amount", totals.budget);
            if (withRevenue) {
                values.put("profit", totals.revenue - totals.actual);
            }
            values.put("variance_pct", totals.budget != 0d ? (totals.actual - totals.budget) / totals.budget : 0d);
            rows.add(DataRow.of(values));
        });
        return DataTable.of(TABLE_NAME, columns, rows);
    }

    static YearMonth monthOf(Object value) {
        if (value instanceof LocalDate date) {
            return YearMonth.from(date);
        }
        if (value instanceof java.sql.Date date) {
            return YearMonth.from(date.toLocalDate());
        }
        if (value instanceof String text && text.length() >= 7) {
            return YearMonth.parse(text.substring(0, 7));
        }
        throw new IllegalArgumentException("Cannot derive a month from '" + value + "'");
    }

    private static final class MonthTotals {
        private double revenue;
        private double actual;
        private double budget;
    }
}
