package com.finrisk.analytics.dataset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.finrisk.analytics.model.DataRow;
import com.finrisk.analytics.model.DataTable;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MonthlyKpiAggregatorTest {

    private final MonthlyKpiAggregator aggregator = new MonthlyKpiAggregator();

    private static DataRow cost(String date, double budget, double actual) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("cost_date", LocalDate.parse(date));
        values.put("budget_amount", budget);
        values.put("actual_amount", actual);
        return DataRow.of(values);
    }

    private static DataRow transaction(String date, String type, double amount) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("transaction_date", date);
        values.put("transaction_type", type);
        values.put("amount", amount);
        return DataRow.of(values);
    }

    private static DataTable costs(DataRow... rows) {
        return DataTable.of("costs", List.of("cost_date", "budget_amount", "actual_amount"), List.of(rows));
    }

    @Test
    void rollsCostsUpByMonthInCalendarOrder() {
        DataTable result = aggregator.aggregate(costs(
                cost("2024-03-02", 100d, 110d),
                cost("2024-01-15", 200d, 150d),
                cost("2024-01-20", 300d, 350d)
        ));

        assertThat(result.name()).isEqualTo(MonthlyKpiAggregator.TABLE_NAME);
        assertThat(result.columns()).containsExactly("month", "actual_amount", "budget_amount", "variance_pct");
        assertThat(result.rows()).extracting(row -> row.get("month")).containsExactly("2024-01", "2024-03");
        DataRow january = result.row(0);
        assertThat(january.getDouble("actual_amount")).isEqualTo(500d);
        assertThat(january.getDouble("budget_amount")).isEqualTo(500d);
        assertThat(january.getDouble("variance_pct")).isZero();
        assertThat(result.row(1).getDouble("variance_pct")).isCloseTo(0.1d, within(1e-12));
    }

    @Test
    void addsRevenueAndProfitFromCreditAndInterestTransactions() {
        DataTable transactions = DataTable.of("transactions", DatasetSchemas.TRANSACTION_COLUMNS, List.of(
                transaction("2024-01-03", "Credit", 500d),
                transaction("2024-01-09", "Debit", 75d),
                transaction("2024-01-11", "Interest", 12.5d),
                transaction("2024-02-20", "Credit", 900d)
        ));

        DataTable result = aggregator.aggregate(costs(cost("2024-01-15", 200d, 150d)), transactions);

        assertThat(result.columns())
                .containsExactly("month", "total_revenue", "actual_amount", "budget_amount", "profit", "variance_pct");
        assertThat(result.size()).isEqualTo(2);
        DataRow january = result.row(0);
        assertThat(january.getDouble("total_revenue")).isEqualTo(512.5d);
        assertThat(january.getDouble("profit")).isEqualTo(362.5d);
        DataRow february = result.row(1);
        assertThat(february.get("month")).isEqualTo("2024-02");
        assertThat(february.getDouble("actual_amount")).isZero();
        // no budget that month
        assertThat(february.getDouble("variance_pct")).isZero();
    }

    @Test
    void monthIsDerivedFromDatesAndIsoText() {
        assertThat(MonthlyKpiAggregator.monthOf(LocalDate.of(2024, 6, 30))).isEqualTo(YearMonth.of(2024, 6));
        assertThat(MonthlyKpiAggregator.monthOf("2023-11-02")).isEqualTo(YearMonth.of(2023, 11));
        assertThat(MonthlyKpiAggregator.monthOf(java.sql.Date.valueOf("2022-02-01"))).isEqualTo(YearMonth.of(2022, 2));
        assertThatThrownBy(() -> MonthlyKpiAggregator.monthOf(42L)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void costsWithoutDateColumnAreRejected() {
        DataTable costs = DataTable.of("costs", List.of("budget_amount", "actual_amount"), List.of());

        assertThatThrownBy(() -> aggregator.aggregate(costs)).hasMessageContaining("cost_date");
    }
}
