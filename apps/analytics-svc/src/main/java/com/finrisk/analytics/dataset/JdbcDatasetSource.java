package com.finrisk.analytics.dataset;

import com.finrisk.analytics.model.AnalyticsDatasets;
import com.finrisk.analytics.model.DataRow;
import com.finrisk.analytics.model.DataTable;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Reads the raw layer of the warehouse ({@code raw.costs}, {@code raw.loans},
 * {@code raw.transactions}).
 */
@Repository
@ConditionalOnProperty(prefix = "finrisk.data", name = "source", havingValue = "jdbc")
public class JdbcDatasetSource implements DatasetSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcDatasetSource.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final MonthlyKpiAggregator kpiAggregator;

    public JdbcDatasetSource(NamedParameterJdbcTemplate jdbcTemplate, MonthlyKpiAggregator kpiAggregator) {
        this.jdbcTemplate = jdbcTemplate;
        this.kpiAggregator = kpiAggregator;
    }

    @Override
    public AnalyticsDatasets load() {
        try {
            DataTable costs = DatasetSchemas.validate(fetchCosts(), DatasetSchemas.COST_COLUMNS);
            DataTable loans = DatasetSchemas.validate(fetchLoans(), DatasetSchemas.LOAN_COLUMNS);
            DataTable transactions = fetchRevenueTransactions();
            DataTable monthlyKpis = kpiAggregator.aggregate(costs, transactions);
            log.info("jdbc_source costs={} loans={} revenueTransactions={} months={}",
                    costs.size(), loans.size(), transactions.size(), monthlyKpis.size());
            return new AnalyticsDatasets(costs, loans, monthlyKpis);
        } catch (DataAccessException ex) {
            throw new DatasetLoadException("Failed to load datasets from warehouse: " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    @Override
    public String describe() {
        return "jdbc:raw";
    }

    DataTable fetchCosts() {
        return queryTable("costs", """
                SELECT cost_id,
                       cost_date,
                       business_unit,
                       cost_category,
                       vendor,
                       budget_amount,
                       actual_amount,
                       variance_amount,
                       variance_pct
                FROM raw.costs
                ORDER BY cost_id
                """, new MapSqlParameterSource());
    }

    DataTable fetchLoans() {
        return queryTable("loans", """
                SELECT loan_id,
                       customer_id,
                       loan_type,
                       origination_date,
                       maturity_date,
                       original_amount,
                       outstanding_balance,
                       interest_rate,
                       loan_status,
                       days_past_due,
                       pd,
                       lgd,
                       ead,
                       ecl
                FROM raw.loans
                ORDER BY loan_id
                """, new MapSqlParameterSource());
    }

    DataTable fetchRevenueTransactions() {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("types", List.copyOf(MonthlyKpiAggregator.REVENUE_TRANSACTION_TYPES));
        return queryTable("transactions", """
                SELECT transaction_date,
                       transaction_type,
                       amount
                FROM raw.transactions
                WHERE transaction_type IN (:types)
                ORDER BY transaction_id
                """, params);
    }

    private DataTable queryTable(String name, String sql, MapSqlParameterSource params) {
        return jdbcTemplate.query(sql, params, rs -> {
            List<String> columns = columnNames(rs.getMetaData());
            List<DataRow> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(mapRow(rs, columns));
            }
            return DataTable.of(name, columns, rows);
        });
    }

    private List<String> columnNames(ResultSetMetaData meta) throws SQLException {
        List<String> columns = new ArrayList<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            columns.add(meta.getColumnLabel(i).toLowerCase(Locale.ROOT));
        }
        return columns;
    }

    private DataRow mapRow(ResultSet rs, List<String> columns) throws SQLException {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            Object value = rs.getObject(i + 1);
            if (value instanceof java.sql.Date date) {
                value = date.toLocalDate();
            }
            values.put(columns.get(i), value);
        }
        return DataRow.of(values);
    }
}
