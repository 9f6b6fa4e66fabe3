package com.finrisk.analytics.dataset;

import com.finrisk.analytics.model.DataTable;
import java.util.List;

/**
 * Columns each source table must carry before it is handed to the engine.
 */
public final class DatasetSchemas {

    public static final List<String> COST_COLUMNS = List.of(
            "cost_id", "cost_date", "business_unit", "budget_amount", "actual_amount", "variance_amount", "variance_pct");
    public static final List<String> LOAN_COLUMNS = List.of(
            "loan_id", "loan_type", "loan_status", "days_past_due", "pd", "lgd", "ead", "ecl");
    public static final List<String> TRANSACTION_COLUMNS = List.of(
            "transaction_date", "transaction_type", "amount");
    public static final List<String> MONTHLY_KPI_COLUMNS = List.of("month");

    private DatasetSchemas() {
    }

    public static DataTable validate(DataTable table, List<String> required) {
        table.requireColumns(required);
        return table;
    }
}
