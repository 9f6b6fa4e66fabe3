package com.finrisk.analytics.dataset;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.finrisk.analytics.config.FinRiskProperties;
import com.finrisk.analytics.model.AnalyticsDatasets;
import com.finrisk.analytics.model.DataRow;
import com.finrisk.analytics.model.DataTable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Reads the generator's CSV exports from a directory. The monthly KPI series comes
 * from {@code monthly_kpis.csv} when present, otherwise it is rolled up from costs and
 * (if available) {@code transactions.csv}.
 */
@Component
@ConditionalOnProperty(prefix = "finrisk.data", name = "source", havingValue = "csv", matchIfMissing = true)
public class CsvDatasetSource implements DatasetSource {

    private static final Logger log = LoggerFactory.getLogger(CsvDatasetSource.class);

    static final String COSTS_FILE = "costs.csv";
    static final String LOANS_FILE = "loans.csv";
    static final String TRANSACTIONS_FILE = "transactions.csv";
    static final String MONTHLY_KPIS_FILE = "monthly_kpis.csv";

    private final CsvMapper mapper = new CsvMapper();
    private final Path inputDir;
    private final MonthlyKpiAggregator kpiAggregator;

    @Autowired
    public CsvDatasetSource(FinRiskProperties properties, MonthlyKpiAggregator kpiAggregator) {
        this(Path.of(properties.data().inputDir()), kpiAggregator);
    }

    public CsvDatasetSource(Path inputDir, MonthlyKpiAggregator kpiAggregator) {
        this.inputDir = inputDir;
        this.kpiAggregator = kpiAggregator;
    }

    @Override
    public AnalyticsDatasets load() {
        DataTable costs = DatasetSchemas.validate(readTable("costs", inputDir.resolve(COSTS_FILE)), DatasetSchemas.COST_COLUMNS);
        DataTable loans = DatasetSchemas.validate(readTable("loans", inputDir.resolve(LOANS_FILE)), DatasetSchemas.LOAN_COLUMNS);
        DataTable monthlyKpis = loadMonthlyKpis(costs);
        log.info("csv_source dir={} costs={} loans={} months={}", inputDir, costs.size(), loans.size(), monthlyKpis.size());
        return new AnalyticsDatasets(costs, loans, monthlyKpis);
    }

    @Override
    public String describe() {
        return "csv:" + inputDir;
    }

    private DataTable loadMonthlyKpis(DataTable costs) {
        Path kpiFile = inputDir.resolve(MONTHLY_KPIS_FILE);
        if (Files.isRegularFile(kpiFile)) {
            return DatasetSchemas.validate(readTable(MonthlyKpiAggregator.TABLE_NAME, kpiFile), DatasetSchemas.MONTHLY_KPI_COLUMNS);
        }
        Path transactionsFile = inputDir.resolve(TRANSACTIONS_FILE);
        if (Files.isRegularFile(transactionsFile)) {
            return kpiAggregator.aggregate(costs, readTable("transactions", transactionsFile));
        }
        log.debug("csv_source no {} or {} in {}; KPI series built from costs only", MONTHLY_KPIS_FILE, TRANSACTIONS_FILE, inputDir);
        return kpiAggregator.aggregate(costs);
    }

    DataTable readTable(String name, Path file) {
        if (!Files.isRegularFile(file)) {
            throw new DatasetLoadException("Required dataset file not found: " + file);
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it = mapper.readerFor(Map.class).with(schema).readValues(file.toFile())) {
            List<DataRow> rows = new ArrayList<>();
            List<String> columns = null;
            while (it.hasNext()) {
                Map<String, String> raw = it.next();
                if (columns == null) {
                    columns = new ArrayList<>(raw.keySet());
                }
                Map<String, Object> typed = new LinkedHashMap<>();
                raw.forEach((column, cell) -> typed.put(column, CellParser.parse(cell)));
                rows.add(DataRow.of(typed));
            }
            if (columns == null) {
                columns = headerColumns(it);
            }
            return DataTable.of(name, columns, rows);
        } catch (IOException ex) {
            throw new DatasetLoadException("Failed to read " + file + ": " + ex.getMessage(), ex);
        }
    }

    private List<String> headerColumns(MappingIterator<?> it) {
        List<String> columns = new ArrayList<>();
        if (it.getParserSchema() instanceof CsvSchema parsed) {
            for (CsvSchema.Column column : parsed) {
                columns.add(column.getName());
            }
        }
        return columns;
    }
}
