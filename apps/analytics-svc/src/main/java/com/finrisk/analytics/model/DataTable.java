package com.finrisk.analytics.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ordered collection of homogeneous rows. Instances are immutable; every
 * transformation returns a new table and leaves the source untouched.
 */
public final class DataTable {

    private final String name;
    private final List<String> columns;
    private final List<DataRow> rows;

    private DataTable(String name, List<String> columns, List<DataRow> rows) {
        this.name = name;
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
    }

    public static DataTable of(String name, List<String> columns, List<DataRow> rows) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        return new DataTable(name, columns, rows);
    }

    public static DataTable empty(String name, List<String> columns) {
        return of(name, columns, List.of());
    }

    public String name() {
        return name;
    }

    public List<String> columns() {
        return columns;
    }

    public List<DataRow> rows() {
        return rows;
    }

    public DataRow row(int index) {
        return rows.get(index);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public void requireColumns(Collection<String> required) {
        Set<String> missing = new TreeSet<>();
        for (String column : required) {
            if (!columns.contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingColumnsException(name, missing);
        }
    }

    /**
     * Reads a column as doubles. Fails on null or non-numeric cells rather than
     * letting a bad value leak into the statistics.
     */
    public double[] numericColumn(String column) {
        requireColumns(List.of(column));
        double[] values = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            Object value = rows.get(i).get(column);
            if (!(value instanceof Number number)) {
                throw new IllegalArgumentException(
                        name + ": column '" + column + "' has non-numeric value '" + value + "' at row " + i);
            }
            values[i] = number.doubleValue();
        }
        return values;
    }

    public DataTable withRows(List<DataRow> newRows) {
        return new DataTable(name, columns, newRows);
    }

    public List<String> columnsWith(List<String> extra) {
        Set<String> merged = new LinkedHashSet<>(columns);
        merged.addAll(extra);
        return new ArrayList<>(merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof DataTable other
                && name.equals(other.name)
                && columns.equals(other.columns)
                && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, columns, rows);
    }

    @Override
    public String toString() {
        return "DataTable[" + name + ", columns=" + columns + ", rows=" + rows.size() + "]";
    }
}
