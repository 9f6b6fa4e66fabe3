package com.finrisk.analytics.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of a tabular dataset: column name to value, in column order.
 * Values are {@link Number}, {@link String}, {@link java.time.LocalDate} or {@code null}.
 */
public final class DataRow {

    private final Map<String, Object> values;

    private DataRow(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static DataRow of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        return new DataRow(new LinkedHashMap<>(values));
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public String getString(String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    public double getDouble(String column) {
        Object value = values.get(column);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalArgumentException("Column '" + column + "' is not numeric: " + value);
    }

    public DataRow with(String column, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(column, value);
        return new DataRow(copy);
    }

    public DataRow withAll(Map<String, ?> derived) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.putAll(derived);
        return new DataRow(copy);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof DataRow other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
