package com.finrisk.analytics.model;

import java.util.Set;
import java.util.TreeSet;

/**
 * Raised when a dataset lacks columns a detection call depends on.
 */
public class MissingColumnsException extends IllegalArgumentException {

    private final String dataset;
    private final Set<String> missingColumns;

    public MissingColumnsException(String dataset, Set<String> missingColumns) {
        super(dataset + " missing required columns: " + new TreeSet<>(missingColumns));
        this.dataset = dataset;
        this.missingColumns = Set.copyOf(missingColumns);
    }

    public String dataset() {
        return dataset;
    }

    public Set<String> missingColumns() {
        return missingColumns;
    }
}
