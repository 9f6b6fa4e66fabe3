package com.finrisk.analytics.anomaly;

import java.util.Objects;

/**
 * A numeric column watched by the cross-sectional detector, the derived column its
 * score is written to, and the anomaly label it assigns when it fires.
 */
public record WatchedField(String column, String scoreColumn, String label) {

    public WatchedField {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(scoreColumn, "scoreColumn must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }
}
