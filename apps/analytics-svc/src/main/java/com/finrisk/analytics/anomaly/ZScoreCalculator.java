package com.finrisk.analytics.anomaly;

import java.util.Objects;

/**
 * Standardized scores over a reference population. Standard deviation uses the
 * sample divisor ({@code n - 1}) throughout.
 */
public final class ZScoreCalculator {

    private ZScoreCalculator() {
    }

    public static double[] scores(double[] values) {
        return scores(values, values);
    }

    /**
     * Scores {@code values} against {@code population}. A population with fewer than
     * two points or zero spread yields a score of 0 for every value.
     */
    public static double[] scores(double[] values, double[] population) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(population, "population must not be null");
        double[] result = new double[values.length];
        if (population.length < 2 || isConstant(population)) {
            return result;
        }
        double mean = mean(population);
        double stdDev = sampleStdDev(population, mean);
        if (stdDev == 0d) {
            return result;
        }
        for (int i = 0; i < values.length; i++) {
            result[i] = (values[i] - mean) / stdDev;
        }
        return result;
    }

    /**
     * True when every value is identical, regardless of rounding residue in the mean.
     */
    public static boolean isConstant(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (Double.compare(values[i], values[0]) != 0) {
                return false;
            }
        }
        return true;
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0d;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double sampleStdDev(double[] values) {
        return sampleStdDev(values, mean(values));
    }

    static double sampleStdDev(double[] values, double mean) {
        if (values.length < 2) {
            return Double.NaN;
        }
        double squares = 0d;
        for (double value : values) {
            double delta = value - mean;
            squares += delta * delta;
        }
        return Math.sqrt(squares / (values.length - 1));
    }
}
