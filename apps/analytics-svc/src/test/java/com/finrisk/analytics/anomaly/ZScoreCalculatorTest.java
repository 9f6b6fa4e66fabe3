package com.finrisk.analytics.anomaly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class ZScoreCalculatorTest {

    @Test
    void scoresAgainstSampleStandardDeviation() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        double[] scores = ZScoreCalculator.scores(values);

        // mean 5, sample std sqrt(32 / 7)
        double std = Math.sqrt(32d / 7d);
        assertThat(scores).hasSize(8);
        assertThat(scores[0]).isCloseTo((2 - 5) / std, within(1e-12));
        assertThat(scores[7]).isCloseTo((9 - 5) / std, within(1e-12));
        assertThat(scores[4]).isCloseTo(0d, within(1e-12));
    }

    @Test
    void constantColumnScoresZero() {
        double[] values = {0.1, 0.1, 0.1, 0.1, 0.1, 0.1, 0.1};

        assertThat(ZScoreCalculator.scores(values)).containsOnly(0d);
    }

    @Test
    void singleValueScoresZero() {
        assertThat(ZScoreCalculator.scores(new double[] {42d})).containsExactly(0d);
    }

    @Test
    void emptyColumnGivesEmptyScores() {
        assertThat(ZScoreCalculator.scores(new double[0])).isEmpty();
    }

    @Test
    void scoresAgainstSeparateReferencePopulation() {
        double[] population = {1, 2, 3, 4, 5};
        double std = ZScoreCalculator.sampleStdDev(population);
        double[] values = {3, 3 + 12 * std};

        double[] scores = ZScoreCalculator.scores(values, population);

        assertThat(scores[0]).isCloseTo(0d, within(1e-12));
        assertThat(scores[1]).isCloseTo(12d, within(1e-9));
    }

    @Test
    void sameInputGivesSameScores() {
        double[] values = {10.5, 11.25, 9.75, 30.0, 10.0};

        assertThat(ZScoreCalculator.scores(values)).containsExactly(ZScoreCalculator.scores(values));
    }
}
