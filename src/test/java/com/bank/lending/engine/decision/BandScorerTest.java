package com.bank.lending.engine.decision;

import com.bank.lending.config.ScoringConfig.BandDirection;
import com.bank.lending.config.ScoringConfig.BandTable;
import org.junit.jupiter.api.Test;

import static com.bank.lending.testutil.TestDataFactory.table;
import static org.assertj.core.api.Assertions.assertThat;

class BandScorerTest {

    private static final BandTable DTI = table(BandDirection.LOWER_IS_BETTER,
            30, 18, 40, 15, 50, 12, 60, 8, 70, 4, 100, 0);
    private static final BandTable BALANCE = table(BandDirection.HIGHER_IS_BETTER,
            500, 5, 200, 3, 0, 1);
    private static final BandTable GAMBLING = table(BandDirection.LOWER_IS_BETTER,
            0, 5, 2, 3, 5, 0, 10, -3, 100, -5);

    @Test
    void score_lowerIsBetter_boundIsInclusive() {
        assertThat(BandScorer.score(DTI, 30.0)).isEqualTo(18.0);
        assertThat(BandScorer.score(DTI, 30.1)).isEqualTo(15.0);
        assertThat(BandScorer.score(DTI, 0.0)).isEqualTo(18.0);
    }

    @Test
    void score_higherIsBetter_boundIsInclusive() {
        assertThat(BandScorer.score(BALANCE, 500.0)).isEqualTo(5.0);
        assertThat(BandScorer.score(BALANCE, 499.99)).isEqualTo(3.0);
        assertThat(BandScorer.score(BALANCE, 0.0)).isEqualTo(1.0);
    }

    @Test
    void score_outsideEveryBand_getsZeroWhenTableIsNonNegative() {
        assertThat(BandScorer.score(DTI, 150.0)).isEqualTo(0.0);
        assertThat(BandScorer.score(BALANCE, -20.0)).isEqualTo(0.0);
    }

    @Test
    void score_undefinedValue_getsLowestPoints() {
        assertThat(BandScorer.score(DTI, null)).isEqualTo(0.0);
        assertThat(BandScorer.score(GAMBLING, Double.NaN)).isEqualTo(-5.0);
    }

    @Test
    void isMonotonic_detectsReversedPoints() {
        assertThat(BandScorer.isMonotonic(DTI)).isTrue();
        assertThat(BandScorer.isMonotonic(GAMBLING)).isTrue();
        assertThat(BandScorer.isMonotonic(table(BandDirection.LOWER_IS_BETTER, 10, 2, 20, 5))).isFalse();
        assertThat(BandScorer.isMonotonic(table(BandDirection.HIGHER_IS_BETTER, 10, 5, 20, 2))).isFalse();
    }

    @Test
    void maxPoints_isLargestBand() {
        assertThat(BandScorer.maxPoints(DTI)).isEqualTo(18.0);
        assertThat(BandScorer.maxPoints(GAMBLING)).isEqualTo(5.0);
    }
}
