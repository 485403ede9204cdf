package com.bank.lending.engine.decision;

import com.bank.lending.config.ScoringConfig.Band;
import com.bank.lending.config.ScoringConfig.BandDirection;
import com.bank.lending.config.ScoringConfig.BandTable;

import java.util.List;

/**
 * Maps a metric value to points through a band table.
 */
public final class BandScorer {

    private BandScorer() {
    }

    /**
     * LOWER_IS_BETTER scores the first band whose bound the value does not exceed;
     * HIGHER_IS_BETTER the first band whose bound it reaches. Values outside every
     * band, and undefined values, get min(0, lowest points in the table).
     */
    public static double score(BandTable table, Double value) {
        if (value != null && !value.isNaN()) {
            for (Band band : table.getBands()) {
                boolean inBand = table.getDirection() == BandDirection.LOWER_IS_BETTER
                        ? value <= band.getBound()
                        : value >= band.getBound();
                if (inBand) {
                    return band.getPoints();
                }
            }
        }
        return unmatchedPoints(table);
    }

    static double unmatchedPoints(BandTable table) {
        double lowest = 0.0;
        for (Band band : table.getBands()) {
            lowest = Math.min(lowest, band.getPoints());
        }
        return lowest;
    }

    /**
     * A table is monotonic when bounds are strictly ordered in its direction
     * (ascending for LOWER_IS_BETTER, descending for HIGHER_IS_BETTER) and points never
     * increase down the table, so a better value can never earn fewer points.
     */
    public static boolean isMonotonic(BandTable table) {
        List<Band> bands = table.getBands();
        for (int i = 1; i < bands.size(); i++) {
            Band prev = bands.get(i - 1);
            Band curr = bands.get(i);
            boolean ordered = table.getDirection() == BandDirection.LOWER_IS_BETTER
                    ? curr.getBound() > prev.getBound()
                    : curr.getBound() < prev.getBound();
            if (!ordered || curr.getPoints() > prev.getPoints()) {
                return false;
            }
        }
        return true;
    }

    public static double maxPoints(BandTable table) {
        double max = Double.NEGATIVE_INFINITY;
        for (Band band : table.getBands()) {
            max = Math.max(max, band.getPoints());
        }
        return max;
    }
}
