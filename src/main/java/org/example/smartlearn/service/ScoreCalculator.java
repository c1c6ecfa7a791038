package org.example.smartlearn.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * XP and accuracy arithmetic shared by submission scoring and leaderboard aggregation.
 */
public final class ScoreCalculator {

    public static final int XP_PER_CORRECT_ANSWER = 10;

    private ScoreCalculator() {
    }

    /**
     * Percentage of correct answers rounded half-up to two decimals; {@code 0.0} when nothing was attempted.
     */
    public static double accuracy(long correct, long attempted) {
        if (attempted <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(correct * 100L)
                .divide(BigDecimal.valueOf(attempted), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public static long xp(long correct) {
        return correct * XP_PER_CORRECT_ANSWER;
    }
}
