package org.example.smartlearn.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ScoreCalculatorTest {

    @Test
    void accuracy_roundsHalfUpToTwoDecimals() {
        assertEquals(80.0, ScoreCalculator.accuracy(4, 5));
        assertEquals(66.67, ScoreCalculator.accuracy(2, 3));
        assertEquals(33.33, ScoreCalculator.accuracy(1, 3));
        assertEquals(14.29, ScoreCalculator.accuracy(1, 7));
        assertEquals(100.0, ScoreCalculator.accuracy(9, 9));
    }

    @Test
    void accuracy_nothingAttempted_isZero() {
        assertEquals(0.0, ScoreCalculator.accuracy(0, 0));
    }

    @Test
    void xp_awardsTenPointsPerCorrectAnswer() {
        assertEquals(0L, ScoreCalculator.xp(0));
        assertEquals(40L, ScoreCalculator.xp(4));
    }
}
