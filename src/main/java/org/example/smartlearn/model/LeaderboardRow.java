package org.example.smartlearn.model;

public record LeaderboardRow(
        int rank,
        String studentId,
        long attempted,
        long correct,
        long xp,
        double accuracy
) {
}
