package org.example.smartlearn.model;

public record StudentStats(
        String studentId,
        long attempted,
        long correct,
        long xp,
        double accuracy
) {
}
