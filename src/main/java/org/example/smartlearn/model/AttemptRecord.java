package org.example.smartlearn.model;

import java.time.LocalDateTime;

/**
 * One scored answer in the attempt history.
 */
public record AttemptRecord(
        String studentId,
        Long questionId,
        String sessionId,
        boolean correct,
        LocalDateTime timestamp
) {
}
