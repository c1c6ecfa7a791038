package org.example.smartlearn.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record SessionView(
        String studentId,
        String sessionId,
        SessionStatus status,
        String subject,
        int requestedCount,
        int questionCount,
        boolean shortfall,
        int answeredCount,
        LocalDateTime createdAt,
        List<QuestionView> questions,
        Map<Long, AnswerLetter> answers,
        SubmissionResult result
) {
    public static SessionView empty(String studentId) {
        return new SessionView(studentId, null, SessionStatus.EMPTY, null, 0, 0, false, 0, null,
                List.of(), Map.of(), null);
    }
}
