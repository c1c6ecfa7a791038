package org.example.smartlearn.model;

import java.util.List;

public record SubmissionResult(
        String sessionId,
        int correct,
        int total,
        double accuracy,
        int xp,
        FeedbackTier tier,
        List<QuestionOutcome> results
) {
    public record QuestionOutcome(
            Long questionId,
            AnswerLetter selected,
            String correctAnswer,
            boolean correct
    ) {
    }
}
