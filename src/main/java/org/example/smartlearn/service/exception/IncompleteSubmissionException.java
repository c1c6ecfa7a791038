package org.example.smartlearn.service.exception;

import java.util.List;

/**
 * Raised when a submission is attempted while some questions are still unanswered.
 * The session stays active.
 */
public class IncompleteSubmissionException extends AssessmentException {

    private final List<Long> unansweredQuestionIds;

    public IncompleteSubmissionException(List<Long> unansweredQuestionIds) {
        super("incomplete_submission",
                unansweredQuestionIds.size() + " question(s) must be answered before submitting");
        this.unansweredQuestionIds = List.copyOf(unansweredQuestionIds);
    }

    public List<Long> getUnansweredQuestionIds() {
        return unansweredQuestionIds;
    }
}
