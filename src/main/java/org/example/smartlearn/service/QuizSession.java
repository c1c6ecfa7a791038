package org.example.smartlearn.service;

import org.example.smartlearn.model.AnswerLetter;
import org.example.smartlearn.model.QuestionView;
import org.example.smartlearn.model.SessionStatus;
import org.example.smartlearn.model.SessionView;
import org.example.smartlearn.model.SubmissionResult;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One learner's quiz attempt. The question order is fixed at construction; only answers change,
 * and only while the session is active. Instances are not thread-safe and are always accessed
 * under the owning learner's lock in {@link QuizSessionRegistry}.
 */
public final class QuizSession {

    private final String sessionId;
    private final String studentId;
    private final String subject;
    private final int requestedCount;
    private final LocalDateTime createdAt;
    private final List<QuestionView> questions;
    private final Map<Long, AnswerLetter> answers = new LinkedHashMap<>();
    private SessionStatus status = SessionStatus.ACTIVE;
    private SubmissionResult result;

    QuizSession(
            String sessionId,
            String studentId,
            String subject,
            int requestedCount,
            List<QuestionView> questions,
            LocalDateTime createdAt) {
        this.sessionId = sessionId;
        this.studentId = studentId;
        this.subject = subject;
        this.requestedCount = requestedCount;
        this.questions = List.copyOf(questions);
        this.createdAt = createdAt;
        for (QuestionView question : this.questions) {
            if (answers.containsKey(question.id())) {
                throw new IllegalArgumentException("Duplicate question " + question.id() + " in session");
            }
            answers.put(question.id(), null);
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getStudentId() {
        return studentId;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public SubmissionResult getResult() {
        return result;
    }

    public List<Long> questionIds() {
        return List.copyOf(answers.keySet());
    }

    public boolean contains(Long questionId) {
        return answers.containsKey(questionId);
    }

    public AnswerLetter answerFor(Long questionId) {
        return answers.get(questionId);
    }

    public List<Long> unansweredQuestionIds() {
        List<Long> unanswered = new ArrayList<>();
        answers.forEach((questionId, letter) -> {
            if (letter == null) {
                unanswered.add(questionId);
            }
        });
        return unanswered;
    }

    void answer(Long questionId, AnswerLetter letter) {
        if (status != SessionStatus.ACTIVE) {
            throw new IllegalStateException("Session " + sessionId + " is " + status);
        }
        if (!answers.containsKey(questionId)) {
            throw new IllegalArgumentException("Question " + questionId + " is not part of session " + sessionId);
        }
        answers.put(questionId, letter);
    }

    void markSubmitted(SubmissionResult submissionResult) {
        if (status != SessionStatus.ACTIVE) {
            throw new IllegalStateException("Session " + sessionId + " is " + status);
        }
        this.result = submissionResult;
        this.status = SessionStatus.SUBMITTED;
    }

    public SessionView toView() {
        int answered = (int) answers.values().stream().filter(letter -> letter != null).count();
        return new SessionView(
                studentId,
                sessionId,
                status,
                subject,
                requestedCount,
                questions.size(),
                questions.size() < requestedCount,
                answered,
                createdAt,
                questions,
                Collections.unmodifiableMap(new LinkedHashMap<>(answers)),
                result
        );
    }
}
