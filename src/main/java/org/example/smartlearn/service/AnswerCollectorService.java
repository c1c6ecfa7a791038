package org.example.smartlearn.service;

import org.example.smartlearn.model.AnswerLetter;
import org.example.smartlearn.model.SessionStatus;
import org.example.smartlearn.model.SessionView;
import org.example.smartlearn.service.exception.InvalidSessionStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AnswerCollectorService {

    private static final Logger log = LoggerFactory.getLogger(AnswerCollectorService.class);

    private final QuizSessionRegistry sessionRegistry;
    private final QuizMetricsService quizMetricsService;

    public AnswerCollectorService(QuizSessionRegistry sessionRegistry, QuizMetricsService quizMetricsService) {
        this.sessionRegistry = sessionRegistry;
        this.quizMetricsService = quizMetricsService;
    }

    public SessionView setAnswer(String studentId, Long questionId, String rawAnswer) {
        return setAnswer(studentId, questionId, AnswerLetter.parse(rawAnswer));
    }

    /**
     * Records (or clears, with {@code null}) the learner's choice for one question. Last write wins.
     *
     * @throws InvalidSessionStateException when there is no active session or the question is not in it
     */
    public SessionView setAnswer(String studentId, Long questionId, AnswerLetter letter) {
        String learner = QuizSessionService.requireStudentId(studentId);
        return sessionRegistry.withLearner(learner, slot -> {
            QuizSession session = slot.getSession();
            if (session == null) {
                throw new InvalidSessionStateException(SessionStatus.EMPTY,
                        "Student " + learner + " has no session to answer");
            }
            if (session.getStatus() != SessionStatus.ACTIVE) {
                throw new InvalidSessionStateException(session.getStatus(),
                        "Session " + session.getSessionId() + " is already submitted");
            }
            if (questionId == null || !session.contains(questionId)) {
                throw new InvalidSessionStateException(SessionStatus.ACTIVE,
                        "Question " + questionId + " is not part of session " + session.getSessionId());
            }

            session.answer(questionId, letter);
            quizMetricsService.recordAnswerRecorded();
            log.debug("Session {}: question {} -> {}", session.getSessionId(), questionId, letter);
            return session.toView();
        });
    }
}
