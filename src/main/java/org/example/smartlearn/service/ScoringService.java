package org.example.smartlearn.service;

import org.example.smartlearn.model.AnswerLetter;
import org.example.smartlearn.model.AttemptRecord;
import org.example.smartlearn.model.FeedbackTier;
import org.example.smartlearn.model.SubmissionResult;
import org.example.smartlearn.service.exception.IncompleteSubmissionException;
import org.example.smartlearn.service.exception.NoActiveSessionException;
import org.example.smartlearn.service.exception.PersistenceFailureException;
import org.example.smartlearn.service.exception.QuestionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Finalizes a session: checks completeness, scores against the current canonical answers,
 * appends one attempt per question in a single transaction and memoizes the result.
 */
@Service
public class ScoringService {

    private static final Logger log = LoggerFactory.getLogger(ScoringService.class);

    private final QuizSessionRegistry sessionRegistry;
    private final QuestionCatalogService questionCatalogService;
    private final AttemptStoreService attemptStoreService;
    private final QuizMetricsService quizMetricsService;

    public ScoringService(
            QuizSessionRegistry sessionRegistry,
            QuestionCatalogService questionCatalogService,
            AttemptStoreService attemptStoreService,
            QuizMetricsService quizMetricsService) {
        this.sessionRegistry = sessionRegistry;
        this.questionCatalogService = questionCatalogService;
        this.attemptStoreService = attemptStoreService;
        this.quizMetricsService = quizMetricsService;
    }

    /**
     * Submits the learner's session. Calling this again after a successful submission returns the
     * stored result without writing anything.
     *
     * @throws NoActiveSessionException when the learner has no session
     * @throws IncompleteSubmissionException when any question is unanswered
     * @throws QuestionNotFoundException when a canonical answer cannot be found
     * @throws PersistenceFailureException when the attempt batch could not be stored
     */
    public SubmissionResult submit(String studentId) {
        String learner = QuizSessionService.requireStudentId(studentId);
        return sessionRegistry.withLearner(learner, slot -> {
            QuizSession session = slot.getSession();
            if (session == null) {
                throw new NoActiveSessionException(learner);
            }
            if (session.getResult() != null) {
                quizMetricsService.recordDuplicateSubmission();
                log.debug("Session {} already submitted; returning stored result", session.getSessionId());
                return session.getResult();
            }

            List<Long> unanswered = session.unansweredQuestionIds();
            if (!unanswered.isEmpty()) {
                quizMetricsService.recordIncompleteSubmission();
                log.warn("Rejected submission of session {}: {} unanswered question(s)",
                        session.getSessionId(), unanswered.size());
                throw new IncompleteSubmissionException(unanswered);
            }

            long startedAt = System.currentTimeMillis();
            SubmissionResult result = score(session);
            LocalDateTime submittedAt = LocalDateTime.now();
            List<AttemptRecord> batch = result.results().stream()
                    .map(outcome -> new AttemptRecord(
                            learner,
                            outcome.questionId(),
                            session.getSessionId(),
                            outcome.correct(),
                            submittedAt))
                    .toList();

            try {
                attemptStoreService.appendAttempts(batch);
            } catch (DataAccessException | TransactionException e) {
                quizMetricsService.recordSubmissionFailed();
                log.error("Failed to store {} attempts for session {}", batch.size(), session.getSessionId(), e);
                throw new PersistenceFailureException(
                        "Attempts for session " + session.getSessionId() + " were not stored", e);
            }

            session.markSubmitted(result);
            quizMetricsService.recordSubmissionCompleted(System.currentTimeMillis() - startedAt);
            log.info("Submitted session {} for {}: {}/{} correct, xp={}, tier={}",
                    session.getSessionId(), learner, result.correct(), result.total(), result.xp(), result.tier().code());
            return result;
        });
    }

    private SubmissionResult score(QuizSession session) {
        List<SubmissionResult.QuestionOutcome> outcomes = new ArrayList<>();
        int correct = 0;
        for (Long questionId : session.questionIds()) {
            String canonical;
            try {
                canonical = questionCatalogService.getCanonicalAnswer(questionId);
            } catch (QuestionNotFoundException e) {
                quizMetricsService.recordSubmissionFailed();
                log.warn("Aborting submission of session {}: question {} has no canonical answer",
                        session.getSessionId(), questionId);
                throw e;
            }
            AnswerLetter selected = session.answerFor(questionId);
            boolean isCorrect = selected.matches(canonical);
            if (isCorrect) {
                correct++;
            }
            outcomes.add(new SubmissionResult.QuestionOutcome(questionId, selected, canonical, isCorrect));
        }

        int total = outcomes.size();
        return new SubmissionResult(
                session.getSessionId(),
                correct,
                total,
                ScoreCalculator.accuracy(correct, total),
                (int) ScoreCalculator.xp(correct),
                FeedbackTier.of(correct, total),
                List.copyOf(outcomes)
        );
    }
}
