package org.example.smartlearn.service;

import org.example.smartlearn.config.QuizProperties;
import org.example.smartlearn.model.QuestionView;
import org.example.smartlearn.model.SessionStatus;
import org.example.smartlearn.model.SessionView;
import org.example.smartlearn.service.exception.InvalidSessionStateException;
import org.example.smartlearn.service.exception.NoQuestionsAvailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Owns the lifecycle of a learner's quiz session: start, reset and status.
 */
@Service
public class QuizSessionService {

    private static final Logger log = LoggerFactory.getLogger(QuizSessionService.class);

    private final QuizSessionRegistry sessionRegistry;
    private final QuestionCatalogService questionCatalogService;
    private final QuizMetricsService quizMetricsService;
    private final QuizProperties quizProperties;

    public QuizSessionService(
            QuizSessionRegistry sessionRegistry,
            QuestionCatalogService questionCatalogService,
            QuizMetricsService quizMetricsService,
            QuizProperties quizProperties) {
        this.sessionRegistry = sessionRegistry;
        this.questionCatalogService = questionCatalogService;
        this.quizMetricsService = quizMetricsService;
        this.quizProperties = quizProperties;
    }

    /**
     * Starts a new session with up to {@code count} randomly ordered questions. A previous session
     * must be submitted or reset first. When fewer questions exist than requested, the session holds
     * all of them and the returned view is flagged with {@code shortfall}.
     *
     * @param count requested question count, or {@code null} for the configured default
     * @throws IllegalArgumentException when the count is not positive or above the configured maximum
     * @throws InvalidSessionStateException when the learner already has an active session
     * @throws NoQuestionsAvailableException when no question matches the subject
     */
    public SessionView createSession(String studentId, String subject, Integer count) {
        String learner = requireStudentId(studentId);
        int requested = resolveQuestionCount(count);
        String subjectFilter = normalizeSubject(subject);

        return sessionRegistry.withLearner(learner, slot -> {
            QuizSession current = slot.getSession();
            if (current != null && current.getStatus() == SessionStatus.ACTIVE) {
                throw new InvalidSessionStateException(
                        SessionStatus.ACTIVE,
                        "Student " + learner + " already has an active session; reset it first");
            }

            List<QuestionView> questions = questionCatalogService.sampleRandom(subjectFilter, requested);
            if (questions.isEmpty()) {
                throw new NoQuestionsAvailableException(subjectFilter);
            }

            QuizSession session = new QuizSession(
                    UUID.randomUUID().toString(),
                    learner,
                    subjectFilter,
                    requested,
                    questions,
                    LocalDateTime.now());
            slot.replace(session);
            quizMetricsService.recordSessionCreated();

            if (questions.size() < requested) {
                log.info("Started session {} for {} with {} of {} requested questions (subject={})",
                        session.getSessionId(), learner, questions.size(), requested, subjectFilter);
            } else {
                log.info("Started session {} for {} with {} questions (subject={})",
                        session.getSessionId(), learner, questions.size(), subjectFilter);
            }
            return session.toView();
        });
    }

    /**
     * Discards the learner's session, including unsaved answers. Resetting with no session is a no-op.
     */
    public void resetSession(String studentId) {
        String learner = requireStudentId(studentId);
        sessionRegistry.withLearner(learner, slot -> {
            QuizSession current = slot.getSession();
            if (current == null) {
                return null;
            }
            slot.clear();
            quizMetricsService.recordSessionReset();
            log.info("Reset session {} for {} (was {})", current.getSessionId(), learner, current.getStatus());
            return null;
        });
    }

    public SessionView getStatus(String studentId) {
        return sessionRegistry.view(requireStudentId(studentId));
    }

    int resolveQuestionCount(Integer count) {
        QuizProperties.Session settings = quizProperties.getSession();
        if (count == null) {
            return Math.max(1, settings.getDefaultQuestionCount());
        }
        if (count <= 0) {
            throw new IllegalArgumentException("Question count must be positive");
        }
        int max = Math.max(1, settings.getMaxQuestionCount());
        if (count > max) {
            throw new IllegalArgumentException("Question count must not exceed " + max);
        }
        return count;
    }

    static String requireStudentId(String studentId) {
        if (studentId == null || studentId.isBlank()) {
            throw new IllegalArgumentException("studentId is required");
        }
        return studentId.trim();
    }

    private String normalizeSubject(String subject) {
        if (subject == null || subject.isBlank()) {
            return null;
        }
        return subject.trim();
    }
}
