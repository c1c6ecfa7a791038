package org.example.smartlearn.service;

import org.example.smartlearn.model.AnswerLetter;
import org.example.smartlearn.model.AttemptRecord;
import org.example.smartlearn.model.FeedbackTier;
import org.example.smartlearn.model.QuestionView;
import org.example.smartlearn.model.SessionStatus;
import org.example.smartlearn.model.SubmissionResult;
import org.example.smartlearn.service.exception.IncompleteSubmissionException;
import org.example.smartlearn.service.exception.NoActiveSessionException;
import org.example.smartlearn.service.exception.PersistenceFailureException;
import org.example.smartlearn.service.exception.QuestionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScoringServiceTest {

    @Mock
    private QuestionCatalogService questionCatalogService;

    @Mock
    private AttemptStoreService attemptStoreService;

    @Captor
    private ArgumentCaptor<List<AttemptRecord>> batchCaptor;

    private QuizSessionRegistry sessionRegistry;
    private AnswerCollectorService answerCollectorService;
    private QuizMetricsService quizMetricsService;
    private ScoringService scoringService;

    @BeforeEach
    void setUp() {
        sessionRegistry = new QuizSessionRegistry();
        quizMetricsService = new QuizMetricsService();
        answerCollectorService = new AnswerCollectorService(sessionRegistry, quizMetricsService);
        scoringService = new ScoringService(
                sessionRegistry, questionCatalogService, attemptStoreService, quizMetricsService);
    }

    @Test
    void submit_fourOfFiveCorrect_isNearPerfect() {
        startSession("student-1", 1, 2, 3, 4, 5);
        for (long id = 1; id <= 5; id++) {
            when(questionCatalogService.getCanonicalAnswer(id)).thenReturn(id == 5 ? "B" : "A");
            answerCollectorService.setAnswer("student-1", id, AnswerLetter.A);
        }

        SubmissionResult result = scoringService.submit("student-1");

        assertEquals(4, result.correct());
        assertEquals(5, result.total());
        assertEquals(80.0, result.accuracy());
        assertEquals(40, result.xp());
        assertEquals(FeedbackTier.NEAR_PERFECT, result.tier());
        assertEquals(SessionStatus.SUBMITTED, sessionRegistry.view("student-1").status());

        verify(attemptStoreService).appendAttempts(batchCaptor.capture());
        List<AttemptRecord> batch = batchCaptor.getValue();
        assertEquals(5, batch.size());
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), batch.stream().map(AttemptRecord::questionId).toList());
        assertEquals(4, batch.stream().filter(AttemptRecord::correct).count());
        assertTrue(batch.stream().allMatch(record -> "student-1".equals(record.studentId())));
        assertTrue(batch.stream().allMatch(record -> result.sessionId().equals(record.sessionId())));
    }

    @Test
    void submit_singleCorrectAnswer_isPerfect() {
        startSession("student-1", 42);
        when(questionCatalogService.getCanonicalAnswer(42L)).thenReturn("C");
        answerCollectorService.setAnswer("student-1", 42L, AnswerLetter.C);

        SubmissionResult result = scoringService.submit("student-1");

        assertEquals(1, result.correct());
        assertEquals(1, result.total());
        assertEquals(100.0, result.accuracy());
        assertEquals(10, result.xp());
        assertEquals(FeedbackTier.PERFECT, result.tier());
    }

    @Test
    void submit_comparesCanonicalAnswerIgnoringCase() {
        startSession("student-1", 1);
        when(questionCatalogService.getCanonicalAnswer(1L)).thenReturn("d");
        answerCollectorService.setAnswer("student-1", 1L, "D");

        SubmissionResult result = scoringService.submit("student-1");

        assertEquals(1, result.correct());
        assertTrue(result.results().get(0).correct());
    }

    @Test
    void submit_withUnansweredQuestions_failsAndWritesNothing() {
        startSession("student-1", 1, 2, 3, 4, 5);
        answerCollectorService.setAnswer("student-1", 1L, AnswerLetter.A);
        answerCollectorService.setAnswer("student-1", 2L, AnswerLetter.B);
        answerCollectorService.setAnswer("student-1", 4L, AnswerLetter.C);

        IncompleteSubmissionException error = assertThrows(IncompleteSubmissionException.class,
                () -> scoringService.submit("student-1"));

        assertEquals(List.of(3L, 5L), error.getUnansweredQuestionIds());
        assertEquals(SessionStatus.ACTIVE, sessionRegistry.view("student-1").status());
        verifyNoInteractions(attemptStoreService);
        verifyNoInteractions(questionCatalogService);
        assertEquals(1L, quizMetricsService.snapshot().get("incompleteSubmissions"));
    }

    @Test
    void submit_withoutSession_failsWithNoActiveSession() {
        assertThrows(NoActiveSessionException.class, () -> scoringService.submit("student-1"));
        verifyNoInteractions(attemptStoreService);
    }

    @Test
    void submit_twice_returnsMemoizedResultAndWritesOnce() {
        startSession("student-1", 1, 2);
        when(questionCatalogService.getCanonicalAnswer(1L)).thenReturn("A");
        when(questionCatalogService.getCanonicalAnswer(2L)).thenReturn("B");
        answerCollectorService.setAnswer("student-1", 1L, AnswerLetter.A);
        answerCollectorService.setAnswer("student-1", 2L, AnswerLetter.A);

        SubmissionResult first = scoringService.submit("student-1");
        SubmissionResult second = scoringService.submit("student-1");

        assertSame(first, second);
        verify(attemptStoreService, times(1)).appendAttempts(anyList());
        verify(questionCatalogService, times(1)).getCanonicalAnswer(1L);
        assertEquals(1L, quizMetricsService.snapshot().get("duplicateSubmissions"));
    }

    @Test
    void submit_missingCanonicalAnswer_abortsAndKeepsSessionActive() {
        startSession("student-1", 1, 2);
        when(questionCatalogService.getCanonicalAnswer(1L)).thenReturn("A");
        when(questionCatalogService.getCanonicalAnswer(2L))
                .thenThrow(new QuestionNotFoundException(2L))
                .thenReturn("B");
        answerCollectorService.setAnswer("student-1", 1L, AnswerLetter.A);
        answerCollectorService.setAnswer("student-1", 2L, AnswerLetter.B);

        assertThrows(QuestionNotFoundException.class, () -> scoringService.submit("student-1"));

        assertEquals(SessionStatus.ACTIVE, sessionRegistry.view("student-1").status());
        assertNull(sessionRegistry.view("student-1").result());
        verify(attemptStoreService, never()).appendAttempts(anyList());

        SubmissionResult retried = scoringService.submit("student-1");
        assertEquals(2, retried.correct());
        verify(attemptStoreService, times(1)).appendAttempts(anyList());
    }

    @Test
    void submit_persistenceFailure_surfacesOnceAndAllowsRetry() {
        startSession("student-1", 1);
        when(questionCatalogService.getCanonicalAnswer(1L)).thenReturn("A");
        answerCollectorService.setAnswer("student-1", 1L, AnswerLetter.A);
        doThrow(new DataAccessResourceFailureException("connection lost"))
                .doNothing()
                .when(attemptStoreService).appendAttempts(anyList());

        PersistenceFailureException error = assertThrows(PersistenceFailureException.class,
                () -> scoringService.submit("student-1"));

        assertTrue(error.getCause() instanceof DataAccessResourceFailureException);
        assertEquals(SessionStatus.ACTIVE, sessionRegistry.view("student-1").status());
        verify(attemptStoreService, times(1)).appendAttempts(anyList());

        SubmissionResult retried = scoringService.submit("student-1");
        assertEquals(FeedbackTier.PERFECT, retried.tier());
        verify(attemptStoreService, times(2)).appendAttempts(anyList());
        assertEquals(1L, quizMetricsService.snapshot().get("submissionsFailed"));
    }

    @Test
    void submit_resultDoesNotDependOnAnswerOrder() {
        startSession("student-1", 1, 2, 3);
        startSession("student-2", 1, 2, 3);
        when(questionCatalogService.getCanonicalAnswer(anyLong())).thenReturn("B");

        answerCollectorService.setAnswer("student-1", 1L, AnswerLetter.B);
        answerCollectorService.setAnswer("student-1", 2L, AnswerLetter.C);
        answerCollectorService.setAnswer("student-1", 3L, AnswerLetter.B);

        answerCollectorService.setAnswer("student-2", 3L, AnswerLetter.B);
        answerCollectorService.setAnswer("student-2", 2L, AnswerLetter.C);
        answerCollectorService.setAnswer("student-2", 1L, AnswerLetter.B);

        SubmissionResult first = scoringService.submit("student-1");
        SubmissionResult second = scoringService.submit("student-2");

        assertEquals(first.correct(), second.correct());
        assertEquals(first.accuracy(), second.accuracy());
        assertEquals(first.tier(), second.tier());
        assertEquals(first.results().stream().map(SubmissionResult.QuestionOutcome::correct).toList(),
                second.results().stream().map(SubmissionResult.QuestionOutcome::correct).toList());
    }

    @Test
    void submit_concurrentCallsForSameLearner_writeSingleBatch() throws Exception {
        startSession("student-1", 1, 2, 3);
        when(questionCatalogService.getCanonicalAnswer(anyLong())).thenReturn("A");
        for (long id = 1; id <= 3; id++) {
            answerCollectorService.setAnswer("student-1", id, AnswerLetter.A);
        }

        CountDownLatch start = new CountDownLatch(1);
        Callable<SubmissionResult> submitTask = () -> {
            start.await();
            return scoringService.submit("student-1");
        };
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<SubmissionResult>> futures = List.of(
                    executor.submit(submitTask),
                    executor.submit(submitTask),
                    executor.submit(submitTask),
                    executor.submit(submitTask));
            start.countDown();

            SubmissionResult expected = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<SubmissionResult> future : futures) {
                assertSame(expected, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        verify(attemptStoreService, times(1)).appendAttempts(anyList());
    }

    private void startSession(String studentId, long... questionIds) {
        List<QuestionView> questions = LongStream.of(questionIds)
                .mapToObj(id -> new QuestionView(id, "Question " + id, List.of("a", "b", "c", "d"),
                        null, null, null, null))
                .toList();
        sessionRegistry.withLearner(studentId, slot -> {
            slot.replace(new QuizSession("session-" + studentId, studentId, null, questions.size(),
                    questions, LocalDateTime.now()));
            return null;
        });
    }
}
