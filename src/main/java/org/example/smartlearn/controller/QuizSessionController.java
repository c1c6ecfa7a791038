package org.example.smartlearn.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.smartlearn.model.SessionView;
import org.example.smartlearn.model.SubmissionResult;
import org.example.smartlearn.service.AnswerCollectorService;
import org.example.smartlearn.service.QuizMetricsService;
import org.example.smartlearn.service.QuizSessionService;
import org.example.smartlearn.service.ScoringService;
import org.example.smartlearn.service.exception.AssessmentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/quiz")
public class QuizSessionController {

    private static final Logger log = LoggerFactory.getLogger(QuizSessionController.class);

    @Value("${quiz.enabled:true}")
    private boolean quizEnabled;

    @Value("${quiz.session.default-question-count:5}")
    private int defaultQuestionCount;

    @Value("${quiz.session.max-question-count:50}")
    private int maxQuestionCount;

    private final QuizSessionService quizSessionService;
    private final AnswerCollectorService answerCollectorService;
    private final ScoringService scoringService;
    private final QuizMetricsService quizMetricsService;

    public QuizSessionController(
            QuizSessionService quizSessionService,
            AnswerCollectorService answerCollectorService,
            ScoringService scoringService,
            QuizMetricsService quizMetricsService) {
        this.quizSessionService = quizSessionService;
        this.answerCollectorService = answerCollectorService;
        this.scoringService = scoringService;
        this.quizMetricsService = quizMetricsService;
    }

    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("enabled", quizEnabled);
        status.put("defaultQuestionCount", defaultQuestionCount);
        status.put("maxQuestionCount", maxQuestionCount);
        status.put("metrics", quizMetricsService.snapshot());
        return status;
    }

    @PostMapping("/sessions/{studentId}")
    public ResponseEntity<Object> createSession(
            @PathVariable String studentId,
            @RequestBody(required = false) StartSessionRequest request,
            HttpServletRequest httpRequest) {
        if (!quizEnabled) {
            return ApiErrors.disabled(httpRequest);
        }
        String subject = request == null ? null : request.subject();
        Integer count = request == null ? null : request.count();
        try {
            SessionView view = quizSessionService.createSession(studentId, subject, count);
            return ResponseEntity.status(HttpStatus.CREATED).body(view);
        } catch (AssessmentException e) {
            log.info("Session start rejected for {}: {}", studentId, e.getMessage());
            return ApiErrors.of(e, httpRequest);
        } catch (IllegalArgumentException e) {
            return ApiErrors.badRequest(e.getMessage(), httpRequest);
        }
    }

    @GetMapping("/sessions/{studentId}")
    public ResponseEntity<Object> getSession(@PathVariable String studentId, HttpServletRequest httpRequest) {
        if (!quizEnabled) {
            return ApiErrors.disabled(httpRequest);
        }
        try {
            return ResponseEntity.ok(quizSessionService.getStatus(studentId));
        } catch (IllegalArgumentException e) {
            return ApiErrors.badRequest(e.getMessage(), httpRequest);
        }
    }

    @PutMapping("/sessions/{studentId}/answers/{questionId}")
    public ResponseEntity<Object> setAnswer(
            @PathVariable String studentId,
            @PathVariable Long questionId,
            @RequestBody AnswerRequest request,
            HttpServletRequest httpRequest) {
        if (!quizEnabled) {
            return ApiErrors.disabled(httpRequest);
        }
        if (request == null) {
            return ApiErrors.badRequest("Answer body is required", httpRequest);
        }
        try {
            return ResponseEntity.ok(answerCollectorService.setAnswer(studentId, questionId, request.answer()));
        } catch (AssessmentException e) {
            return ApiErrors.of(e, httpRequest);
        } catch (IllegalArgumentException e) {
            return ApiErrors.badRequest(e.getMessage(), httpRequest);
        }
    }

    @PostMapping("/sessions/{studentId}/submit")
    public ResponseEntity<Object> submit(@PathVariable String studentId, HttpServletRequest httpRequest) {
        if (!quizEnabled) {
            return ApiErrors.disabled(httpRequest);
        }
        try {
            SubmissionResult result = scoringService.submit(studentId);
            return ResponseEntity.ok(result);
        } catch (AssessmentException e) {
            return ApiErrors.of(e, httpRequest);
        } catch (IllegalArgumentException e) {
            return ApiErrors.badRequest(e.getMessage(), httpRequest);
        }
    }

    @DeleteMapping("/sessions/{studentId}")
    public ResponseEntity<Object> resetSession(@PathVariable String studentId, HttpServletRequest httpRequest) {
        if (!quizEnabled) {
            return ApiErrors.disabled(httpRequest);
        }
        try {
            quizSessionService.resetSession(studentId);
            return ResponseEntity.noContent().build();
        } catch (IllegalArgumentException e) {
            return ApiErrors.badRequest(e.getMessage(), httpRequest);
        }
    }

    public record StartSessionRequest(String subject, Integer count) {
    }

    public record AnswerRequest(String answer) {
    }
}
