package org.example.smartlearn.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.smartlearn.config.RequestCorrelationFilter;
import org.example.smartlearn.service.exception.AssessmentException;
import org.example.smartlearn.service.exception.IncompleteSubmissionException;
import org.example.smartlearn.service.exception.InvalidSessionStateException;
import org.example.smartlearn.service.exception.NoActiveSessionException;
import org.example.smartlearn.service.exception.NoQuestionsAvailableException;
import org.example.smartlearn.service.exception.PersistenceFailureException;
import org.example.smartlearn.service.exception.QuestionNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps assessment failures to HTTP responses with a small {@code {error, message, requestId}} body.
 */
final class ApiErrors {

    private ApiErrors() {
    }

    static ResponseEntity<Object> of(AssessmentException e, HttpServletRequest request) {
        Map<String, Object> body = body(e.getCode(), e.getMessage(), request);
        if (e instanceof IncompleteSubmissionException incomplete) {
            body.put("unansweredQuestionIds", incomplete.getUnansweredQuestionIds());
        }
        if (e instanceof InvalidSessionStateException invalid) {
            body.put("status", invalid.getStatus());
        }
        return ResponseEntity.status(statusFor(e)).body(body);
    }

    static ResponseEntity<Object> badRequest(String message, HttpServletRequest request) {
        return ResponseEntity.badRequest().body(body("bad_request", message, request));
    }

    static ResponseEntity<Object> disabled(HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(body("quiz_disabled", "Quizzes are disabled", request));
    }

    static HttpStatus statusFor(AssessmentException e) {
        if (e instanceof InvalidSessionStateException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof IncompleteSubmissionException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (e instanceof NoActiveSessionException || e instanceof NoQuestionsAvailableException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof QuestionNotFoundException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof PersistenceFailureException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static Map<String, Object> body(String code, String message, HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        body.put("requestId", RequestCorrelationFilter.requestIdOf(request));
        return body;
    }
}
