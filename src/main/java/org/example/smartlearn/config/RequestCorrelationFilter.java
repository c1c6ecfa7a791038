package org.example.smartlearn.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags every API request with a request id (taken from {@code X-Request-Id} when present) and,
 * for learner scoped paths, the student id, so that session and scoring log lines of one call
 * can be correlated.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String REQUEST_ID_KEY = "requestId";
    public static final String STUDENT_ID_KEY = "studentId";
    static final String UNKNOWN_REQUEST = "unknown";

    private static final int MAX_HEADER_LENGTH = 80;
    private static final Pattern LEARNER_PATH =
            Pattern.compile("^/api/(?:quiz/sessions|students)/([^/]+)(?:/.*)?$");

    private static final Logger log = LoggerFactory.getLogger(RequestCorrelationFilter.class);

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String requestId = normalizeHeader(request.getHeader(HEADER_NAME));
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        String studentId = studentIdFromPath(request.getRequestURI());

        request.setAttribute(REQUEST_ID_KEY, requestId);
        response.setHeader(HEADER_NAME, requestId);
        MDC.put(REQUEST_ID_KEY, requestId);
        if (studentId != null) {
            MDC.put(STUDENT_ID_KEY, studentId);
        }
        long startedAt = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            if (log.isDebugEnabled()) {
                log.debug("{} {} -> {} in {}ms",
                        request.getMethod(),
                        request.getRequestURI(),
                        response.getStatus(),
                        (System.nanoTime() - startedAt) / 1_000_000);
            }
            MDC.remove(REQUEST_ID_KEY);
            MDC.remove(STUDENT_ID_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    /**
     * Request id assigned by this filter, or {@value #UNKNOWN_REQUEST} when the request bypassed it.
     */
    public static String requestIdOf(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN_REQUEST;
        }
        Object requestId = request.getAttribute(REQUEST_ID_KEY);
        if (requestId instanceof String value && !value.isBlank()) {
            return value;
        }
        return UNKNOWN_REQUEST;
    }

    static String studentIdFromPath(String uri) {
        if (uri == null) {
            return null;
        }
        Matcher matcher = LEARNER_PATH.matcher(uri);
        if (!matcher.matches()) {
            return null;
        }
        String studentId = matcher.group(1);
        return studentId.isBlank() ? null : studentId;
    }

    static String normalizeHeader(String headerValue) {
        if (headerValue == null) {
            return null;
        }
        String trimmed = headerValue.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > MAX_HEADER_LENGTH ? trimmed.substring(0, MAX_HEADER_LENGTH) : trimmed;
    }
}
