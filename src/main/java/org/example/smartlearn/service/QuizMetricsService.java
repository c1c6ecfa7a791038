package org.example.smartlearn.service;

import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

@Service
public class QuizMetricsService {

    private final LongAdder sessionsCreated = new LongAdder();
    private final LongAdder sessionsReset = new LongAdder();
    private final LongAdder answersRecorded = new LongAdder();
    private final LongAdder submissionsCompleted = new LongAdder();
    private final LongAdder duplicateSubmissions = new LongAdder();
    private final LongAdder incompleteSubmissions = new LongAdder();
    private final LongAdder submissionsFailed = new LongAdder();
    private final LongAdder leaderboardReads = new LongAdder();
    private final AtomicLong submissionLatencyTotalMs = new AtomicLong(0);

    public void recordSessionCreated() {
        sessionsCreated.increment();
    }

    public void recordSessionReset() {
        sessionsReset.increment();
    }

    public void recordAnswerRecorded() {
        answersRecorded.increment();
    }

    public void recordSubmissionCompleted(long durationMs) {
        submissionsCompleted.increment();
        if (durationMs > 0) {
            submissionLatencyTotalMs.addAndGet(durationMs);
        }
    }

    public void recordDuplicateSubmission() {
        duplicateSubmissions.increment();
    }

    public void recordIncompleteSubmission() {
        incompleteSubmissions.increment();
    }

    public void recordSubmissionFailed() {
        submissionsFailed.increment();
    }

    public void recordLeaderboardRead() {
        leaderboardReads.increment();
    }

    public Map<String, Object> snapshot() {
        long completed = submissionsCompleted.sum();
        long avgLatencyMs = completed == 0 ? 0 : submissionLatencyTotalMs.get() / completed;

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("sessionsCreated", sessionsCreated.sum());
        metrics.put("sessionsReset", sessionsReset.sum());
        metrics.put("answersRecorded", answersRecorded.sum());
        metrics.put("submissionsCompleted", completed);
        metrics.put("duplicateSubmissions", duplicateSubmissions.sum());
        metrics.put("incompleteSubmissions", incompleteSubmissions.sum());
        metrics.put("submissionsFailed", submissionsFailed.sum());
        metrics.put("submissionAverageLatencyMs", avgLatencyMs);
        metrics.put("leaderboardReads", leaderboardReads.sum());
        return metrics;
    }
}
