package org.example.smartlearn.service;

import org.example.smartlearn.model.LeaderboardRow;
import org.example.smartlearn.model.StudentStats;
import org.example.smartlearn.repository.AttemptRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks learners over the whole attempt history. Reads never touch session state and reflect
 * whatever submissions were committed when the query ran.
 */
@Service
public class LeaderboardService {

    static final Comparator<Standing> RANKING = Comparator
            .comparingLong(Standing::xp).reversed()
            .thenComparing(Comparator.comparingDouble(Standing::accuracy).reversed())
            .thenComparing(Standing::studentId);

    private final AttemptRepository attemptRepository;
    private final QuizMetricsService quizMetricsService;

    public LeaderboardService(AttemptRepository attemptRepository, QuizMetricsService quizMetricsService) {
        this.attemptRepository = attemptRepository;
        this.quizMetricsService = quizMetricsService;
    }

    /**
     * Full standings ordered by xp, then accuracy (both descending), then student id.
     */
    @Transactional(readOnly = true)
    public List<LeaderboardRow> aggregate() {
        quizMetricsService.recordLeaderboardRead();
        List<Standing> standings = attemptRepository.summarizeByStudent().stream()
                .map(Standing::from)
                .filter(standing -> standing.attempted() > 0)
                .sorted(RANKING)
                .toList();

        List<LeaderboardRow> rows = new ArrayList<>(standings.size());
        for (int i = 0; i < standings.size(); i++) {
            Standing standing = standings.get(i);
            rows.add(new LeaderboardRow(
                    i + 1,
                    standing.studentId(),
                    standing.attempted(),
                    standing.correct(),
                    standing.xp(),
                    standing.accuracy()));
        }
        return rows;
    }

    @Transactional(readOnly = true)
    public List<LeaderboardRow> getLeaderboard(int limit) {
        List<LeaderboardRow> rows = aggregate();
        if (limit <= 0 || limit >= rows.size()) {
            return rows;
        }
        return rows.subList(0, limit);
    }

    @Transactional(readOnly = true)
    public StudentStats getStudentStats(String studentId) {
        String learner = QuizSessionService.requireStudentId(studentId);
        return attemptRepository.summarizeForStudent(learner)
                .map(Standing::from)
                .map(standing -> new StudentStats(
                        learner,
                        standing.attempted(),
                        standing.correct(),
                        standing.xp(),
                        standing.accuracy()))
                .orElseGet(() -> new StudentStats(learner, 0, 0, 0, 0.0));
    }

    record Standing(String studentId, long attempted, long correct, long xp, double accuracy) {

        static Standing from(AttemptRepository.StudentTotals totals) {
            long attempted = totals.getAttempted() == null ? 0 : totals.getAttempted();
            long correct = totals.getCorrect() == null ? 0 : totals.getCorrect();
            return new Standing(
                    totals.getStudentId(),
                    attempted,
                    correct,
                    ScoreCalculator.xp(correct),
                    ScoreCalculator.accuracy(correct, attempted));
        }
    }
}
