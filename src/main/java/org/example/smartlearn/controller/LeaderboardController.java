package org.example.smartlearn.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.smartlearn.model.LeaderboardRow;
import org.example.smartlearn.service.LeaderboardService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class LeaderboardController {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardController.class);

    private final LeaderboardService leaderboardService;

    public LeaderboardController(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<List<LeaderboardRow>> getLeaderboard(@RequestParam(defaultValue = "0") int limit) {
        try {
            return ResponseEntity.ok(leaderboardService.getLeaderboard(limit));
        } catch (RuntimeException e) {
            log.error("Failed to build leaderboard (limit={})", limit, e);
            return ResponseEntity.status(500).build();
        }
    }

    @GetMapping("/students/{studentId}/stats")
    public ResponseEntity<Object> getStudentStats(@PathVariable String studentId, HttpServletRequest httpRequest) {
        try {
            return ResponseEntity.ok(leaderboardService.getStudentStats(studentId));
        } catch (IllegalArgumentException e) {
            return ApiErrors.badRequest(e.getMessage(), httpRequest);
        }
    }
}
