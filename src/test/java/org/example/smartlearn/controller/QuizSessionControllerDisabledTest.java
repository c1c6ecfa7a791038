package org.example.smartlearn.controller;

import org.example.smartlearn.service.AnswerCollectorService;
import org.example.smartlearn.service.QuizMetricsService;
import org.example.smartlearn.service.QuizSessionService;
import org.example.smartlearn.service.ScoringService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QuizSessionController.class)
@TestPropertySource(properties = {
        "quiz.enabled=false"
})
class QuizSessionControllerDisabledTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private QuizSessionService quizSessionService;

    @MockitoBean
    private AnswerCollectorService answerCollectorService;

    @MockitoBean
    private ScoringService scoringService;

    @MockitoBean
    private QuizMetricsService quizMetricsService;

    @Test
    void createSession_whenDisabled_returnsForbidden() throws Exception {
        mockMvc.perform(post("/api/quiz/sessions/alice"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error", is("quiz_disabled")));

        verifyNoInteractions(quizSessionService);
    }

    @Test
    void submit_whenDisabled_returnsForbidden() throws Exception {
        mockMvc.perform(post("/api/quiz/sessions/alice/submit"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(scoringService);
    }
}
