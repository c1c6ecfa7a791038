package org.example.smartlearn.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.smartlearn.model.NewQuestion;
import org.example.smartlearn.model.QuestionAddResult;
import org.example.smartlearn.service.QuestionCatalogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/questions")
public class QuestionController {

    private final QuestionCatalogService questionCatalogService;

    public QuestionController(QuestionCatalogService questionCatalogService) {
        this.questionCatalogService = questionCatalogService;
    }

    @PostMapping
    public ResponseEntity<Object> addQuestion(@RequestBody NewQuestion request, HttpServletRequest httpRequest) {
        try {
            QuestionAddResult result = questionCatalogService.addQuestion(request);
            HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
            return ResponseEntity.status(status).body(result);
        } catch (IllegalArgumentException e) {
            return ApiErrors.badRequest(e.getMessage(), httpRequest);
        }
    }

    @GetMapping("/subjects")
    public List<String> listSubjects() {
        return questionCatalogService.listSubjects();
    }
}
