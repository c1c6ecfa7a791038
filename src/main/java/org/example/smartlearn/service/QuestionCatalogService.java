package org.example.smartlearn.service;

import org.example.smartlearn.entity.QuestionEntity;
import org.example.smartlearn.model.AnswerLetter;
import org.example.smartlearn.model.NewQuestion;
import org.example.smartlearn.model.QuestionAddResult;
import org.example.smartlearn.model.QuestionView;
import org.example.smartlearn.repository.QuestionRepository;
import org.example.smartlearn.service.exception.QuestionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class QuestionCatalogService {

    private static final Logger log = LoggerFactory.getLogger(QuestionCatalogService.class);

    private final QuestionRepository questionRepository;
    private final Random random;

    public QuestionCatalogService(QuestionRepository questionRepository, Random questionSamplingRandom) {
        this.questionRepository = questionRepository;
        this.random = questionSamplingRandom;
    }

    /**
     * Picks up to {@code count} distinct questions in random order, optionally restricted to one subject.
     */
    @Transactional(readOnly = true)
    public List<QuestionView> sampleRandom(String subject, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Question count must be positive");
        }
        List<Long> candidates = subject == null
                ? questionRepository.findAllIds()
                : questionRepository.findIdsBySubject(subject);
        List<Long> picked = shuffleAndTake(candidates, count, random);
        if (picked.isEmpty()) {
            return List.of();
        }

        Map<Long, QuestionEntity> byId = questionRepository.findAllById(picked).stream()
                .collect(Collectors.toMap(QuestionEntity::getId, Function.identity()));
        return picked.stream()
                .map(byId::get)
                .filter(Objects::nonNull)
                .map(this::toView)
                .toList();
    }

    /**
     * Returns the upper-cased first character of the stored answer, read fresh on every call.
     */
    @Transactional(readOnly = true)
    public String getCanonicalAnswer(Long questionId) {
        String answer = questionRepository.findById(questionId)
                .map(QuestionEntity::getAnswer)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .orElseThrow(() -> new QuestionNotFoundException(questionId));
        return answer.substring(0, 1).toUpperCase(Locale.ROOT);
    }

    /**
     * Stores a question unless one with the same text already exists (insert-or-ignore).
     */
    public QuestionAddResult addQuestion(NewQuestion request) {
        if (request == null) {
            throw new IllegalArgumentException("Question is required");
        }
        String text = requireText(request.question(), "question");
        AnswerLetter answer = AnswerLetter.parse(request.answer());
        if (answer == null) {
            throw new IllegalArgumentException("answer is required");
        }

        var existing = questionRepository.findByQuestionText(text);
        if (existing.isPresent()) {
            log.debug("Ignoring duplicate question {}", existing.get().getId());
            return new QuestionAddResult(existing.get().getId(), false);
        }

        QuestionEntity entity = new QuestionEntity(
                text,
                requireText(request.optionA(), "optionA"),
                requireText(request.optionB(), "optionB"),
                requireText(request.optionC(), "optionC"),
                requireText(request.optionD(), "optionD"),
                answer.name()
        );
        entity.setSubject(trimToNull(request.subject()));
        entity.setChapter(trimToNull(request.chapter()));
        entity.setTopic(trimToNull(request.topic()));
        entity.setDifficulty(trimToNull(request.difficulty()));
        entity.setType(trimToNull(request.type()));

        try {
            QuestionEntity saved = questionRepository.saveAndFlush(entity);
            return new QuestionAddResult(saved.getId(), true);
        } catch (DataIntegrityViolationException e) {
            log.debug("Question text already stored by a concurrent insert", e);
            Long existingId = questionRepository.findByQuestionText(text)
                    .map(QuestionEntity::getId)
                    .orElseThrow(() -> e);
            return new QuestionAddResult(existingId, false);
        }
    }

    @Transactional(readOnly = true)
    public List<String> listSubjects() {
        return questionRepository.findDistinctSubjects();
    }

    /**
     * Partial Fisher-Yates shuffle: uniform sample without replacement, in random order.
     * Candidates are sorted first so a seeded {@link Random} always yields the same pick.
     */
    static <T extends Comparable<T>> List<T> shuffleAndTake(List<T> candidates, int count, Random random) {
        List<T> pool = new ArrayList<>(candidates);
        Collections.sort(pool);
        int take = Math.min(count, pool.size());
        for (int i = 0; i < take; i++) {
            int j = i + random.nextInt(pool.size() - i);
            Collections.swap(pool, i, j);
        }
        return List.copyOf(pool.subList(0, take));
    }

    private QuestionView toView(QuestionEntity entity) {
        return new QuestionView(
                entity.getId(),
                entity.getQuestionText(),
                List.of(entity.getOptionA(), entity.getOptionB(), entity.getOptionC(), entity.getOptionD()),
                entity.getSubject(),
                entity.getChapter(),
                entity.getTopic(),
                entity.getDifficulty()
        );
    }

    private String requireText(String value, String field) {
        String trimmed = trimToNull(value);
        if (trimmed == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return trimmed;
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
