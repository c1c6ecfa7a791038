package org.example.smartlearn.service;

import org.example.smartlearn.entity.AttemptEntity;
import org.example.smartlearn.model.AttemptRecord;
import org.example.smartlearn.repository.AttemptRepository;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Append-only attempt history. A batch is written in a single transaction, so either every
 * row of a submission is stored or none is.
 */
@Service
public class AttemptStoreService {

    private final AttemptRepository attemptRepository;

    public AttemptStoreService(AttemptRepository attemptRepository) {
        this.attemptRepository = attemptRepository;
    }

    @Transactional
    public void appendAttempts(List<AttemptRecord> batch) {
        if (batch == null || batch.isEmpty()) {
            return;
        }
        List<AttemptEntity> entities = batch.stream()
                .map(this::toEntity)
                .toList();
        attemptRepository.saveAll(entities);
        attemptRepository.flush();
    }

    /**
     * Full attempt history, oldest first. Ranking uses the grouped totals query instead.
     */
    @Transactional(readOnly = true)
    public List<AttemptRecord> readAll() {
        return attemptRepository.findAll(Sort.by("createdAt", "id")).stream()
                .map(entity -> new AttemptRecord(
                        entity.getStudentId(),
                        entity.getQuestionId(),
                        entity.getSessionId(),
                        entity.isCorrect(),
                        entity.getCreatedAt()))
                .toList();
    }

    private AttemptEntity toEntity(AttemptRecord record) {
        AttemptEntity entity = new AttemptEntity();
        entity.setStudentId(record.studentId());
        entity.setQuestionId(record.questionId());
        entity.setSessionId(record.sessionId());
        entity.setCorrect(record.correct());
        entity.setCreatedAt(record.timestamp());
        return entity;
    }
}
