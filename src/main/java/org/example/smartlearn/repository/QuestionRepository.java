package org.example.smartlearn.repository;

import org.example.smartlearn.entity.QuestionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface QuestionRepository extends JpaRepository<QuestionEntity, Long> {

    @Query("SELECT q.id FROM QuestionEntity q ORDER BY q.id")
    List<Long> findAllIds();

    @Query("SELECT q.id FROM QuestionEntity q WHERE q.subject = :subject ORDER BY q.id")
    List<Long> findIdsBySubject(@Param("subject") String subject);

    Optional<QuestionEntity> findByQuestionText(String questionText);

    @Query("SELECT DISTINCT q.subject FROM QuestionEntity q WHERE q.subject IS NOT NULL ORDER BY q.subject")
    List<String> findDistinctSubjects();
}
