package org.example.smartlearn.repository;

import org.example.smartlearn.entity.AttemptEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AttemptRepository extends JpaRepository<AttemptEntity, String> {

    @Query("""
            SELECT a.studentId AS studentId,
                   COUNT(a) AS attempted,
                   SUM(CASE WHEN a.correct = true THEN 1 ELSE 0 END) AS correct
            FROM AttemptEntity a
            GROUP BY a.studentId
            """)
    List<StudentTotals> summarizeByStudent();

    @Query("""
            SELECT a.studentId AS studentId,
                   COUNT(a) AS attempted,
                   SUM(CASE WHEN a.correct = true THEN 1 ELSE 0 END) AS correct
            FROM AttemptEntity a
            WHERE a.studentId = :studentId
            GROUP BY a.studentId
            """)
    Optional<StudentTotals> summarizeForStudent(@Param("studentId") String studentId);

    interface StudentTotals {
        String getStudentId();

        Long getAttempted();

        Long getCorrect();
    }
}
