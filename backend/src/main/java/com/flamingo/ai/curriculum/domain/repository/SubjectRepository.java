package com.flamingo.ai.curriculum.domain.repository;

import com.flamingo.ai.curriculum.domain.entity.Subject;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Subject entities. */
@Repository
public interface SubjectRepository extends JpaRepository<Subject, UUID> {

  /** Finds a subject by its natural key. */
  Optional<Subject> findByExamBoardAndQualificationAndSubjectCode(
      String examBoard, String qualification, String subjectCode);

  /** Loads a subject and takes a row lock for the rest of the transaction. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT s FROM Subject s WHERE s.id = :id")
  Optional<Subject> findByIdForUpdate(@Param("id") UUID id);

  /** Lists all subjects by natural key. */
  List<Subject> findAllByOrderByExamBoardAscQualificationAscSubjectCodeAsc();
}
