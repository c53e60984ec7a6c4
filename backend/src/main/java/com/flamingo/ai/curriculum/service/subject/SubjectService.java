package com.flamingo.ai.curriculum.service.subject;

import com.flamingo.ai.curriculum.domain.entity.Subject;
import com.flamingo.ai.curriculum.service.outline.model.SubjectKey;
import java.util.List;
import java.util.UUID;

/** Service interface for subject management. */
public interface SubjectService {

  /**
   * Creates the subject for {@code key} or refreshes its details. Safe to repeat.
   *
   * @param key natural key
   * @param details display name and source URI
   * @return the persisted subject
   */
  Subject upsert(SubjectKey key, SubjectDetails details);

  /**
   * Gets a subject by ID.
   *
   * @param subjectId the subject ID
   * @return the subject
   * @throws com.flamingo.ai.curriculum.exception.SubjectNotFoundException if not found
   */
  Subject getSubject(UUID subjectId);

  /** Lists all subjects ordered by natural key. */
  List<Subject> listSubjects();
}
