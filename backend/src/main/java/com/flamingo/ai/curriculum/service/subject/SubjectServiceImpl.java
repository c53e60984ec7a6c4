package com.flamingo.ai.curriculum.service.subject;

import com.flamingo.ai.curriculum.domain.entity.Subject;
import com.flamingo.ai.curriculum.domain.repository.SubjectRepository;
import com.flamingo.ai.curriculum.exception.SubjectNotFoundException;
import com.flamingo.ai.curriculum.service.outline.model.SubjectKey;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the SubjectService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubjectServiceImpl implements SubjectService {

  private final SubjectRepository subjectRepository;

  @Override
  @Transactional
  public Subject upsert(SubjectKey key, SubjectDetails details) {
    Subject subject =
        subjectRepository
            .findByExamBoardAndQualificationAndSubjectCode(
                key.examBoard(), key.qualification(), key.subjectCode())
            .orElseGet(
                () ->
                    Subject.builder()
                        .examBoard(key.examBoard())
                        .qualification(key.qualification())
                        .subjectCode(key.subjectCode())
                        .build());
    boolean created = subject.getId() == null;

    if (details.displayName() != null && !details.displayName().isBlank()) {
      subject.setDisplayName(details.displayName().strip());
    } else if (subject.getDisplayName() == null) {
      subject.setDisplayName(key.subjectCode());
    }
    if (details.sourceUri() != null && !details.sourceUri().isBlank()) {
      subject.setSourceUri(details.sourceUri());
    }

    Subject saved = subjectRepository.saveAndFlush(subject);
    log.info("{} subject {} ({})", created ? "Created" : "Updated", key, saved.getId());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Subject getSubject(UUID subjectId) {
    return subjectRepository
        .findById(subjectId)
        .orElseThrow(() -> new SubjectNotFoundException(subjectId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Subject> listSubjects() {
    return subjectRepository.findAllByOrderByExamBoardAscQualificationAscSubjectCodeAsc();
  }
}
