package com.flamingo.ai.curriculum.api.dto.response;

import com.flamingo.ai.curriculum.domain.entity.Subject;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for subject data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubjectResponse {

  private UUID id;
  private String examBoard;
  private String qualification;
  private String subjectCode;
  private String displayName;
  private String sourceUri;
  private int nodeCount;
  private LocalDateTime lastSyncedAt;

  /** Creates a SubjectResponse from a Subject entity. */
  public static SubjectResponse fromEntity(Subject subject) {
    return SubjectResponse.builder()
        .id(subject.getId())
        .examBoard(subject.getExamBoard())
        .qualification(subject.getQualification())
        .subjectCode(subject.getSubjectCode())
        .displayName(subject.getDisplayName())
        .sourceUri(subject.getSourceUri())
        .nodeCount(subject.getNodeCount())
        .lastSyncedAt(subject.getLastSyncedAt())
        .build();
  }
}
