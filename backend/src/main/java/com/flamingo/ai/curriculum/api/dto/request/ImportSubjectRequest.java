package com.flamingo.ai.curriculum.api.dto.request;

import com.flamingo.ai.curriculum.service.importer.ImportRequest;
import com.flamingo.ai.curriculum.service.outline.model.SubjectKey;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for importing one subject. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportSubjectRequest {

  @NotBlank(message = "Exam board is required")
  @Size(max = 64, message = "Exam board must be at most 64 characters")
  private String examBoard;

  @NotBlank(message = "Qualification is required")
  @Size(max = 64, message = "Qualification must be at most 64 characters")
  private String qualification;

  @NotBlank(message = "Subject code is required")
  @Size(max = 64, message = "Subject code must be at most 64 characters")
  private String subjectCode;

  @Size(max = 255, message = "Display name must be at most 255 characters")
  private String displayName;

  @NotBlank(message = "Source URI is required")
  private String sourceUri;

  private boolean dryRun;

  /** Converts to the service-level request. */
  public ImportRequest toImportRequest() {
    return new ImportRequest(
        new SubjectKey(examBoard, qualification, subjectCode), displayName, sourceUri, dryRun);
  }
}
