package com.flamingo.ai.curriculum.service.outline.model;

import java.util.Locale;
import java.util.Objects;

/** Natural key of a subject: exam board, qualification and subject code. */
public record SubjectKey(String examBoard, String qualification, String subjectCode) {

  public SubjectKey {
    examBoard = normalize(examBoard, "examBoard");
    qualification = normalize(qualification, "qualification");
    subjectCode = normalize(subjectCode, "subjectCode");
  }

  private static String normalize(String value, String name) {
    Objects.requireNonNull(value, name + " is required");
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return trimmed.toUpperCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return examBoard + "/" + qualification + "/" + subjectCode;
  }
}
