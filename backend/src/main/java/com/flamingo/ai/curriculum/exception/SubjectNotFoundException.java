package com.flamingo.ai.curriculum.exception;

import java.util.UUID;

/** Exception thrown when a subject is not found. */
public class SubjectNotFoundException extends RuntimeException {

  private final UUID subjectId;

  public SubjectNotFoundException(UUID subjectId) {
    super("Subject not found: " + subjectId);
    this.subjectId = subjectId;
  }

  public UUID getSubjectId() {
    return subjectId;
  }
}
