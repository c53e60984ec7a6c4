package com.flamingo.ai.curriculum.exception;

import com.flamingo.ai.curriculum.service.outline.model.SubjectKey;

/** Exception thrown when replacing a subject's stored tree fails. The run must be repeated. */
public class StoreWriteException extends RuntimeException {

  private final SubjectKey subjectKey;

  public StoreWriteException(SubjectKey subjectKey, String message, Throwable cause) {
    super(message, cause);
    this.subjectKey = subjectKey;
  }

  public SubjectKey getSubjectKey() {
    return subjectKey;
  }

  public String getUserMessage() {
    return "Failed to store the outline for " + subjectKey + "; re-run the import";
  }
}
