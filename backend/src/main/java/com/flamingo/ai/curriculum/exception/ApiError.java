package com.flamingo.ai.curriculum.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String SUBJECT_NOT_FOUND = "SUBJECT_001";
  public static final String TOPIC_NOT_FOUND = "TOPIC_001";
  public static final String SOURCE_UNAVAILABLE = "SOURCE_001";
  public static final String OUTLINE_INVALID = "OUTLINE_001";
  public static final String SYNC_GUARD_ABORTED = "SYNC_001";
  public static final String STORE_WRITE_FAILED = "SYNC_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, e.g. the list of structural violations. */
  private final String details;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
