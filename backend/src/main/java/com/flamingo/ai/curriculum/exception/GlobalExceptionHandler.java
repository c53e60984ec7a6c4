package com.flamingo.ai.curriculum.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(SubjectNotFoundException.class)
  public ResponseEntity<ApiError> handleSubjectNotFound(
      SubjectNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("subject_not_found");
    String errorId = generateErrorId();
    log.warn("Subject not found [{}]: {}", errorId, ex.getSubjectId());

    return error(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.SUBJECT_NOT_FOUND,
        "Subject not found",
        null,
        request);
  }

  @ExceptionHandler(TopicNotFoundException.class)
  public ResponseEntity<ApiError> handleTopicNotFound(
      TopicNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("topic_not_found");
    String errorId = generateErrorId();
    log.warn("Topic not found [{}]: {}", errorId, ex.getTopicId());

    return error(
        HttpStatus.NOT_FOUND, errorId, ApiError.TOPIC_NOT_FOUND, "Topic not found", null, request);
  }

  @ExceptionHandler(StructuralParseException.class)
  public ResponseEntity<ApiError> handleStructuralParse(
      StructuralParseException ex, HttpServletRequest request) {

    incrementErrorCounter("outline_invalid");
    String errorId = generateErrorId();
    log.error("Outline validation failed [{}]: {}", errorId, ex.getViolations());

    return error(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.OUTLINE_INVALID,
        "The parsed outline is structurally invalid; nothing was stored",
        String.join("; ", ex.getViolations()),
        request);
  }

  @ExceptionHandler(SourceDocumentException.class)
  public ResponseEntity<ApiError> handleSourceDocument(
      SourceDocumentException ex, HttpServletRequest request) {

    incrementErrorCounter("source_unavailable");
    String errorId = generateErrorId();
    log.error("Source document error [{}] for {}: {}", errorId, ex.getSourceUri(), ex.getMessage());

    return error(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.SOURCE_UNAVAILABLE,
        ex.getUserMessage(),
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(StoreWriteException.class)
  public ResponseEntity<ApiError> handleStoreWrite(
      StoreWriteException ex, HttpServletRequest request) {

    incrementErrorCounter("store_write_failed");
    String errorId = generateErrorId();
    log.error("Store write failed [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.STORE_WRITE_FAILED,
        ex.getUserMessage(),
        null,
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return error(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Invalid argument [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), null, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        null,
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      String details,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .details(details)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
