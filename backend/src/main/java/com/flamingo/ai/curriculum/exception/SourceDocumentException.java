package com.flamingo.ai.curriculum.exception;

/** Exception thrown when a source document cannot be fetched or read. */
public class SourceDocumentException extends RuntimeException {

  private final String sourceUri;
  private final String userMessage;

  public SourceDocumentException(String sourceUri, String message) {
    super(message);
    this.sourceUri = sourceUri;
    this.userMessage = "Failed to read source document";
  }

  public SourceDocumentException(String sourceUri, String message, Throwable cause) {
    super(message, cause);
    this.sourceUri = sourceUri;
    this.userMessage = "Failed to read source document";
  }

  public SourceDocumentException(String sourceUri, String message, String userMessage) {
    super(message);
    this.sourceUri = sourceUri;
    this.userMessage = userMessage;
  }

  public String getSourceUri() {
    return sourceUri;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
