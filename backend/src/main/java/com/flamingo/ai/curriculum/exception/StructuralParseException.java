package com.flamingo.ai.curriculum.exception;

import java.util.List;

/** Exception thrown when a materialized outline violates a structural invariant. */
public class StructuralParseException extends RuntimeException {

  private final List<String> violations;

  public StructuralParseException(List<String> violations) {
    super("Outline failed validation: " + String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }
}
