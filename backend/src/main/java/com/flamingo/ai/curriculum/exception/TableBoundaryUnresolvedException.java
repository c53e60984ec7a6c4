package com.flamingo.ai.curriculum.exception;

/**
 * Thrown when neither header labels nor cached boundaries locate a table's columns. Callers skip
 * the table and continue.
 */
public class TableBoundaryUnresolvedException extends RuntimeException {

  private final int pageNumber;

  public TableBoundaryUnresolvedException(int pageNumber) {
    super("No column boundaries for table on page " + pageNumber);
    this.pageNumber = pageNumber;
  }

  public int getPageNumber() {
    return pageNumber;
  }
}
