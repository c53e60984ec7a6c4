package com.flamingo.ai.curriculum.service.outline.model;

/**
 * One extracted text line.
 *
 * @param pageNumber 1-based page number
 * @param text line text as extracted
 * @param top distance from the page top in PDF units, or {@link Float#NaN} when unknown
 * @param tableColumn true when the line is known to sit in a table body column
 */
public record SourceLine(int pageNumber, String text, float top, boolean tableColumn) {

  public SourceLine(int pageNumber, String text) {
    this(pageNumber, text, Float.NaN, false);
  }

  public SourceLine(int pageNumber, String text, float top) {
    this(pageNumber, text, top, false);
  }

  public boolean hasPosition() {
    return !Float.isNaN(top);
  }
}
