package com.flamingo.ai.curriculum.service.outline.model;

/**
 * State the classifier may consult for one line.
 *
 * @param previousHeadingLevel level of the most recent non-relative heading, or -1
 * @param inTableColumn true when the line comes from a table body column
 * @param previousText raw text of the last non-noise line, or null
 */
public record ClassificationContext(
    int previousHeadingLevel, boolean inTableColumn, String previousText) {

  public static ClassificationContext initial() {
    return new ClassificationContext(-1, false, null);
  }

  public ClassificationContext inTableColumn(boolean tableColumn) {
    return new ClassificationContext(previousHeadingLevel, tableColumn, previousText);
  }

  /** Returns the context for the line following {@code rawText}, classified as {@code token}. */
  public ClassificationContext advance(ParseToken token, String rawText) {
    if (token.is(TokenKind.NOISE)) {
      return this;
    }
    int headingLevel = previousHeadingLevel;
    if (token.is(TokenKind.HEADING) && !token.relative()) {
      headingLevel = token.levelHint();
    }
    return new ClassificationContext(headingLevel, inTableColumn, rawText);
  }
}
