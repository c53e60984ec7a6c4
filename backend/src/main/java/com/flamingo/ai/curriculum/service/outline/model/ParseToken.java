package com.flamingo.ai.curriculum.service.outline.model;

/**
 * A classified line. Transient; never persisted.
 *
 * @param kind token kind
 * @param levelHint heading depth for {@link TokenKind#HEADING}, glyph depth (0 primary, 1
 *     secondary) for {@link TokenKind#BULLET}, otherwise 0
 * @param text title or bullet text with any marker stripped
 * @param label stable label taken from a heading (e.g. {@code 1.2.3}, {@code a}), or null
 * @param relative true for headings placed relative to the last anchored heading
 * @param noiseReason set only for {@link TokenKind#NOISE}
 */
public record ParseToken(
    TokenKind kind,
    int levelHint,
    String text,
    String label,
    boolean relative,
    NoiseReason noiseReason) {

  public static ParseToken heading(int level, String text, String label, boolean relative) {
    return new ParseToken(TokenKind.HEADING, level, text, label, relative, null);
  }

  public static ParseToken bullet(int glyphLevel, String text) {
    return new ParseToken(TokenKind.BULLET, glyphLevel, text, null, false, null);
  }

  public static ParseToken continuation(String text) {
    return new ParseToken(TokenKind.CONTINUATION, 0, text, null, false, null);
  }

  public static ParseToken noise(NoiseReason reason, String text) {
    return new ParseToken(TokenKind.NOISE, 0, text, null, false, reason);
  }

  public boolean is(TokenKind other) {
    return kind == other;
  }
}
