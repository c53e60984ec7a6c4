package com.flamingo.ai.curriculum.service.outline.model;

/** Classification outcome for one extracted line. */
public enum TokenKind {
  HEADING,
  BULLET,
  CONTINUATION,
  NOISE
}
