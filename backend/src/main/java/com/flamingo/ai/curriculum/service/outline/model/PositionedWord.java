package com.flamingo.ai.curriculum.service.outline.model;

/** A word with its bounding box; {@code top < bottom}, y grows down the page. */
public record PositionedWord(
    String text, float x0, float x1, float top, float bottom, int pageNumber) {

  public float centerY() {
    return (top + bottom) / 2.0f;
  }
}
