package com.flamingo.ai.curriculum.service.outline.model;

/** Vertical extent of one table row. */
public record RowBand(float top, float bottom) {

  public boolean contains(float y) {
    return y >= top && y < bottom;
  }
}
