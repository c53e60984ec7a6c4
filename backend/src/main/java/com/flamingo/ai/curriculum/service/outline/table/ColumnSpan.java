package com.flamingo.ai.curriculum.service.outline.table;

import com.flamingo.ai.curriculum.service.outline.model.ColumnRole;

/** Horizontal extent of one column; {@code x0} inclusive, {@code x1} exclusive. */
public record ColumnSpan(String label, ColumnRole role, float x0, float x1) {

  public boolean containsX(float x) {
    return x >= x0 && x < x1;
  }
}
