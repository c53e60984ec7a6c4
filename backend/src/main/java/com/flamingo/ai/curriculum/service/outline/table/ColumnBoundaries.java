package com.flamingo.ai.curriculum.service.outline.table;

import com.flamingo.ai.curriculum.service.outline.model.ColumnRole;
import com.flamingo.ai.curriculum.service.outline.model.PositionedWord;
import java.util.List;
import java.util.Optional;

/** Column spans of one table layout, left to right. */
public record ColumnBoundaries(List<ColumnSpan> spans) {

  public ColumnBoundaries {
    spans = List.copyOf(spans);
  }

  /** Column whose span contains the word's horizontal center. */
  public Optional<ColumnSpan> columnOf(PositionedWord word) {
    float center = (word.x0() + word.x1()) / 2.0f;
    return spans.stream().filter(s -> s.containsX(center)).findFirst();
  }

  public Optional<ColumnSpan> titleColumn() {
    return spans.stream().filter(s -> s.role() == ColumnRole.TITLE).findFirst();
  }
}
