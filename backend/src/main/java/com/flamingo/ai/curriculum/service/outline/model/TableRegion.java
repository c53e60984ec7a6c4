package com.flamingo.ai.curriculum.service.outline.model;

import java.util.List;

/**
 * A table's bounding box on one page.
 *
 * @param rows row geometry reported by the extractor; empty when unknown
 */
public record TableRegion(
    int pageNumber, float x0, float top, float x1, float bottom, List<RowBand> rows) {

  public TableRegion {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }

  public boolean containsY(float y) {
    return y >= top && y <= bottom;
  }

  public boolean contains(PositionedWord word) {
    return word.pageNumber() == pageNumber
        && word.x0() >= x0
        && word.x1() <= x1
        && word.top() >= top
        && word.bottom() <= bottom;
  }
}
