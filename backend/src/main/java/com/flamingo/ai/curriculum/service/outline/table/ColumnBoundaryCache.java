package com.flamingo.ai.curriculum.service.outline.table;

import java.util.Optional;

/**
 * Remembers the column layout of the last table whose header was found, for continuation pages
 * where the header does not repeat. One instance per document.
 */
public class ColumnBoundaryCache {

  private ColumnBoundaries last;
  private int sourcePage = -1;

  public void remember(ColumnBoundaries boundaries, int pageNumber) {
    this.last = boundaries;
    this.sourcePage = pageNumber;
  }

  public Optional<ColumnBoundaries> lastKnown() {
    return Optional.ofNullable(last);
  }

  /** Page the cached layout was measured on, or -1. */
  public int getSourcePage() {
    return sourcePage;
  }
}
