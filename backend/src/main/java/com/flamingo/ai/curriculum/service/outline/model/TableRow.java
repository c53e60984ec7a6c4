package com.flamingo.ai.curriculum.service.outline.model;

import java.util.List;
import java.util.Optional;

/** One table row, split into its retained columns in reading order. */
public record TableRow(int pageNumber, float top, List<ColumnBlock> columns) {

  public TableRow {
    columns = List.copyOf(columns);
  }

  public Optional<ColumnBlock> title() {
    return columns.stream().filter(c -> c.role() == ColumnRole.TITLE).findFirst();
  }

  public List<ColumnBlock> bodies() {
    return columns.stream().filter(c -> c.role() == ColumnRole.BODY).toList();
  }
}
