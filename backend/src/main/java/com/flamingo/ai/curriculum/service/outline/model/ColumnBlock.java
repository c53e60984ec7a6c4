package com.flamingo.ai.curriculum.service.outline.model;

import java.util.List;

/** Text lines of one retained column within one table row. */
public record ColumnBlock(String label, ColumnRole role, List<String> lines) {

  public ColumnBlock {
    lines = List.copyOf(lines);
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  public String joined() {
    return String.join(" ", lines).trim();
  }
}
