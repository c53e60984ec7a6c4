package com.flamingo.ai.curriculum.service.outline.model;

import java.util.List;

/**
 * Everything the extraction collaborator hands to the outline parser.
 *
 * @param lines text lines in reading order
 * @param words positioned words; empty when only flattened text is available
 * @param tableRegions table bounding boxes; empty when none were located
 */
public record ExtractedSource(
    List<SourceLine> lines, List<PositionedWord> words, List<TableRegion> tableRegions) {

  public ExtractedSource {
    lines = List.copyOf(lines);
    words = words == null ? List.of() : List.copyOf(words);
    tableRegions = tableRegions == null ? List.of() : List.copyOf(tableRegions);
  }

  public static ExtractedSource ofLines(List<SourceLine> lines) {
    return new ExtractedSource(lines, List.of(), List.of());
  }

  public boolean hasGeometry() {
    return !words.isEmpty();
  }
}
