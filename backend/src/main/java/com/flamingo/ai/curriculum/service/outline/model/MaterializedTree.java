package com.flamingo.ai.curriculum.service.outline.model;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/** Validated outline nodes in pre-order (every parent precedes its children). */
public record MaterializedTree(List<OutlineNode> nodes) {

  public MaterializedTree {
    nodes = List.copyOf(nodes);
  }

  public static MaterializedTree empty() {
    return new MaterializedTree(List.of());
  }

  public int size() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  /** Node count per level, ascending by level. */
  public SortedMap<Integer, Long> levelCounts() {
    Map<Integer, Long> counts =
        nodes.stream().collect(Collectors.groupingBy(OutlineNode::level, Collectors.counting()));
    return new TreeMap<>(counts);
  }
}
