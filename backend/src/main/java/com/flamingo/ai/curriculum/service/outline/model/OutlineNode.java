package com.flamingo.ai.curriculum.service.outline.model;

/**
 * A materialized outline element.
 *
 * @param code unique within the tree and stable across re-parses of identical input
 * @param title node title
 * @param level depth, 0 for roots
 * @param parentCode code of the parent, or null for roots
 */
public record OutlineNode(String code, String title, int level, String parentCode) {

  public boolean isRoot() {
    return parentCode == null;
  }
}
