package com.flamingo.ai.curriculum.service.outline.model;

/** Origin of an outline node. */
public enum NodeKind {
  HEADING,
  BULLET,
  /** Created for bullets that appear before any heading. */
  CONTAINER
}
