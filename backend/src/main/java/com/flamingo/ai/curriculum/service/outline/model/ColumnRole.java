package com.flamingo.ai.curriculum.service.outline.model;

/** What a table column contributes to the outline. */
public enum ColumnRole {
  /** Row title; becomes a heading. */
  TITLE,
  /** Row body; each statement becomes a child of the row. */
  BODY,
  /** Never emitted. */
  IGNORED
}
