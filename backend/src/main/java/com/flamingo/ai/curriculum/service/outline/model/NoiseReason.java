package com.flamingo.ai.curriculum.service.outline.model;

/** Why a line was discarded. */
public enum NoiseReason {
  BLANK,
  BOILERPLATE,
  PAGE_NUMBER,
  RUNNING_HEADER,
  /** Recoverable: the line matched nothing and could not continue anything. */
  UNCLASSIFIED
}
