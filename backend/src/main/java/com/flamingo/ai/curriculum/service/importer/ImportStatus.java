package com.flamingo.ai.curriculum.service.importer;

/** Outcome of importing one subject. */
public enum ImportStatus {
  SYNCED,
  DRY_RUN,
  GUARD_ABORTED,
  FAILED
}
