package com.flamingo.ai.curriculum.service.sync;

/** Outcome of a tree synchronization. */
public enum SyncStatus {
  /** The stored tree was replaced. */
  SYNCED,
  /** The new tree was rejected; the stored tree is unchanged. */
  GUARD_ABORTED
}
