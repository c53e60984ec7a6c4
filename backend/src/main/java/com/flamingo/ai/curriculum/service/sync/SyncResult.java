package com.flamingo.ai.curriculum.service.sync;

import java.util.UUID;

/**
 * Result of {@link TopicTreeSynchronizer#sync}.
 *
 * @param persisted nodes inserted; 0 when aborted
 * @param deleted nodes removed from the previous tree
 * @param linked parent references written by the relink pass
 * @param message abort reason, or a short summary
 */
public record SyncResult(
    SyncStatus status, UUID subjectId, int persisted, int deleted, int linked, String message) {

  static SyncResult synced(UUID subjectId, TopicTreeWriter.ReplaceSummary summary) {
    return new SyncResult(
        SyncStatus.SYNCED,
        subjectId,
        summary.inserted(),
        summary.deleted(),
        summary.linked(),
        "Replaced " + summary.deleted() + " node(s) with " + summary.inserted());
  }

  static SyncResult guardAborted(UUID subjectId, String reason) {
    return new SyncResult(SyncStatus.GUARD_ABORTED, subjectId, 0, 0, 0, reason);
  }

  public boolean isSynced() {
    return status == SyncStatus.SYNCED;
  }
}
