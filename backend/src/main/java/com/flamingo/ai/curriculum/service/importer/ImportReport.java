package com.flamingo.ai.curriculum.service.importer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.SortedMap;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;

/** What an import did, for the CLI summary and the REST response. */
@Getter
@Builder
public class ImportReport {

  private final String subject;
  private final UUID subjectId;
  private final ImportStatus status;

  /** Parsed node count per level; empty when parsing did not complete. */
  private final SortedMap<Integer, Long> levelCounts;

  private final int nodeCount;
  private final int persisted;
  private final int deleted;
  private final int tablesSkipped;
  private final boolean lowConfidenceColumns;

  /** Abort or failure reason, or a short summary. */
  private final String message;

  /** Cause of a {@link ImportStatus#FAILED} import. */
  @JsonIgnore private final RuntimeException failure;

  public boolean isSuccessful() {
    return status == ImportStatus.SYNCED || status == ImportStatus.DRY_RUN;
  }
}
