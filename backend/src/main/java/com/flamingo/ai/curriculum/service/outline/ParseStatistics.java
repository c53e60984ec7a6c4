package com.flamingo.ai.curriculum.service.outline;

import com.flamingo.ai.curriculum.service.outline.model.NoiseReason;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Counters collected while parsing one document. */
@Getter
@Builder
public class ParseStatistics {

  private final int lineCount;
  private final Map<NoiseReason, Integer> noiseByReason;
  private final int tablesSplit;
  private final int tablesSkipped;
  private final int tableRows;

  /** Lines split into pseudo-columns by keyword because no word geometry was available. */
  private final int keywordSplits;

  private final int droppedContinuations;

  public boolean isLowConfidenceColumns() {
    return keywordSplits > 0;
  }

  public int noiseCount(NoiseReason reason) {
    return noiseByReason.getOrDefault(reason, 0);
  }
}
