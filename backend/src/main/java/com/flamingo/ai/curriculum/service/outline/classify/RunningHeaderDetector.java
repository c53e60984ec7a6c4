package com.flamingo.ai.curriculum.service.outline.classify;

import com.flamingo.ai.curriculum.service.outline.model.ClassificationContext;
import com.flamingo.ai.curriculum.service.outline.model.SourceLine;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds lines repeated on many pages of one document.
 *
 * <p>Digits are ignored when comparing, so "Specification page 3" and "Specification page 4" are
 * the same header. Heading- and bullet-shaped lines are never promoted since tables repeat their
 * header rows after a page break and those repeats are merged by the hierarchy builder instead.
 */
@Slf4j
public final class RunningHeaderDetector {

  private RunningHeaderDetector() {}

  /** Returns a classifier for {@code lines} that drops the detected running headers as noise. */
  public static LineClassifier classifierFor(ClassifierRules rules, List<SourceLine> lines) {
    return new LineClassifier(rules, detect(rules, lines));
  }

  static Set<String> detect(ClassifierRules rules, List<SourceLine> lines) {
    Map<String, Set<Integer>> pagesByKey = new HashMap<>();
    for (SourceLine line : lines) {
      String text = LineClassifier.normalize(line.text());
      if (!text.isEmpty()) {
        pagesByKey
            .computeIfAbsent(LineClassifier.headerKey(text), k -> new HashSet<>())
            .add(line.pageNumber());
      }
    }

    LineClassifier probe = new LineClassifier(rules);
    ClassificationContext context = ClassificationContext.initial();
    Set<String> detected = new HashSet<>();
    for (SourceLine line : lines) {
      String text = LineClassifier.normalize(line.text());
      if (text.isEmpty()) {
        continue;
      }
      String key = LineClassifier.headerKey(text);
      if (pagesByKey.get(key).size() >= rules.runningHeaderMinPages()
          && probe.matchHeading(text, context) == null
          && probe.matchBullet(text) == null) {
        detected.add(key);
      }
    }
    if (!detected.isEmpty()) {
      log.debug("Detected {} running header(s): {}", detected.size(), detected);
    }
    return detected;
  }
}
