package com.flamingo.ai.curriculum.service.outline.table;

import com.flamingo.ai.curriculum.service.outline.model.SourceLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Low-confidence column split for sources that only have flattened text.
 *
 * <p>A line containing one of the configured phrases (for example "Students should") is cut at the
 * phrase: the part before it stays a free line, the phrase and everything after it is marked as
 * body-column text. Lines without a phrase pass through unchanged. No geometry is invented; rows
 * whose title and body were extracted on separate lines are not recovered.
 */
@Slf4j
public class KeywordColumnGuesser {

  private final List<String> phrases;

  public KeywordColumnGuesser(List<String> phrases) {
    this.phrases = phrases.stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
  }

  public boolean isEnabled() {
    return !phrases.isEmpty();
  }

  /** Returns the lines with keyword-split rows expanded. */
  public Guess guess(List<SourceLine> lines) {
    List<SourceLine> out = new ArrayList<>(lines.size());
    int count = 0;
    boolean inBody = false;
    for (SourceLine line : lines) {
      String text = line.text() == null ? "" : line.text();
      int at = indexOfPhrase(text);
      if (at < 0) {
        // lines after a split stay in the body column until a blank line ends the row
        boolean body = inBody && !text.isBlank();
        out.add(new SourceLine(line.pageNumber(), text, line.top(), body || line.tableColumn()));
        inBody = body;
        continue;
      }
      count++;
      String title = text.substring(0, at).strip();
      if (!title.isEmpty()) {
        out.add(new SourceLine(line.pageNumber(), title, line.top(), false));
      }
      out.add(new SourceLine(line.pageNumber(), text.substring(at).strip(), line.top(), true));
      inBody = true;
    }
    if (count > 0) {
      log.info("Split {} line(s) into pseudo-columns by keyword; column precision is reduced", count);
    }
    return new Guess(out, count);
  }

  /** Rewritten lines and how many were split. */
  public record Guess(List<SourceLine> lines, int splitCount) {}

  private int indexOfPhrase(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    int best = -1;
    for (String phrase : phrases) {
      int at = lower.indexOf(phrase);
      if (at >= 0 && (best < 0 || at < best)) {
        best = at;
      }
    }
    return best;
  }
}
