package com.flamingo.ai.curriculum.service.source;

import com.flamingo.ai.curriculum.config.OutlineConfig;
import com.flamingo.ai.curriculum.config.OutlineConfig.ColumnSpec;
import com.flamingo.ai.curriculum.service.outline.model.ColumnRole;
import com.flamingo.ai.curriculum.service.outline.model.PositionedWord;
import com.flamingo.ai.curriculum.service.outline.model.TableRegion;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds table regions from word positions.
 *
 * <p>A page whose words contain the title column label and another configured label on the same
 * line starts a table from that header down to the bottom of the page. Following pages without a
 * header continue the table while at least two of their lines start inside the body columns
 * measured on the header page.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TableRegionLocator {

  private final OutlineConfig outlineConfig;

  public List<TableRegion> locate(List<PositionedWord> words) {
    OutlineConfig.Table table = outlineConfig.getTable();
    if (!table.isEnabled() || words.isEmpty()) {
      return List.of();
    }
    Map<Integer, List<PositionedWord>> byPage = new TreeMap<>();
    words.forEach(w -> byPage.computeIfAbsent(w.pageNumber(), p -> new ArrayList<>()).add(w));

    List<TableRegion> regions = new ArrayList<>();
    Float bodyColumnX = null;
    for (Map.Entry<Integer, List<PositionedWord>> page : byPage.entrySet()) {
      List<PositionedWord> pageWords = page.getValue();
      Optional<Header> header = findHeader(pageWords, table);
      if (header.isPresent()) {
        bodyColumnX = header.get().bodyColumnX();
        regions.add(region(page.getKey(), pageWords, header.get().top() - table.getLineTolerance()));
      } else if (bodyColumnX != null && continuesTable(pageWords, bodyColumnX, table)) {
        regions.add(region(page.getKey(), pageWords, minTop(pageWords) - 1));
      } else {
        bodyColumnX = null;
      }
    }
    log.debug("Located {} table region(s)", regions.size());
    return regions;
  }

  private Optional<Header> findHeader(List<PositionedWord> words, OutlineConfig.Table table) {
    List<ColumnSpec> columns = table.getColumns();
    Optional<ColumnSpec> title =
        columns.stream().filter(c -> c.getRole() == ColumnRole.TITLE).findFirst();
    if (title.isEmpty()) {
      return Optional.empty();
    }
    String titleKey = key(title.get().getLabel());
    for (PositionedWord candidate : words) {
      if (!titleKey.equals(key(candidate.text()))) {
        continue;
      }
      float bodyX = Float.MAX_VALUE;
      for (ColumnSpec other : columns) {
        if (other == title.get() || other.getRole() == ColumnRole.IGNORED) {
          continue;
        }
        String otherKey = key(other.getLabel());
        for (PositionedWord w : words) {
          if (otherKey.equals(key(w.text()))
              && Math.abs(w.top() - candidate.top()) <= table.getLineTolerance()
              && w.x0() > candidate.x0()) {
            bodyX = Math.min(bodyX, w.x0());
          }
        }
      }
      if (bodyX < Float.MAX_VALUE) {
        return Optional.of(new Header(candidate.top(), bodyX));
      }
    }
    return Optional.empty();
  }

  private static boolean continuesTable(
      List<PositionedWord> words, float bodyColumnX, OutlineConfig.Table table) {
    Set<Integer> bodyLines = new HashSet<>();
    for (PositionedWord w : words) {
      if (w.x0() >= bodyColumnX - table.getLineTolerance()) {
        bodyLines.add(Math.round(w.top() / Math.max(table.getLineTolerance(), 1.0f)));
      }
    }
    return bodyLines.size() >= 2;
  }

  private static TableRegion region(int page, List<PositionedWord> words, float top) {
    float x0 = (float) words.stream().mapToDouble(PositionedWord::x0).min().orElse(0) - 1;
    float x1 = (float) words.stream().mapToDouble(PositionedWord::x1).max().orElse(0) + 1;
    float bottom = (float) words.stream().mapToDouble(PositionedWord::bottom).max().orElse(0) + 1;
    return new TableRegion(page, x0, top, x1, bottom, List.of());
  }

  private static float minTop(List<PositionedWord> words) {
    return (float) words.stream().mapToDouble(PositionedWord::top).min().orElse(0);
  }

  private static String key(String text) {
    String first = text.strip().split("\\s+", 2)[0];
    return first.replaceAll("[^\\p{L}\\p{N}]", "").toLowerCase(Locale.ROOT);
  }

  private record Header(float top, float bodyColumnX) {}
}
