package com.flamingo.ai.curriculum.service.outline.table;

import com.flamingo.ai.curriculum.config.OutlineConfig;
import com.flamingo.ai.curriculum.config.OutlineConfig.ColumnSpec;
import com.flamingo.ai.curriculum.exception.TableBoundaryUnresolvedException;
import com.flamingo.ai.curriculum.service.outline.model.ColumnBlock;
import com.flamingo.ai.curriculum.service.outline.model.ColumnRole;
import com.flamingo.ai.curriculum.service.outline.model.PositionedWord;
import com.flamingo.ai.curriculum.service.outline.model.RowBand;
import com.flamingo.ai.curriculum.service.outline.model.TableRegion;
import com.flamingo.ai.curriculum.service.outline.model.TableRow;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits the words of one table region into rows of per-column text.
 *
 * <p>Column boundaries come from the header labels when they can be found on the page, and from
 * the last measured layout otherwise. Each column starts at the left edge of its header label.
 * Rows follow the region's own row geometry when the header was measured on this page; on
 * continuation pages row lines are unreliable, so rows are rebuilt from vertical gaps between
 * title-column lines. Words in {@link ColumnRole#IGNORED} columns are discarded before any row is
 * built.
 */
@Slf4j
public class TableColumnSplitter {

  private final OutlineConfig.Table config;

  public TableColumnSplitter(OutlineConfig.Table config) {
    this.config = config;
  }

  /**
   * Splits {@code region} into rows.
   *
   * @throws TableBoundaryUnresolvedException when the header is missing and nothing is cached
   */
  public List<TableRow> split(
      TableRegion region, List<PositionedWord> words, ColumnBoundaryCache cache) {
    List<PositionedWord> inRegion = words.stream().filter(region::contains).toList();

    Optional<HeaderMatch> header = locateHeader(region, inRegion);
    ColumnBoundaries boundaries;
    if (header.isPresent()) {
      boundaries = header.get().boundaries();
      cache.remember(boundaries, region.pageNumber());
    } else {
      boundaries =
          cache
              .lastKnown()
              .orElseThrow(() -> new TableBoundaryUnresolvedException(region.pageNumber()));
      log.debug(
          "No header on page {}, reusing columns measured on page {}",
          region.pageNumber(),
          cache.getSourcePage());
    }

    float bodyTop = header.map(HeaderMatch::bottom).orElse(region.top());
    Map<ColumnSpan, List<PositionedWord>> byColumn = new LinkedHashMap<>();
    for (ColumnSpan span : boundaries.spans()) {
      if (span.role() != ColumnRole.IGNORED) {
        byColumn.put(span, new ArrayList<>());
      }
    }
    for (PositionedWord word : inRegion) {
      if (word.top() < bodyTop) {
        continue;
      }
      boundaries
          .columnOf(word)
          .filter(byColumn::containsKey)
          .ifPresent(span -> byColumn.get(span).add(word));
    }

    List<RowBand> bands =
        header.isPresent() && region.rows().size() >= 2
            ? region.rows().stream().filter(b -> b.bottom() > bodyTop).toList()
            : bandsFromGaps(boundaries, byColumn, bodyTop, region.bottom());

    List<TableRow> rows = new ArrayList<>();
    for (RowBand band : bands) {
      List<ColumnBlock> blocks = new ArrayList<>();
      for (Map.Entry<ColumnSpan, List<PositionedWord>> column : byColumn.entrySet()) {
        List<PositionedWord> cell =
            column.getValue().stream().filter(w -> band.contains(w.centerY())).toList();
        List<String> lines = toLines(cell);
        if (!lines.isEmpty()) {
          ColumnSpan span = column.getKey();
          blocks.add(new ColumnBlock(span.label(), span.role(), lines));
        }
      }
      if (!blocks.isEmpty()) {
        rows.add(new TableRow(region.pageNumber(), band.top(), blocks));
      }
    }
    log.debug("Table on page {} split into {} row(s)", region.pageNumber(), rows.size());
    return rows;
  }

  private Optional<HeaderMatch> locateHeader(TableRegion region, List<PositionedWord> words) {
    float bandBottom = region.top() + config.getHeaderBandHeight();
    List<PositionedWord> band = words.stream().filter(w -> w.top() < bandBottom).toList();

    List<Located> located = new ArrayList<>();
    for (ColumnSpec spec : config.getColumns()) {
      String firstWord = firstWord(spec.getLabel());
      band.stream()
          .filter(w -> firstWord.equals(firstWord(w.text())))
          .min(Comparator.comparing(PositionedWord::top))
          .ifPresent(w -> located.add(new Located(spec, w)));
    }

    boolean hasTitle = located.stream().anyMatch(l -> l.spec().getRole() == ColumnRole.TITLE);
    if (!hasTitle || located.size() < 2) {
      return Optional.empty();
    }

    located.sort(Comparator.comparing(l -> l.word().x0()));
    List<ColumnSpan> spans = new ArrayList<>();
    for (int i = 0; i < located.size(); i++) {
      Located current = located.get(i);
      float x0 = i == 0 ? region.x0() : current.word().x0() - config.getLineTolerance();
      float x1 =
          i == located.size() - 1
              ? region.x1() + 1
              : located.get(i + 1).word().x0() - config.getLineTolerance();
      spans.add(new ColumnSpan(current.spec().getLabel(), current.spec().getRole(), x0, x1));
    }

    float headerBottom =
        (float) located.stream().mapToDouble(l -> l.word().bottom()).max().orElse(region.top());
    // labels that wrap onto a second header line still belong to the header
    float lastHeaderTop =
        (float) located.stream().mapToDouble(l -> l.word().top()).max().orElse(region.top());
    for (PositionedWord w : band) {
      if (w.top() <= lastHeaderTop + config.getLineTolerance()) {
        headerBottom = Math.max(headerBottom, w.bottom());
      }
    }
    return Optional.of(new HeaderMatch(new ColumnBoundaries(spans), headerBottom));
  }

  private List<RowBand> bandsFromGaps(
      ColumnBoundaries boundaries,
      Map<ColumnSpan, List<PositionedWord>> byColumn,
      float bodyTop,
      float bodyBottom) {
    List<PositionedWord> titleWords =
        boundaries.titleColumn().map(byColumn::get).orElse(List.of());
    List<Line> titleLines = groupLines(titleWords);

    List<Float> starts = new ArrayList<>();
    float previousBottom = Float.NaN;
    for (Line line : titleLines) {
      if (Float.isNaN(previousBottom) || line.top() - previousBottom > config.getRowGapThreshold()) {
        starts.add(Math.max(bodyTop, line.top() - config.getLineTolerance()));
      }
      previousBottom = line.bottom();
    }

    float end = bodyBottom + 1;
    List<RowBand> bands = new ArrayList<>();
    if (starts.isEmpty() || starts.get(0) > bodyTop) {
      // body text above the first title line continues the previous page's row
      bands.add(new RowBand(bodyTop, starts.isEmpty() ? end : starts.get(0)));
    }
    for (int i = 0; i < starts.size(); i++) {
      float bottom = i + 1 < starts.size() ? starts.get(i + 1) : end;
      if (bottom > starts.get(i)) {
        bands.add(new RowBand(starts.get(i), bottom));
      }
    }
    return bands;
  }

  private List<String> toLines(List<PositionedWord> words) {
    return groupLines(words).stream().map(Line::text).toList();
  }

  private List<Line> groupLines(List<PositionedWord> words) {
    List<PositionedWord> sorted =
        words.stream()
            .sorted(
                Comparator.comparing(PositionedWord::top).thenComparing(PositionedWord::x0))
            .toList();
    List<Line> lines = new ArrayList<>();
    List<PositionedWord> current = new ArrayList<>();
    for (PositionedWord word : sorted) {
      if (!current.isEmpty()
          && Math.abs(word.top() - current.get(0).top()) > config.getLineTolerance()) {
        lines.add(Line.of(current));
        current = new ArrayList<>();
      }
      current.add(word);
    }
    if (!current.isEmpty()) {
      lines.add(Line.of(current));
    }
    return lines;
  }

  private static String firstWord(String text) {
    String[] parts = text.strip().split("\\s+", 2);
    return parts[0].replaceAll("[^\\p{L}\\p{N}]", "").toLowerCase(Locale.ROOT);
  }

  private record Located(ColumnSpec spec, PositionedWord word) {}

  private record HeaderMatch(ColumnBoundaries boundaries, float bottom) {}

  private record Line(String text, float top, float bottom) {
    static Line of(List<PositionedWord> words) {
      List<PositionedWord> ordered =
          words.stream().sorted(Comparator.comparing(PositionedWord::x0)).toList();
      StringBuilder text = new StringBuilder();
      for (PositionedWord w : ordered) {
        if (text.length() > 0) {
          text.append(' ');
        }
        text.append(w.text());
      }
      float top = (float) words.stream().mapToDouble(PositionedWord::top).min().orElse(0);
      float bottom = (float) words.stream().mapToDouble(PositionedWord::bottom).max().orElse(0);
      return new Line(text.toString(), top, bottom);
    }
  }
}
