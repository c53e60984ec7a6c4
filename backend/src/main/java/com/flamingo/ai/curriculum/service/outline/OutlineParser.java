package com.flamingo.ai.curriculum.service.outline;

import com.flamingo.ai.curriculum.config.OutlineConfig;
import com.flamingo.ai.curriculum.exception.TableBoundaryUnresolvedException;
import com.flamingo.ai.curriculum.service.outline.build.HierarchyBuilder;
import com.flamingo.ai.curriculum.service.outline.classify.ClassifierRules;
import com.flamingo.ai.curriculum.service.outline.classify.LineClassifier;
import com.flamingo.ai.curriculum.service.outline.classify.RunningHeaderDetector;
import com.flamingo.ai.curriculum.service.outline.materialize.TreeMaterializer;
import com.flamingo.ai.curriculum.service.outline.model.ClassificationContext;
import com.flamingo.ai.curriculum.service.outline.model.ColumnBlock;
import com.flamingo.ai.curriculum.service.outline.model.ExtractedSource;
import com.flamingo.ai.curriculum.service.outline.model.MaterializedTree;
import com.flamingo.ai.curriculum.service.outline.model.NoiseReason;
import com.flamingo.ai.curriculum.service.outline.model.ParseToken;
import com.flamingo.ai.curriculum.service.outline.model.SourceLine;
import com.flamingo.ai.curriculum.service.outline.model.TableRegion;
import com.flamingo.ai.curriculum.service.outline.model.TableRow;
import com.flamingo.ai.curriculum.service.outline.model.TokenKind;
import com.flamingo.ai.curriculum.service.outline.table.ColumnBoundaryCache;
import com.flamingo.ai.curriculum.service.outline.table.KeywordColumnGuesser;
import com.flamingo.ai.curriculum.service.outline.table.TableColumnSplitter;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives one document through classification, hierarchy building and materialization.
 *
 * <p>Table rows located by the column splitter are interleaved with the free lines of each page by
 * vertical position. A row's title cell becomes a heading one level under the current section
 * heading unless the cell itself matches a heading family; body cell lines are classified as table
 * column text so unmarked statements become items. Every call uses fresh per-document state, so
 * one instance can parse several documents concurrently.
 */
@Service
@Slf4j
public class OutlineParser {

  private final OutlineConfig config;
  private final ClassifierRules rules;
  private final MeterRegistry meterRegistry;

  public OutlineParser(OutlineConfig config, MeterRegistry meterRegistry) {
    this.config = config;
    this.rules = ClassifierRules.compile(config.getClassifier());
    this.meterRegistry = meterRegistry;
  }

  /**
   * Parses an extracted document into a validated outline.
   *
   * @throws com.flamingo.ai.curriculum.exception.StructuralParseException if the tree is invalid
   */
  @Timed(value = "outline.parse", description = "Time taken to parse a document into an outline")
  public ParseOutcome parse(ExtractedSource source) {
    Run run = new Run();

    List<SourceLine> lines = source.lines();
    KeywordColumnGuesser guesser =
        new KeywordColumnGuesser(config.getTable().getKeywordSplitPhrases());
    if (!source.hasGeometry() && guesser.isEnabled()) {
      KeywordColumnGuesser.Guess guess = guesser.guess(lines);
      lines = guess.lines();
      run.keywordSplits = guess.splitCount();
    }
    run.lineCount = lines.size();
    run.classifier = RunningHeaderDetector.classifierFor(rules, lines);

    List<Event> events = new ArrayList<>();
    List<TableRegion> regions =
        config.getTable().isEnabled() && source.hasGeometry() ? source.tableRegions() : List.of();
    for (int i = 0; i < lines.size(); i++) {
      SourceLine line = lines.get(i);
      if (!insideRegion(line, regions)) {
        events.add(Event.ofLine(line, i));
      }
    }
    addTableRows(source, regions, run, events);
    events.sort(Event.ORDER);

    for (Event event : events) {
      if (event.line() != null) {
        feedLine(run, event.line().text(), event.line().tableColumn());
      } else {
        feedRow(run, event.row());
      }
    }

    MaterializedTree tree =
        new TreeMaterializer(config.getBuilder().getTruncationMarker())
            .materialize(run.builder.finish());

    ParseStatistics statistics =
        ParseStatistics.builder()
            .lineCount(run.lineCount)
            .noiseByReason(Map.copyOf(run.noise))
            .tablesSplit(run.tablesSplit)
            .tablesSkipped(run.tablesSkipped)
            .tableRows(run.tableRows)
            .keywordSplits(run.keywordSplits)
            .droppedContinuations(run.builder.getDroppedContinuations())
            .build();

    int unclassified = statistics.noiseCount(NoiseReason.UNCLASSIFIED);
    if (unclassified > 0) {
      meterRegistry.counter("outline.noise.unclassified").increment(unclassified);
    }
    log.info(
        "Parsed outline: {} lines, {} nodes, per level {}, {} table row(s), {} table(s) skipped",
        run.lineCount,
        tree.size(),
        tree.levelCounts(),
        run.tableRows,
        run.tablesSkipped);
    return new ParseOutcome(tree, statistics);
  }

  private void addTableRows(
      ExtractedSource source, List<TableRegion> regions, Run run, List<Event> events) {
    if (regions.isEmpty()) {
      return;
    }
    TableColumnSplitter splitter = new TableColumnSplitter(config.getTable());
    ColumnBoundaryCache cache = new ColumnBoundaryCache();
    List<TableRegion> ordered =
        regions.stream()
            .sorted(
                Comparator.comparingInt(TableRegion::pageNumber)
                    .thenComparing(TableRegion::top))
            .toList();
    for (TableRegion region : ordered) {
      try {
        List<TableRow> rows = splitter.split(region, source.words(), cache);
        rows.forEach(row -> events.add(Event.ofRow(row)));
        run.tablesSplit++;
        run.tableRows += rows.size();
      } catch (TableBoundaryUnresolvedException e) {
        run.tablesSkipped++;
        meterRegistry.counter("outline.table.skipped").increment();
        log.warn("Skipping table on page {}: {}", e.getPageNumber(), e.getMessage());
      }
    }
  }

  private static boolean insideRegion(SourceLine line, List<TableRegion> regions) {
    if (!line.hasPosition()) {
      return false;
    }
    return regions.stream()
        .anyMatch(r -> r.pageNumber() == line.pageNumber() && r.containsY(line.top()));
  }

  private void feedLine(Run run, String text, boolean tableColumn) {
    ParseToken token = run.classifier.classify(text, run.context.inTableColumn(tableColumn));
    accept(run, token, text);
  }

  private void feedRow(Run run, TableRow row) {
    row.title()
        .filter(block -> !block.isEmpty())
        .ifPresent(
            title -> {
              List<String> titleLines = title.lines();
              String first = titleLines.get(0);
              ParseToken token =
                  run.classifier.classify(first, run.context.inTableColumn(false));
              if (token.is(TokenKind.NOISE) && token.noiseReason() != NoiseReason.UNCLASSIFIED) {
                // running header or footer caught inside a continuation page's title column
                accept(run, token, first);
                return;
              }
              if (!token.is(TokenKind.HEADING)) {
                int level = Math.max(0, run.context.previousHeadingLevel() + 1);
                token = ParseToken.heading(level, first.strip(), null, true);
              }
              accept(run, token, first);
              for (String wrapped : titleLines.subList(1, titleLines.size())) {
                accept(run, ParseToken.continuation(wrapped.strip()), wrapped);
              }
            });
    for (ColumnBlock body : row.bodies()) {
      for (String line : body.lines()) {
        feedLine(run, line, true);
      }
    }
  }

  private void accept(Run run, ParseToken token, String rawText) {
    if (token.is(TokenKind.NOISE)) {
      run.noise.merge(token.noiseReason(), 1, Integer::sum);
    }
    run.builder.accept(token);
    run.context = run.context.advance(token, rawText);
  }

  /** Per-document state. */
  private final class Run {
    private final HierarchyBuilder builder = new HierarchyBuilder(config.getBuilder());
    private final Map<NoiseReason, Integer> noise = new EnumMap<>(NoiseReason.class);
    private LineClassifier classifier;
    private ClassificationContext context = ClassificationContext.initial();
    private int lineCount;
    private int tablesSplit;
    private int tablesSkipped;
    private int tableRows;
    private int keywordSplits;
  }

  /** A free line or a table row, positioned on its page. */
  private record Event(int page, float top, int sequence, SourceLine line, TableRow row) {

    static final Comparator<Event> ORDER =
        Comparator.comparingInt(Event::page)
            .thenComparing(Event::top)
            .thenComparingInt(Event::sequence);

    static Event ofLine(SourceLine line, int index) {
      float top = line.hasPosition() ? line.top() : -1.0f;
      return new Event(line.pageNumber(), top, index, line, null);
    }

    static Event ofRow(TableRow row) {
      return new Event(row.pageNumber(), row.top(), Integer.MAX_VALUE, null, row);
    }
  }
}
