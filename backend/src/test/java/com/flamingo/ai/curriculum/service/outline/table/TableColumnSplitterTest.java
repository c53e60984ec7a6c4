package com.flamingo.ai.curriculum.service.outline.table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.curriculum.config.OutlineConfig;
import com.flamingo.ai.curriculum.exception.TableBoundaryUnresolvedException;
import com.flamingo.ai.curriculum.service.outline.model.ColumnBlock;
import com.flamingo.ai.curriculum.service.outline.model.PositionedWord;
import com.flamingo.ai.curriculum.service.outline.model.RowBand;
import com.flamingo.ai.curriculum.service.outline.model.TableRegion;
import com.flamingo.ai.curriculum.service.outline.model.TableRow;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link TableColumnSplitter}. */
class TableColumnSplitterTest {

  private TableColumnSplitter splitter;
  private ColumnBoundaryCache cache;

  @BeforeEach
  void setUp() {
    splitter = new TableColumnSplitter(new OutlineConfig().getTable());
    cache = new ColumnBoundaryCache();
  }

  private static PositionedWord word(String text, float x0, float x1, float top, int page) {
    return new PositionedWord(text, x0, x1, top, top + 10, page);
  }

  private static List<PositionedWord> header(int page, float top) {
    return List.of(
        word("Content", 10, 60, top, page),
        word("Amplification", 200, 280, top, page),
        word("Guidance", 420, 480, top, page));
  }

  /** Two rows on page 1; the header sits at y=105. */
  private static List<PositionedWord> firstPage() {
    List<PositionedWord> words = new ArrayList<>(header(1, 105));
    words.add(word("Enzymes", 10, 60, 130, 1));
    words.add(word("Describe", 200, 250, 130, 1));
    words.add(word("enzymes.", 255, 300, 130, 1));
    words.add(word("Practical", 420, 470, 130, 1));
    words.add(word("Explain", 200, 250, 145, 1));
    words.add(word("Digestion", 10, 60, 200, 1));
    words.add(word("Recall", 200, 240, 200, 1));
    return words;
  }

  private static TableRegion region(int page, float top, List<RowBand> rows) {
    return new TableRegion(page, 0, top, 600, 400, rows);
  }

  @Test
  void shouldSplitRowsIntoTitleAndBodyColumns() {
    List<TableRow> rows = splitter.split(region(1, 100, List.of()), firstPage(), cache);

    assertThat(rows).hasSize(2);
    assertThat(rows.get(0).title()).map(ColumnBlock::lines).contains(List.of("Enzymes"));
    assertThat(rows.get(0).bodies())
        .singleElement()
        .extracting(ColumnBlock::lines)
        .isEqualTo(List.of("Describe enzymes.", "Explain"));
    assertThat(rows.get(1).title()).map(ColumnBlock::lines).contains(List.of("Digestion"));
    assertThat(rows.get(1).bodies().get(0).lines()).containsExactly("Recall");
  }

  @Test
  void shouldNeverEmitIgnoredColumn() {
    List<TableRow> rows = splitter.split(region(1, 100, List.of()), firstPage(), cache);

    assertThat(rows)
        .flatExtracting(TableRow::columns)
        .extracting(ColumnBlock::label)
        .doesNotContain("Guidance");
    assertThat(rows)
        .flatExtracting(TableRow::columns)
        .flatExtracting(ColumnBlock::lines)
        .doesNotContain("Practical");
  }

  @Test
  void shouldExcludeHeaderRow() {
    List<TableRow> rows = splitter.split(region(1, 100, List.of()), firstPage(), cache);

    assertThat(rows)
        .flatExtracting(TableRow::columns)
        .flatExtracting(ColumnBlock::lines)
        .doesNotContain("Content", "Amplification");
  }

  @Test
  void shouldFollowRegionRowGeometry_whenHeaderIsOnPage() {
    List<PositionedWord> words = new ArrayList<>(header(1, 105));
    words.add(word("Enzymes", 10, 60, 130, 1));
    words.add(word("Digestion", 10, 60, 143, 1));
    TableRegion region =
        region(1, 100, List.of(new RowBand(100, 142), new RowBand(142, 400)));

    List<TableRow> rows = splitter.split(region, words, cache);

    assertThat(rows).hasSize(2);
    assertThat(rows.get(1).title()).map(ColumnBlock::joined).contains("Digestion");
  }

  @Test
  void shouldReuseCachedBoundaries_onContinuationPage() {
    splitter.split(region(1, 100, List.of()), firstPage(), cache);
    List<PositionedWord> page2 =
        List.of(
            word("continued", 200, 260, 55, 2),
            word("Transport", 10, 60, 100, 2),
            word("Describe", 200, 250, 100, 2),
            word("Notes", 420, 470, 100, 2));

    List<TableRow> rows = splitter.split(region(2, 50, List.of()), page2, cache);

    assertThat(cache.getSourcePage()).isEqualTo(1);
    assertThat(rows).hasSize(2);
    assertThat(rows.get(0).title()).isEmpty();
    assertThat(rows.get(0).bodies().get(0).lines()).containsExactly("continued");
    assertThat(rows.get(1).title()).map(ColumnBlock::joined).contains("Transport");
    assertThat(rows.get(1).bodies().get(0).lines()).containsExactly("Describe");
  }

  @Test
  void shouldThrow_whenNoHeaderAndNothingCached() {
    List<PositionedWord> words = List.of(word("Transport", 10, 60, 100, 3));

    assertThatThrownBy(() -> splitter.split(region(3, 50, List.of()), words, cache))
        .isInstanceOf(TableBoundaryUnresolvedException.class)
        .hasMessageContaining("page 3");
  }

  @Test
  void shouldRequireTitleAndSecondLabel_toTrustHeader() {
    List<PositionedWord> words =
        List.of(word("Content", 10, 60, 105, 1), word("Enzymes", 10, 60, 130, 1));

    assertThatThrownBy(() -> splitter.split(region(1, 100, List.of()), words, cache))
        .isInstanceOf(TableBoundaryUnresolvedException.class);
  }
}
