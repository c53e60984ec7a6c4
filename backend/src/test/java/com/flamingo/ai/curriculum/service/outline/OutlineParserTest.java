package com.flamingo.ai.curriculum.service.outline;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.curriculum.config.OutlineConfig;
import com.flamingo.ai.curriculum.service.outline.model.ExtractedSource;
import com.flamingo.ai.curriculum.service.outline.model.NoiseReason;
import com.flamingo.ai.curriculum.service.outline.model.OutlineNode;
import com.flamingo.ai.curriculum.service.outline.model.PositionedWord;
import com.flamingo.ai.curriculum.service.outline.model.SourceLine;
import com.flamingo.ai.curriculum.service.outline.model.TableRegion;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link OutlineParser}. */
class OutlineParserTest {

  private OutlineConfig config;
  private SimpleMeterRegistry meterRegistry;
  private OutlineParser parser;

  @BeforeEach
  void setUp() {
    config = new OutlineConfig();
    meterRegistry = new SimpleMeterRegistry();
    parser = new OutlineParser(config, meterRegistry);
  }

  private static ExtractedSource text(String... lines) {
    return ExtractedSource.ofLines(Stream.of(lines).map(l -> new SourceLine(1, l)).toList());
  }

  private static PositionedWord word(String text, float x0, float x1, float top) {
    return new PositionedWord(text, x0, x1, top, top + 10, 1);
  }

  @Test
  void shouldParseNumberedSectionsWithNestedBullets() {
    ParseOutcome outcome =
        parser.parse(
            text(
                "1.1 Cells",
                "1.1.1 Structure",
                "• nucleus",
                "• mitochondria, including:",
                "o produces ATP"));

    assertThat(outcome.tree().nodes())
        .containsExactly(
            new OutlineNode("1_1", "1.1 Cells", 0, null),
            new OutlineNode("1_1_1", "1.1.1 Structure", 1, "1_1"),
            new OutlineNode("1_1_1_b01", "nucleus", 2, "1_1_1"),
            new OutlineNode("1_1_1_b02", "mitochondria, including:", 2, "1_1_1"),
            new OutlineNode("1_1_1_b02_b01", "produces ATP", 3, "1_1_1_b02"));
  }

  @Test
  void shouldKeepParsing_whenSubsectionPrecedesItsSection() {
    ParseOutcome outcome =
        parser.parse(text("1.1.1 Early sub", "1.1 Cells", "1.1.1 Structure"));

    assertThat(outcome.tree().nodes())
        .containsExactly(
            new OutlineNode("1_1_1_dup2", "1.1.1 Early sub", 0, null),
            new OutlineNode("1_1", "1.1 Cells", 0, null),
            new OutlineNode("1_1_1", "1.1.1 Structure", 1, "1_1"));
  }

  @Test
  void shouldAttachPrimaryBullet_besideCuedBulletWithSubBullets() {
    ParseOutcome outcome =
        parser.parse(
            text(
                "1.1 Cells",
                "• The cell, including:",
                "o nucleus",
                "o mitochondria",
                "• Cell division"));

    assertThat(outcome.tree().nodes())
        .contains(
            new OutlineNode("1_1_b02", "Cell division", 1, "1_1"),
            new OutlineNode("1_1_b01_b02", "mitochondria", 2, "1_1_b01"));
  }

  @Test
  void shouldDiscardCopyrightFooter() {
    ParseOutcome outcome = parser.parse(text("Unit 2: Biology", "© Exam Board 2024"));

    assertThat(outcome.tree().nodes())
        .containsExactly(new OutlineNode("unit2", "Unit 2: Biology", 0, null));
    assertThat(outcome.statistics().noiseCount(NoiseReason.BOILERPLATE)).isEqualTo(1);
  }

  @Test
  void shouldDropRunningHeadersAndPageNumbers() {
    ExtractedSource source =
        ExtractedSource.ofLines(
            List.of(
                new SourceLine(1, "Biology specification"),
                new SourceLine(1, "Topic 1: Cells"),
                new SourceLine(1, "1"),
                new SourceLine(2, "Biology specification"),
                new SourceLine(2, "• nucleus"),
                new SourceLine(2, "2"),
                new SourceLine(3, "Biology specification"),
                new SourceLine(3, "• ribosomes"),
                new SourceLine(3, "3")));

    ParseOutcome outcome = parser.parse(source);

    assertThat(outcome.tree().nodes())
        .extracting(OutlineNode::code)
        .containsExactly("topic1", "topic1_b01", "topic1_b02");
    assertThat(outcome.statistics().noiseCount(NoiseReason.RUNNING_HEADER)).isEqualTo(3);
    assertThat(outcome.statistics().noiseCount(NoiseReason.PAGE_NUMBER)).isEqualTo(3);
  }

  @Test
  void shouldCountUnclassifiedLines() {
    parser.parse(text("Introductory prose without structure", "1.1 Cells"));

    assertThat(meterRegistry.counter("outline.noise.unclassified").count()).isEqualTo(1.0);
  }

  @Test
  void shouldTurnTableRowsIntoSectionsWithItems() {
    List<PositionedWord> words =
        List.of(
            word("Content", 10, 60, 105),
            word("Amplification", 200, 280, 105),
            word("Guidance", 420, 480, 105),
            word("Enzymes", 10, 60, 130),
            word("Describe", 200, 250, 130),
            word("the", 255, 270, 130),
            word("action", 275, 300, 130),
            word("of", 305, 315, 130),
            word("Practical", 420, 470, 130),
            word("enzymes.", 200, 250, 145),
            word("Digestion", 10, 60, 200),
            word("Recall", 200, 240, 200),
            word("products.", 245, 290, 200));
    List<SourceLine> lines =
        List.of(
            new SourceLine(1, "4.1 Cell biology", 60),
            new SourceLine(1, "Content Amplification Guidance", 105),
            new SourceLine(1, "Enzymes Describe the action of Practical", 130),
            new SourceLine(1, "enzymes.", 145),
            new SourceLine(1, "Digestion Recall products.", 200));
    TableRegion region = new TableRegion(1, 0, 100, 600, 400, List.of());

    ParseOutcome outcome = parser.parse(new ExtractedSource(lines, words, List.of(region)));

    assertThat(outcome.tree().nodes())
        .containsExactly(
            new OutlineNode("4_1", "4.1 Cell biology", 0, null),
            new OutlineNode("4_1_h01", "Enzymes", 1, "4_1"),
            new OutlineNode("4_1_h01_b01", "Describe the action of enzymes.", 2, "4_1_h01"),
            new OutlineNode("4_1_h02", "Digestion", 1, "4_1"),
            new OutlineNode("4_1_h02_b01", "Recall products.", 2, "4_1_h02"));
    assertThat(outcome.statistics().getTablesSplit()).isEqualTo(1);
    assertThat(outcome.statistics().getTableRows()).isEqualTo(2);
  }

  @Test
  void shouldSkipTableWithoutBoundaries_andKeepParsing() {
    List<PositionedWord> words = List.of(word("Enzymes", 10, 60, 130));
    List<SourceLine> lines =
        List.of(
            new SourceLine(1, "4.1 Cell biology", 60),
            new SourceLine(1, "Enzymes", 130),
            new SourceLine(1, "• osmosis", 450));
    TableRegion region = new TableRegion(1, 0, 100, 600, 400, List.of());

    ParseOutcome outcome = parser.parse(new ExtractedSource(lines, words, List.of(region)));

    assertThat(outcome.statistics().getTablesSkipped()).isEqualTo(1);
    assertThat(meterRegistry.counter("outline.table.skipped").count()).isEqualTo(1.0);
    assertThat(outcome.tree().nodes())
        .extracting(OutlineNode::title)
        .containsExactly("4.1 Cell biology", "osmosis");
  }

  @Test
  void shouldGuessColumnsByKeyword_forFlattenedText() {
    config.getTable().setKeywordSplitPhrases(List.of("Students should"));
    parser = new OutlineParser(config, meterRegistry);

    ParseOutcome outcome =
        parser.parse(text("4.1 Cell biology", "Enzymes Students should describe enzymes."));

    assertThat(outcome.tree().nodes())
        .extracting(OutlineNode::title)
        .contains("Students should describe enzymes.");
    assertThat(outcome.statistics().isLowConfidenceColumns()).isTrue();
    assertThat(outcome.statistics().getKeywordSplits()).isEqualTo(1);
  }

  @Test
  void shouldProduceSameTree_onRepeatedParse() {
    ExtractedSource source =
        text("Topic 1: Cells", "• nucleus", "• cell wall", "Topic 2: Organisation", "• tissues");

    assertThat(parser.parse(source).tree()).isEqualTo(parser.parse(source).tree());
  }
}
