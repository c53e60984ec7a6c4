package com.flamingo.ai.curriculum.service.outline.classify;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.curriculum.config.OutlineConfig;
import com.flamingo.ai.curriculum.service.outline.model.ClassificationContext;
import com.flamingo.ai.curriculum.service.outline.model.NoiseReason;
import com.flamingo.ai.curriculum.service.outline.model.ParseToken;
import com.flamingo.ai.curriculum.service.outline.model.SourceLine;
import com.flamingo.ai.curriculum.service.outline.model.TokenKind;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RunningHeaderDetectorTest {

  private final ClassifierRules rules = ClassifierRules.compile(new OutlineConfig().getClassifier());

  @Test
  void shouldDetectLineRepeatedOnEnoughPages_ignoringPageDigits() {
    List<SourceLine> lines =
        List.of(
            new SourceLine(1, "AQA GCSE Biology 8461 page 1"),
            new SourceLine(1, "1.1 Cells"),
            new SourceLine(2, "AQA GCSE Biology 8461 page 2"),
            new SourceLine(3, "AQA GCSE Biology 8461 page 3"));

    Set<String> detected = RunningHeaderDetector.detect(rules, lines);

    assertThat(detected).containsExactly(LineClassifier.headerKey("aqa gcse biology 8461 page 1"));
  }

  @Test
  void shouldIgnoreLinesOnTooFewPages() {
    List<SourceLine> lines =
        List.of(
            new SourceLine(1, "Subject content"),
            new SourceLine(2, "Subject content"),
            new SourceLine(2, "Subject content"));

    assertThat(RunningHeaderDetector.detect(rules, lines)).isEmpty();
  }

  @Test
  void shouldNeverPromoteRepeatedHeadings() {
    List<SourceLine> lines =
        List.of(
            new SourceLine(1, "4.1 Cell biology"),
            new SourceLine(2, "4.1 Cell biology"),
            new SourceLine(3, "4.1 Cell biology"),
            new SourceLine(4, "• Content"),
            new SourceLine(5, "• Content"),
            new SourceLine(6, "• Content"));

    assertThat(RunningHeaderDetector.detect(rules, lines)).isEmpty();
  }

  @Test
  void shouldBuildClassifierThatDropsDetectedHeaders() {
    List<SourceLine> lines =
        List.of(
            new SourceLine(1, "Specification for first teaching 2016"),
            new SourceLine(2, "Specification for first teaching 2016"),
            new SourceLine(3, "Specification for first teaching 2016"));

    LineClassifier classifier = RunningHeaderDetector.classifierFor(rules, lines);

    ParseToken token =
        classifier.classify(
            "Specification for first teaching 2016", ClassificationContext.initial());
    assertThat(token.kind()).isEqualTo(TokenKind.NOISE);
    assertThat(token.noiseReason()).isEqualTo(NoiseReason.RUNNING_HEADER);
  }
}
