package com.flamingo.ai.curriculum.service.outline.table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.flamingo.ai.curriculum.service.outline.model.SourceLine;
import java.util.List;
import org.junit.jupiter.api.Test;

class KeywordColumnGuesserTest {

  private final KeywordColumnGuesser guesser =
      new KeywordColumnGuesser(List.of("Students should"));

  @Test
  void shouldBeDisabled_withoutPhrases() {
    assertThat(new KeywordColumnGuesser(List.of()).isEnabled()).isFalse();
    assertThat(guesser.isEnabled()).isTrue();
  }

  @Test
  void shouldCutLineAtPhrase_andMarkBodyUntilBlankLine() {
    List<SourceLine> lines =
        List.of(
            new SourceLine(1, "Enzymes students should be able to describe"),
            new SourceLine(1, "their role."),
            new SourceLine(1, ""),
            new SourceLine(1, "Digestion"));

    KeywordColumnGuesser.Guess guess = guesser.guess(lines);

    assertThat(guess.splitCount()).isEqualTo(1);
    assertThat(guess.lines())
        .extracting(SourceLine::text, SourceLine::tableColumn)
        .containsExactly(
            tuple("Enzymes", false),
            tuple("students should be able to describe", true),
            tuple("their role.", true),
            tuple("", false),
            tuple("Digestion", false));
  }

  @Test
  void shouldPassLinesThroughUnchanged_withoutPhrase() {
    List<SourceLine> lines = List.of(new SourceLine(2, "4.1 Cell biology", 40f));

    KeywordColumnGuesser.Guess guess = guesser.guess(lines);

    assertThat(guess.splitCount()).isZero();
    assertThat(guess.lines()).containsExactly(new SourceLine(2, "4.1 Cell biology", 40f, false));
  }
}
