package com.flamingo.ai.curriculum.service.outline.classify;

import com.flamingo.ai.curriculum.config.OutlineConfig;
import com.flamingo.ai.curriculum.config.OutlineConfig.HeadingFamily;
import com.flamingo.ai.curriculum.config.OutlineConfig.LevelMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled form of {@link OutlineConfig.Classifier}.
 *
 * <p>Compiling once up front makes a malformed pattern fail at startup instead of on the first
 * document that reaches it.
 */
public final class ClassifierRules {

  private final List<HeadingRule> headingRules;
  private final List<BulletGlyph> bulletGlyphs;
  private final Pattern pageNumber;
  private final List<Pattern> boilerplate;
  private final List<Pattern> runningHeaders;
  private final Set<String> conjunctions;
  private final List<String> danglingEndings;
  private final int maxHeadingLength;
  private final int runningHeaderMinPages;

  private ClassifierRules(
      List<HeadingRule> headingRules,
      List<BulletGlyph> bulletGlyphs,
      Pattern pageNumber,
      List<Pattern> boilerplate,
      List<Pattern> runningHeaders,
      Set<String> conjunctions,
      List<String> danglingEndings,
      int maxHeadingLength,
      int runningHeaderMinPages) {
    this.headingRules = headingRules;
    this.bulletGlyphs = bulletGlyphs;
    this.pageNumber = pageNumber;
    this.boilerplate = boilerplate;
    this.runningHeaders = runningHeaders;
    this.conjunctions = conjunctions;
    this.danglingEndings = danglingEndings;
    this.maxHeadingLength = maxHeadingLength;
    this.runningHeaderMinPages = runningHeaderMinPages;
  }

  /**
   * Compiles the classifier section of the configuration.
   *
   * @throws IllegalStateException if a heading family lacks a {@code title} group
   * @throws java.util.regex.PatternSyntaxException if any pattern is malformed
   */
  public static ClassifierRules compile(OutlineConfig.Classifier config) {
    List<HeadingRule> headings = new ArrayList<>();
    for (HeadingFamily family : config.getHeadingFamilies()) {
      String regex = family.getPattern();
      if (regex == null || !regex.contains("(?<title>")) {
        throw new IllegalStateException(
            "Heading family '" + family.getName() + "' must declare a (?<title>...) group");
      }
      headings.add(
          new HeadingRule(
              family.getName(),
              Pattern.compile(regex),
              family.getLevelMode() == null ? LevelMode.FIXED : family.getLevelMode(),
              family.getBaseLevel(),
              family.getCodePrefix() == null ? "" : family.getCodePrefix(),
              regex.contains("(?<label>"),
              regex.contains("(?<keyword>")));
    }

    List<BulletGlyph> glyphs = new ArrayList<>();
    config.getPrimaryBulletGlyphs().forEach(g -> glyphs.add(new BulletGlyph(g, 0)));
    config.getSecondaryBulletGlyphs().forEach(g -> glyphs.add(new BulletGlyph(g, 1)));
    // longest first so multi-character markers win over their prefixes
    glyphs.sort(Comparator.comparingInt((BulletGlyph g) -> g.glyph().length()).reversed());

    Set<String> conjunctions = new LinkedHashSet<>();
    config.getContinuationConjunctions().forEach(c -> conjunctions.add(c.toLowerCase(Locale.ROOT)));

    return new ClassifierRules(
        List.copyOf(headings),
        List.copyOf(glyphs),
        Pattern.compile(config.getPageNumberPattern()),
        config.getBoilerplatePatterns().stream().map(Pattern::compile).toList(),
        config.getRunningHeaderPatterns().stream().map(Pattern::compile).toList(),
        conjunctions,
        config.getDanglingEndings().stream().map(e -> e.toLowerCase(Locale.ROOT)).toList(),
        config.getMaxHeadingLength(),
        config.getRunningHeaderMinPages());
  }

  List<HeadingRule> headingRules() {
    return headingRules;
  }

  List<BulletGlyph> bulletGlyphs() {
    return bulletGlyphs;
  }

  boolean isPageNumber(String text) {
    return pageNumber.matcher(text).matches();
  }

  boolean isBoilerplate(String text) {
    return boilerplate.stream().anyMatch(p -> p.matcher(text).matches());
  }

  boolean isConfiguredRunningHeader(String text) {
    return runningHeaders.stream().anyMatch(p -> p.matcher(text).matches());
  }

  boolean isConjunction(String word) {
    return conjunctions.contains(word.toLowerCase(Locale.ROOT));
  }

  boolean endsDangling(String previousText) {
    String lower = previousText.stripTrailing().toLowerCase(Locale.ROOT);
    return danglingEndings.stream().anyMatch(lower::endsWith);
  }

  int maxHeadingLength() {
    return maxHeadingLength;
  }

  int runningHeaderMinPages() {
    return runningHeaderMinPages;
  }

  /** A compiled heading family. */
  record HeadingRule(
      String name,
      Pattern pattern,
      LevelMode levelMode,
      int baseLevel,
      String codePrefix,
      boolean hasLabel,
      boolean hasKeyword) {

    /** Stable label for code generation, e.g. {@code 1.2} or {@code topic3}; null if none. */
    String label(Matcher matcher) {
      if (!hasLabel || matcher.group("label") == null) {
        return null;
      }
      String label = matcher.group("label").toLowerCase(Locale.ROOT);
      if (!codePrefix.isBlank()) {
        return codePrefix + label;
      }
      if (hasKeyword && matcher.group("keyword") != null) {
        return matcher.group("keyword").toLowerCase(Locale.ROOT) + label;
      }
      return label;
    }

    int level(Matcher matcher, int previousHeadingLevel) {
      return switch (levelMode) {
        case FIXED -> baseLevel;
        case DOTTED -> {
          String label = hasLabel ? matcher.group("label") : null;
          int segments = label == null ? 1 : label.split("\\.").length;
          yield Math.max(0, baseLevel + segments - 2);
        }
        case RELATIVE -> Math.max(0, previousHeadingLevel + baseLevel);
      };
    }
  }

  /** A bullet marker and the glyph depth it opens. */
  record BulletGlyph(String glyph, int level) {}
}
