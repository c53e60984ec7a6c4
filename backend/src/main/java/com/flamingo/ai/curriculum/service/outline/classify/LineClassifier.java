package com.flamingo.ai.curriculum.service.outline.classify;

import com.flamingo.ai.curriculum.config.OutlineConfig.LevelMode;
import com.flamingo.ai.curriculum.service.outline.classify.ClassifierRules.BulletGlyph;
import com.flamingo.ai.curriculum.service.outline.classify.ClassifierRules.HeadingRule;
import com.flamingo.ai.curriculum.service.outline.model.ClassificationContext;
import com.flamingo.ai.curriculum.service.outline.model.NoiseReason;
import com.flamingo.ai.curriculum.service.outline.model.ParseToken;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns one extracted line into a {@link ParseToken}.
 *
 * <p>Checks run in a fixed order: noise, heading, bullet, continuation, table statement.
 * Classification is total: anything unrecognized, including an unexpected failure inside a rule,
 * degrades to {@link NoiseReason#UNCLASSIFIED} noise.
 */
@Slf4j
public class LineClassifier {

  private final ClassifierRules rules;
  private final Set<String> runningHeaders;

  public LineClassifier(ClassifierRules rules) {
    this(rules, Set.of());
  }

  public LineClassifier(ClassifierRules rules, Set<String> runningHeaders) {
    this.rules = rules;
    this.runningHeaders = Set.copyOf(runningHeaders);
  }

  /** Classifies {@code line}; never throws. */
  public ParseToken classify(String line, ClassificationContext context) {
    try {
      return doClassify(normalize(line), context);
    } catch (RuntimeException e) {
      log.warn("Line could not be classified, treating as noise: '{}' ({})", line, e.toString());
      return ParseToken.noise(NoiseReason.UNCLASSIFIED, line);
    }
  }

  private ParseToken doClassify(String text, ClassificationContext context) {
    if (text.isEmpty()) {
      return ParseToken.noise(NoiseReason.BLANK, text);
    }
    if (rules.isPageNumber(text)) {
      return ParseToken.noise(NoiseReason.PAGE_NUMBER, text);
    }
    if (rules.isBoilerplate(text)) {
      return ParseToken.noise(NoiseReason.BOILERPLATE, text);
    }
    if (rules.isConfiguredRunningHeader(text) || runningHeaders.contains(headerKey(text))) {
      return ParseToken.noise(NoiseReason.RUNNING_HEADER, text);
    }

    ParseToken heading = matchHeading(text, context);
    if (heading != null) {
      return heading;
    }
    ParseToken bullet = matchBullet(text);
    if (bullet != null) {
      return bullet;
    }
    if (isContinuation(text, context)) {
      return ParseToken.continuation(text);
    }
    if (context.inTableColumn()) {
      // each uppercase-initial statement in a body column is its own item
      return ParseToken.bullet(0, text);
    }

    log.trace("Unclassified line: '{}'", text);
    return ParseToken.noise(NoiseReason.UNCLASSIFIED, text);
  }

  ParseToken matchHeading(String text, ClassificationContext context) {
    if (text.length() > rules.maxHeadingLength()) {
      return null;
    }
    for (HeadingRule rule : rules.headingRules()) {
      Matcher matcher = rule.pattern().matcher(text);
      if (matcher.matches()) {
        int level = rule.level(matcher, context.previousHeadingLevel());
        boolean relative = rule.levelMode() == LevelMode.RELATIVE;
        return ParseToken.heading(level, text, rule.label(matcher), relative);
      }
    }
    return null;
  }

  ParseToken matchBullet(String text) {
    for (BulletGlyph glyph : rules.bulletGlyphs()) {
      String marker = glyph.glyph();
      if (marker.isEmpty() || !text.startsWith(marker) || text.length() == marker.length()) {
        continue;
      }
      String rest = text.substring(marker.length());
      boolean spaced = Character.isWhitespace(rest.charAt(0));
      if (spaced || gluedAllowed(marker)) {
        String body = rest.strip();
        if (!body.isEmpty()) {
          return ParseToken.bullet(glyph.level(), body);
        }
      }
    }
    return null;
  }

  private static boolean gluedAllowed(String marker) {
    // "-word" and "*word" are usually hyphenation or emphasis, letters are usually words
    if (marker.equals("-") || marker.equals("*")) {
      return false;
    }
    return marker.codePoints().noneMatch(Character::isLetterOrDigit);
  }

  private boolean isContinuation(String text, ClassificationContext context) {
    if (context.previousText() == null) {
      return false;
    }
    int first = text.codePointAt(0);
    if (Character.isLowerCase(first)) {
      return true;
    }
    String firstWord = text.split("[\\s,;:]+", 2)[0];
    if (rules.isConjunction(firstWord)) {
      return true;
    }
    return rules.endsDangling(context.previousText());
  }

  static String normalize(String line) {
    if (line == null) {
      return "";
    }
    return line.replace('\u00A0', ' ').replaceAll("\\s+", " ").strip();
  }

  static String headerKey(String text) {
    return text.toLowerCase(Locale.ROOT).replaceAll("\\d+", "#");
  }
}
