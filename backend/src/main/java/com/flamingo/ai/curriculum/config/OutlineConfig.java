package com.flamingo.ai.curriculum.config;

import com.flamingo.ai.curriculum.service.outline.model.ColumnRole;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the outline pipeline.
 *
 * <p>Subject-specific quirks live in profile files ({@code application-<profile>.yml}) that
 * override these sections; the engine itself has no per-subject code branches.
 */
@Configuration
@ConfigurationProperties(prefix = "outline")
@Getter
@Setter
public class OutlineConfig {

  private Classifier classifier = new Classifier();
  private Builder builder = new Builder();
  private Table table = new Table();
  private Sync sync = new Sync();
  private Source source = new Source();

  @Getter
  @Setter
  public static class Classifier {

    /** Heading pattern families, tried in order. */
    private List<HeadingFamily> headingFamilies = defaultHeadingFamilies();

    /** Glyphs that open a first-level bullet, including private-use substitutes. */
    private List<String> primaryBulletGlyphs =
        new ArrayList<>(
            List.of(
                "\u2022", "\u25CF", "\u25AA", "\u25A0", "\u2023", "\u2219", "\u00B7", "*", "-",
                "\uF0B7", "\uF076", "\uF0D8", "\uF0FC"));

    /** Glyphs that open a second-level bullet. */
    private List<String> secondaryBulletGlyphs =
        new ArrayList<>(List.of("o", "\u25E6", "\u25CB", "\u2013", "\uF0A7", "\uF06F"));

    /** Bare page numbers and "Page n of m" footers. */
    private String pageNumberPattern = "(?i)(page\\s+)?\\d{1,3}(\\s+of\\s+\\d{1,3})?";

    /** Copyright footers and similar boilerplate. */
    private List<String> boilerplatePatterns =
        new ArrayList<>(
            List.of(
                ".*©.*",
                "(?i).*\\bcopyright\\b.*",
                "(?i).*all rights reserved.*",
                "(?i)^(version|issue)\\s+\\d+(\\.\\d+)*\\b.*"));

    /** Running headers known up front; repeated headers are also detected per document. */
    private List<String> runningHeaderPatterns = new ArrayList<>();

    /** A line repeated on at least this many pages is treated as a running header. */
    private int runningHeaderMinPages = 3;

    /** Words that make a line continue the previous one when it starts with them. */
    private List<String> continuationConjunctions =
        new ArrayList<>(List.of("and", "or", "including", "nor", "but"));

    /** Endings of the previous line that make the next line a continuation. */
    private List<String> danglingEndings =
        new ArrayList<>(List.of("-", ",", " of", " and", " or", " the", " to", " in", " for"));

    /** Lines longer than this are never treated as headings. */
    private int maxHeadingLength = 200;

    private static List<HeadingFamily> defaultHeadingFamilies() {
      List<HeadingFamily> families = new ArrayList<>();
      families.add(
          new HeadingFamily(
              "labelled",
              "(?i)^(?<keyword>topic|unit|component|section|paper|module|theme|area|option)"
                  + "\\s+(?<label>\\d{1,2}[a-z]?)\\s*[:.\\-–]\\s*(?<title>\\S.*)$",
              LevelMode.FIXED,
              0,
              ""));
      families.add(
          new HeadingFamily(
              "dotted",
              "^(?<label>\\d{1,2}(?:\\.\\d{1,2})+)\\.?\\s+(?<title>[\\p{L}(\"'].*)$",
              LevelMode.DOTTED,
              0,
              ""));
      families.add(
          new HeadingFamily(
              "lettered",
              "^\\((?<label>[a-z]{1,2})\\)\\s+(?<title>\\S.*)$",
              LevelMode.RELATIVE,
              1,
              ""));
      return families;
    }
  }

  /** How a heading family maps a match to a tree depth. */
  public enum LevelMode {
    /** Always {@code baseLevel}. */
    FIXED,
    /** {@code baseLevel + segments - 2} for a dotted label such as {@code 1.2.3}. */
    DOTTED,
    /** {@code baseLevel} below the most recent non-relative heading. */
    RELATIVE
  }

  @Getter
  @Setter
  @NoArgsConstructor
  @AllArgsConstructor
  public static class HeadingFamily {
    private String name;

    /** Regex with a {@code title} group and optional {@code label} and {@code keyword} groups. */
    private String pattern;

    private LevelMode levelMode = LevelMode.FIXED;
    private int baseLevel;

    /** Prefix for the stable code label; the matched keyword is used when blank. */
    private String codePrefix = "";
  }

  @Getter
  @Setter
  public static class Builder {

    /** Title of the container created when a bullet appears before any heading. */
    private String implicitContainerTitle = "Content";

    /** Bullet endings that make following bullets attach one level deeper. */
    private List<String> nestingCues =
        new ArrayList<>(List.of(":", "for example", "including", "such as", "e.g."));

    /** Whether a blank line closes open bullets, ending any nesting started by a cue. */
    private boolean resetNestingOnBlankLine = false;

    /** How many trailing siblings are checked for a repeated heading. */
    private int duplicateLookback = 1;

    /** Lines a title may span before it is truncated. */
    private int maxTitleWrapLines = 6;

    private String truncationMarker = "[…]";
  }

  @Getter
  @Setter
  public static class Table {
    private boolean enabled = true;

    /** Columns in reading order; the label is matched against header words. */
    private List<ColumnSpec> columns =
        new ArrayList<>(
            List.of(
                new ColumnSpec("Content", ColumnRole.TITLE),
                new ColumnSpec("Amplification", ColumnRole.BODY),
                new ColumnSpec("Guidance", ColumnRole.IGNORED)));

    /** Height below the region top searched for header labels, in PDF units. */
    private float headerBandHeight = 40.0f;

    /** Words whose tops differ by less than this belong to one line. */
    private float lineTolerance = 2.5f;

    /** A vertical gap larger than this between title-column lines starts a new row. */
    private float rowGapThreshold = 8.0f;

    /** Phrases that split flattened text into title and body columns when no geometry exists. */
    private List<String> keywordSplitPhrases = new ArrayList<>();
  }

  @Getter
  @Setter
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ColumnSpec {
    private String label;
    private ColumnRole role = ColumnRole.BODY;
  }

  @Getter
  @Setter
  public static class Sync {

    /** Parsed trees smaller than this never replace a stored tree. */
    private int minNodeCount = 10;

    private int deleteBatchSize = 500;
    private int insertBatchSize = 500;
    private int relinkBatchSize = 500;
  }

  @Getter
  @Setter
  public static class Source {
    private int fetchTimeoutMs = 60000;

    /** Documents larger than this are rejected. */
    private int maxDocumentBytes = 50 * 1024 * 1024;
  }
}
