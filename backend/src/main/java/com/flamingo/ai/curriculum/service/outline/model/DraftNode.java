package com.flamingo.ai.curriculum.service.outline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Mutable node produced by the hierarchy builder and consumed by the materializer.
 *
 * <p>{@code levelHint} is the level the classifier asked for; the materialized level comes from the
 * node's actual position, since a hint may skip levels that were never opened.
 */
public final class DraftNode {

  private final NodeKind kind;
  private final String label;
  private final int levelHint;
  private final List<String> titleParts = new ArrayList<>();
  private final List<DraftNode> children = new ArrayList<>();
  private boolean truncated;
  private boolean nestingCue;

  public DraftNode(NodeKind kind, String label, int levelHint, String firstLine) {
    this.kind = kind;
    this.label = label;
    this.levelHint = levelHint;
    this.titleParts.add(firstLine);
  }

  public NodeKind getKind() {
    return kind;
  }

  public String getLabel() {
    return label;
  }

  public int getLevelHint() {
    return levelHint;
  }

  public List<DraftNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public void addChild(DraftNode child) {
    children.add(child);
  }

  public void addChildren(List<DraftNode> more) {
    children.addAll(more);
  }

  public boolean isTruncated() {
    return truncated;
  }

  public boolean hasNestingCue() {
    return nestingCue;
  }

  public void setNestingCue(boolean nestingCue) {
    this.nestingCue = nestingCue;
  }

  public int lineCount() {
    return titleParts.size();
  }

  public String firstLine() {
    return titleParts.get(0);
  }

  /**
   * Appends a wrapped line unless the title already spans {@code maxLines}, in which case the title
   * is marked truncated and the line is dropped.
   *
   * @return whether the line was kept
   */
  public boolean appendLine(String line, int maxLines) {
    if (titleParts.size() >= maxLines) {
      truncated = true;
      return false;
    }
    titleParts.add(line);
    return true;
  }

  /** Joined title; a line ending in a hyphen joins the next without a space. */
  public String title(String truncationMarker) {
    StringBuilder title = new StringBuilder();
    for (String part : titleParts) {
      String text = part.strip();
      if (text.isEmpty()) {
        continue;
      }
      if (title.length() > 0 && !endsWithWordHyphen(title)) {
        title.append(' ');
      }
      title.append(text);
    }
    if (truncated) {
      title.append(' ').append(truncationMarker);
    }
    return title.toString();
  }

  private static boolean endsWithWordHyphen(CharSequence text) {
    int n = text.length();
    return n >= 2 && text.charAt(n - 1) == '-' && Character.isLetter(text.charAt(n - 2));
  }

  /** Case- and punctuation-insensitive form used to spot repeated headings. */
  public static String normalizeTitle(String title) {
    return title.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", " ").strip();
  }

  @Override
  public String toString() {
    return kind + "(" + firstLine() + ")";
  }
}
