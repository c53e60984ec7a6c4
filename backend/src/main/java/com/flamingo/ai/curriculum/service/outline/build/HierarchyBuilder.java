package com.flamingo.ai.curriculum.service.outline.build;

import com.flamingo.ai.curriculum.config.OutlineConfig;
import com.flamingo.ai.curriculum.service.outline.model.DraftNode;
import com.flamingo.ai.curriculum.service.outline.model.NodeKind;
import com.flamingo.ai.curriculum.service.outline.model.NoiseReason;
import com.flamingo.ai.curriculum.service.outline.model.ParseToken;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Rebuilds parent-child structure from a token stream.
 *
 * <p>Two stacks hold the open nodes: one for headings, one for the bullets under the deepest
 * heading. A heading closes every open heading at its level or deeper and all bullets. A bullet
 * closes bullets until it finds one it belongs under, either because its glyph is deeper or
 * because that bullet ended in a nesting cue. A cued bullet stops taking same-glyph bullets once
 * it has deeper-glyph children. Continuations extend the most recent open node.
 *
 * <p>One instance serves one document; state transitions are strictly sequential.
 */
@Slf4j
public class HierarchyBuilder {

  private final OutlineConfig.Builder config;
  private final List<DraftNode> roots = new ArrayList<>();
  private final Deque<DraftNode> headings = new ArrayDeque<>();
  private final Deque<DraftNode> bullets = new ArrayDeque<>();
  private boolean suppressWrappedTitle;
  private boolean finished;
  private int droppedContinuations;

  public HierarchyBuilder(OutlineConfig.Builder config) {
    this.config = config;
  }

  public void accept(ParseToken token) {
    if (finished) {
      throw new IllegalStateException("Builder already finished");
    }
    switch (token.kind()) {
      case HEADING -> onHeading(token);
      case BULLET -> onBullet(token);
      case CONTINUATION -> onContinuation(token.text());
      case NOISE -> onNoise(token);
    }
  }

  /** Closes the builder and returns the forest in document order. */
  public List<DraftNode> finish() {
    finished = true;
    headings.clear();
    bullets.clear();
    if (droppedContinuations > 0) {
      log.debug("Dropped {} continuation line(s) with no open node", droppedContinuations);
    }
    return List.copyOf(roots);
  }

  public int getDroppedContinuations() {
    return droppedContinuations;
  }

  private void onHeading(ParseToken token) {
    int level = token.levelHint();
    bullets.clear();
    while (!headings.isEmpty() && headings.peek().getLevelHint() >= level) {
      headings.pop();
    }

    List<DraftNode> siblings = headings.isEmpty() ? roots : headings.peek().getChildren();
    DraftNode repeated = findRepeatedHeading(siblings, token);
    if (repeated != null) {
      log.debug("Heading '{}' repeats a recent sibling, reopening it", token.text());
      headings.push(repeated);
      suppressWrappedTitle = true;
      return;
    }

    DraftNode node = new DraftNode(NodeKind.HEADING, token.label(), level, token.text());
    attach(node);
    headings.push(node);
    suppressWrappedTitle = false;
  }

  private DraftNode findRepeatedHeading(List<DraftNode> siblings, ParseToken token) {
    String normalized = DraftNode.normalizeTitle(token.text());
    int from = Math.max(0, siblings.size() - config.getDuplicateLookback());
    for (int i = siblings.size() - 1; i >= from; i--) {
      DraftNode candidate = siblings.get(i);
      if (candidate.getKind() != NodeKind.HEADING
          || candidate.getLevelHint() != token.levelHint()) {
        continue;
      }
      if (token.label() != null && token.label().equals(candidate.getLabel())) {
        return candidate;
      }
      if (normalized.equals(DraftNode.normalizeTitle(candidate.firstLine()))
          || normalized.equals(
              DraftNode.normalizeTitle(candidate.title(config.getTruncationMarker())))) {
        return candidate;
      }
    }
    return null;
  }

  private void onNoise(ParseToken token) {
    if (token.noiseReason() == NoiseReason.BLANK
        && config.isResetNestingOnBlankLine()
        && !bullets.isEmpty()) {
      log.trace("Blank line closes {} open bullet(s)", bullets.size());
      bullets.clear();
    }
  }

  private void onBullet(ParseToken token) {
    suppressWrappedTitle = false;
    if (headings.isEmpty()) {
      DraftNode container =
          new DraftNode(NodeKind.CONTAINER, null, 0, config.getImplicitContainerTitle());
      roots.add(container);
      headings.push(container);
      log.debug("Bullet before any heading, opened implicit container '{}'", container.firstLine());
    }

    int glyphLevel = token.levelHint();
    while (!bullets.isEmpty()) {
      DraftNode top = bullets.peek();
      boolean deeper = glyphLevel > top.getLevelHint();
      boolean cued =
          top.hasNestingCue()
              && glyphLevel >= top.getLevelHint()
              && !hasDeeperGlyphChild(top);
      if (deeper || cued) {
        break;
      }
      bullets.pop();
    }

    DraftNode node = new DraftNode(NodeKind.BULLET, null, glyphLevel, token.text());
    node.setNestingCue(endsWithNestingCue(token.text()));
    attach(node);
    bullets.push(node);
  }

  private static boolean hasDeeperGlyphChild(DraftNode bullet) {
    return bullet.getChildren().stream()
        .anyMatch(c -> c.getKind() == NodeKind.BULLET && c.getLevelHint() > bullet.getLevelHint());
  }

  private void onContinuation(String text) {
    if (suppressWrappedTitle) {
      log.trace("Skipping wrapped line of a repeated heading: '{}'", text);
      return;
    }
    DraftNode target = !bullets.isEmpty() ? bullets.peek() : headings.peek();
    if (target == null) {
      droppedContinuations++;
      return;
    }
    if (!target.appendLine(text, config.getMaxTitleWrapLines())) {
      log.debug("Title of {} exceeds {} lines, truncating", target, config.getMaxTitleWrapLines());
    }
    if (target.getKind() == NodeKind.BULLET) {
      target.setNestingCue(endsWithNestingCue(target.title(config.getTruncationMarker())));
    }
  }

  private void attach(DraftNode node) {
    DraftNode parent = !bullets.isEmpty() ? bullets.peek() : headings.peek();
    if (node.getKind() == NodeKind.HEADING) {
      parent = headings.peek();
    }
    if (parent == null) {
      roots.add(node);
    } else {
      parent.addChild(node);
    }
  }

  boolean endsWithNestingCue(String text) {
    String lower = text.strip().toLowerCase(Locale.ROOT);
    for (String cue : config.getNestingCues()) {
      String c = cue.toLowerCase(Locale.ROOT);
      if (lower.endsWith(c) || lower.endsWith(c + ":")) {
        return true;
      }
    }
    return false;
  }
}
