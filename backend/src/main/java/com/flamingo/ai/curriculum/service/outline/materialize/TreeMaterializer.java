package com.flamingo.ai.curriculum.service.outline.materialize;

import com.flamingo.ai.curriculum.exception.StructuralParseException;
import com.flamingo.ai.curriculum.service.outline.model.DraftNode;
import com.flamingo.ai.curriculum.service.outline.model.MaterializedTree;
import com.flamingo.ai.curriculum.service.outline.model.NodeKind;
import com.flamingo.ai.curriculum.service.outline.model.OutlineNode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Assigns codes to a built forest, merges siblings that collide on code and validates the result.
 *
 * <p>A code is the parent's code plus a suffix: the heading's own label when it has one (a dotted
 * label that extends the parent's contributes only its new segments), otherwise a per-kind sibling
 * index such as {@code h02} or {@code b01}. Codes depend only on the input, so identical input
 * always yields identical codes. Siblings with the same code are merged. A code already held under
 * another parent, typically by a heading that became a root because its parent was never opened,
 * gets a {@code _dupN} suffix instead.
 */
@Slf4j
public class TreeMaterializer {

  private final String truncationMarker;

  public TreeMaterializer(String truncationMarker) {
    this.truncationMarker = truncationMarker;
  }

  /**
   * Materializes {@code roots} into a pre-ordered node list.
   *
   * @throws StructuralParseException if the result violates a structural invariant
   */
  public MaterializedTree materialize(List<DraftNode> roots) {
    List<DraftNode> anchored = roots.stream().filter(TreeMaterializer::isAnchored).toList();
    List<OutlineNode> claimed = new ArrayList<>();
    emit(anchored, null, null, 0, new Codes(Set.of()), claimed);
    Set<String> reserved = new HashSet<>();
    claimed.forEach(n -> reserved.add(n.code()));

    List<OutlineNode> nodes = new ArrayList<>();
    emit(roots, null, null, 0, new Codes(reserved), nodes);
    validate(nodes);
    return new MaterializedTree(nodes);
  }

  /** A root that skipped no levels; its codes win over those of roots that did. */
  private static boolean isAnchored(DraftNode root) {
    return root.getKind() != NodeKind.HEADING || root.getLevelHint() == 0;
  }

  private void emit(
      List<DraftNode> siblings,
      DraftNode parent,
      String parentCode,
      int level,
      Codes codes,
      List<OutlineNode> out) {
    Map<String, DraftNode> byCode = new LinkedHashMap<>();
    Map<String, List<DraftNode>> mergedChildren = new HashMap<>();
    Map<NodeKind, Integer> counters = new EnumMap<>(NodeKind.class);
    Map<String, String> claimedByNatural = new HashMap<>();

    for (DraftNode node : siblings) {
      int index = counters.merge(node.getKind(), 1, Integer::sum);
      String natural = codeFor(node, parent, parentCode, index);
      boolean anchored = parent != null ? codes.anchoredBranch : isAnchored(node);
      String code = claimedByNatural.computeIfAbsent(natural, c -> codes.claim(c, anchored));
      DraftNode first = byCode.putIfAbsent(code, node);
      if (first == null) {
        mergedChildren.put(code, new ArrayList<>(node.getChildren()));
      } else {
        log.debug("Merging '{}' into earlier sibling with code {}", node.firstLine(), code);
        mergedChildren.get(code).addAll(node.getChildren());
      }
    }

    boolean outerBranch = codes.anchoredBranch;
    for (Map.Entry<String, DraftNode> entry : byCode.entrySet()) {
      String code = entry.getKey();
      DraftNode node = entry.getValue();
      if (parent == null) {
        codes.anchoredBranch = isAnchored(node);
      }
      out.add(new OutlineNode(code, node.title(truncationMarker), level, parentCode));
      emit(mergedChildren.get(code), node, code, level + 1, codes, out);
    }
    codes.anchoredBranch = outerBranch;
  }

  /** Codes handed out so far across the whole tree. */
  private static final class Codes {
    private final Set<String> reserved;
    private final Set<String> taken = new HashSet<>();
    private boolean anchoredBranch = true;

    Codes(Set<String> reserved) {
      this.reserved = reserved;
    }

    /**
     * Returns {@code code}, or {@code code_dupN} when another parent already holds it. Codes of
     * anchored roots are only checked against each other; the rest also avoid the reserved set.
     */
    String claim(String code, boolean anchored) {
      String candidate = code;
      for (int n = 2; isHeld(candidate, anchored); n++) {
        candidate = code + "_dup" + n;
      }
      if (!candidate.equals(code)) {
        log.warn("Code {} is already used elsewhere in the tree, using {}", code, candidate);
      }
      taken.add(candidate);
      return candidate;
    }

    private boolean isHeld(String code, boolean anchored) {
      return taken.contains(code) || (!anchored && reserved.contains(code));
    }
  }

  private String codeFor(DraftNode node, DraftNode parent, String parentCode, int index) {
    String suffix =
        switch (node.getKind()) {
          case HEADING -> headingSuffix(node, parent, index);
          case BULLET -> String.format(Locale.ROOT, "b%02d", index);
          case CONTAINER -> {
            String sanitized = sanitize(node.firstLine());
            yield sanitized.isEmpty() ? String.format(Locale.ROOT, "c%02d", index) : sanitized;
          }
        };
    return parentCode == null ? suffix : parentCode + "_" + suffix;
  }

  private static String headingSuffix(DraftNode node, DraftNode parent, int index) {
    String label = node.getLabel();
    if (label == null || sanitize(label).isEmpty()) {
      return String.format(Locale.ROOT, "h%02d", index);
    }
    if (parent != null
        && parent.getLabel() != null
        && label.startsWith(parent.getLabel() + ".")) {
      return sanitize(label.substring(parent.getLabel().length() + 1));
    }
    return sanitize(label);
  }

  static String sanitize(String raw) {
    return raw.toLowerCase(Locale.ROOT)
        .replaceAll("[^a-z0-9]+", "_")
        .replaceAll("^_+|_+$", "");
  }

  /**
   * Checks that codes are unique, that every parent code resolves to an earlier node and that
   * levels follow the parent chain.
   *
   * @throws StructuralParseException listing every violation found
   */
  public static void validate(List<OutlineNode> nodes) {
    List<String> violations = new ArrayList<>();
    Map<String, OutlineNode> seen = new HashMap<>();
    Set<String> allCodes = new HashSet<>();
    nodes.forEach(n -> allCodes.add(n.code()));

    for (OutlineNode node : nodes) {
      if (node.code() == null || node.code().isBlank()) {
        violations.add("blank code for '" + node.title() + "'");
        continue;
      }
      if (seen.containsKey(node.code())) {
        violations.add("duplicate code " + node.code());
        continue;
      }
      if (node.parentCode() == null) {
        if (node.level() != 0) {
          violations.add("root " + node.code() + " has level " + node.level());
        }
      } else {
        OutlineNode parent = seen.get(node.parentCode());
        if (parent == null) {
          violations.add(
              allCodes.contains(node.parentCode())
                  ? "parent " + node.parentCode() + " appears after child " + node.code()
                  : "dangling parent " + node.parentCode() + " for " + node.code());
        } else if (node.level() != parent.level() + 1) {
          violations.add(
              "level " + node.level() + " of " + node.code() + " does not follow its parent");
        }
      }
      seen.put(node.code(), node);
    }

    if (!violations.isEmpty()) {
      throw new StructuralParseException(violations);
    }
  }
}
