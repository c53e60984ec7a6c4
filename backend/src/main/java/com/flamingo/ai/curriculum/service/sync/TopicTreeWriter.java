package com.flamingo.ai.curriculum.service.sync;

import com.flamingo.ai.curriculum.config.OutlineConfig;
import com.flamingo.ai.curriculum.domain.entity.Subject;
import com.flamingo.ai.curriculum.domain.entity.TopicNode;
import com.flamingo.ai.curriculum.domain.repository.SubjectRepository;
import com.flamingo.ai.curriculum.domain.repository.TopicNodeRepository;
import com.flamingo.ai.curriculum.exception.SubjectNotFoundException;
import com.flamingo.ai.curriculum.service.outline.model.OutlineNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Replaces a subject's stored tree in one transaction: delete the old nodes deepest level first,
 * insert the new nodes without parents, then link parents with one bulk update per parent.
 *
 * <p>Inserting first and linking second keeps every insert independent of generated parent ids.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopicTreeWriter {

  private final SubjectRepository subjectRepository;
  private final TopicNodeRepository topicNodeRepository;
  private final OutlineConfig outlineConfig;

  /**
   * Replaces the tree of {@code subjectId} with {@code nodes}, which must be a validated pre-order
   * node list. Any failure rolls back the whole replacement.
   */
  @Transactional
  public ReplaceSummary replaceTree(UUID subjectId, List<OutlineNode> nodes) {
    Subject subject =
        subjectRepository
            .findByIdForUpdate(subjectId)
            .orElseThrow(() -> new SubjectNotFoundException(subjectId));

    int deleted = deleteExisting(subjectId);
    Map<String, UUID> idsByCode = insert(subject, nodes);
    // flushed by the relink's automatic flush, before the persistence context is cleared
    subject.markSynced(nodes.size());
    int linked = relink(nodes, idsByCode);

    log.info(
        "Replaced tree of subject {}: deleted={}, inserted={}, linked={}",
        subjectId,
        deleted,
        idsByCode.size(),
        linked);
    return new ReplaceSummary(deleted, idsByCode.size(), linked);
  }

  private int deleteExisting(UUID subjectId) {
    Integer maxLevel = topicNodeRepository.findMaxLevel(subjectId);
    if (maxLevel == null) {
      return 0;
    }
    int batchSize = outlineConfig.getSync().getDeleteBatchSize();
    int deleted = 0;
    for (int level = maxLevel; level >= 0; level--) {
      List<UUID> ids;
      do {
        ids =
            topicNodeRepository.findIdsBySubjectAndLevel(
                subjectId, level, PageRequest.of(0, batchSize));
        if (!ids.isEmpty()) {
          topicNodeRepository.deleteAllByIdInBatch(ids);
          deleted += ids.size();
        }
      } while (ids.size() == batchSize);
      log.debug("Deleted level {} of subject {}", level, subjectId);
    }
    return deleted;
  }

  private Map<String, UUID> insert(Subject subject, List<OutlineNode> nodes) {
    int batchSize = outlineConfig.getSync().getInsertBatchSize();
    Map<String, UUID> idsByCode = new HashMap<>();
    List<TopicNode> batch = new ArrayList<>(batchSize);
    for (int i = 0; i < nodes.size(); i++) {
      OutlineNode node = nodes.get(i);
      batch.add(
          TopicNode.builder()
              .subject(subject)
              .code(node.code())
              .title(node.title())
              .level(node.level())
              .sortOrder(i)
              .build());
      if (batch.size() == batchSize || i == nodes.size() - 1) {
        for (TopicNode saved : topicNodeRepository.saveAll(batch)) {
          idsByCode.put(saved.getCode(), saved.getId());
        }
        topicNodeRepository.flush();
        batch = new ArrayList<>(batchSize);
      }
    }
    return idsByCode;
  }

  private int relink(List<OutlineNode> nodes, Map<String, UUID> idsByCode) {
    Map<UUID, List<UUID>> childrenByParent = new LinkedHashMap<>();
    for (OutlineNode node : nodes) {
      if (node.parentCode() != null) {
        UUID parentId = idsByCode.get(node.parentCode());
        if (parentId == null) {
          throw new IllegalStateException(
              "Parent " + node.parentCode() + " of " + node.code() + " was not inserted");
        }
        childrenByParent
            .computeIfAbsent(parentId, k -> new ArrayList<>())
            .add(idsByCode.get(node.code()));
      }
    }

    int batchSize = outlineConfig.getSync().getRelinkBatchSize();
    int linked = 0;
    for (Map.Entry<UUID, List<UUID>> entry : childrenByParent.entrySet()) {
      List<UUID> children = entry.getValue();
      for (int from = 0; from < children.size(); from += batchSize) {
        List<UUID> chunk = children.subList(from, Math.min(from + batchSize, children.size()));
        linked += topicNodeRepository.updateParent(entry.getKey(), chunk);
      }
    }
    return linked;
  }

  /** Counts from one replacement. */
  public record ReplaceSummary(int deleted, int inserted, int linked) {}
}
