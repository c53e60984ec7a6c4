package com.flamingo.ai.curriculum.service.subject;

import com.flamingo.ai.curriculum.domain.entity.TopicNode;
import java.util.List;
import java.util.SortedMap;
import java.util.UUID;

/** Read access to stored topic trees. */
public interface TopicService {

  /**
   * Gets a subject's whole tree in document order.
   *
   * @throws com.flamingo.ai.curriculum.exception.SubjectNotFoundException if not found
   */
  List<TopicNode> getTopics(UUID subjectId);

  /** Gets a subject's root topics. */
  List<TopicNode> getRootTopics(UUID subjectId);

  /**
   * Gets the direct children of a topic.
   *
   * @throws com.flamingo.ai.curriculum.exception.TopicNotFoundException if not found
   */
  List<TopicNode> getChildren(UUID topicId);

  /** Stored node count per level. */
  SortedMap<Integer, Long> getLevelCounts(UUID subjectId);
}
