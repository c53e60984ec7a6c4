package com.flamingo.ai.curriculum.domain.repository;

import com.flamingo.ai.curriculum.domain.entity.TopicNode;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for TopicNode entities. */
@Repository
public interface TopicNodeRepository extends JpaRepository<TopicNode, UUID> {

  /** Finds a subject's nodes in document order. */
  List<TopicNode> findBySubjectIdOrderBySortOrderAsc(UUID subjectId);

  /** Finds a subject's root nodes. */
  List<TopicNode> findBySubjectIdAndParentIdIsNullOrderBySortOrderAsc(UUID subjectId);

  /** Finds the children of a node. */
  List<TopicNode> findByParentIdOrderBySortOrderAsc(UUID parentId);

  /** Counts nodes by subject. */
  long countBySubjectId(UUID subjectId);

  /** Deepest level of a subject's tree, or null when the subject has no nodes. */
  @Query("SELECT MAX(n.level) FROM TopicNode n WHERE n.subject.id = :subjectId")
  Integer findMaxLevel(@Param("subjectId") UUID subjectId);

  /** Ids of one level of a subject's tree, a page at a time. */
  @Query(
      "SELECT n.id FROM TopicNode n "
          + "WHERE n.subject.id = :subjectId AND n.level = :level ORDER BY n.id")
  List<UUID> findIdsBySubjectAndLevel(
      @Param("subjectId") UUID subjectId, @Param("level") int level, Pageable pageable);

  /** Points every node in {@code ids} at {@code parentId}. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE TopicNode n SET n.parentId = :parentId WHERE n.id IN :ids")
  int updateParent(@Param("parentId") UUID parentId, @Param("ids") Collection<UUID> ids);

  /** Node counts per level as {@code [level, count]} pairs. */
  @Query(
      "SELECT n.level, COUNT(n) FROM TopicNode n WHERE n.subject.id = :subjectId "
          + "GROUP BY n.level ORDER BY n.level")
  List<Object[]> countByLevel(@Param("subjectId") UUID subjectId);
}
