package com.flamingo.ai.curriculum.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One node of a subject's topic tree.
 *
 * <p>{@code parentId} is written by a bulk update after all nodes of a tree are inserted; the
 * read-only {@code parent} association only carries the foreign key.
 */
@Entity
@Table(
    name = "topic_nodes",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_topic_node_code",
            columnNames = {"subject_id", "code"}),
    indexes = {
      @Index(name = "idx_topic_node_parent", columnList = "parent_id"),
      @Index(name = "idx_topic_node_subject_level", columnList = "subject_id, node_level")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TopicNode {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "subject_id", nullable = false)
  private Subject subject;

  @Column(nullable = false)
  private String code;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String title;

  @Column(name = "node_level", nullable = false)
  private int level;

  /** Position in document (pre-)order within the subject. */
  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "parent_id")
  private UUID parentId;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "parent_id", insertable = false, updatable = false)
  private TopicNode parent;
}
