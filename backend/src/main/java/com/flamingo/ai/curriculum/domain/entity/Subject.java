package com.flamingo.ai.curriculum.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A subject specification that owns exactly one topic tree. */
@Entity
@Table(
    name = "subjects",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_subject_natural_key",
            columnNames = {"exam_board", "qualification", "subject_code"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Subject {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "exam_board", nullable = false, length = 64)
  private String examBoard;

  @Column(nullable = false, length = 64)
  private String qualification;

  @Column(name = "subject_code", nullable = false, length = 64)
  private String subjectCode;

  @Column(nullable = false)
  private String displayName;

  @Column(columnDefinition = "TEXT")
  private String sourceUri;

  /** Node count of the stored tree; 0 while the subject has no tree. */
  @Builder.Default
  private int nodeCount = 0;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  private LocalDateTime lastSyncedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Records a successful tree replacement. */
  public void markSynced(int nodeCount) {
    this.nodeCount = nodeCount;
    this.lastSyncedAt = LocalDateTime.now();
  }
}
