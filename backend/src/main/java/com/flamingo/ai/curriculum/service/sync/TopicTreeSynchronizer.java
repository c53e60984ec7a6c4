package com.flamingo.ai.curriculum.service.sync;

import com.flamingo.ai.curriculum.config.OutlineConfig;
import com.flamingo.ai.curriculum.domain.entity.Subject;
import com.flamingo.ai.curriculum.exception.StoreWriteException;
import com.flamingo.ai.curriculum.exception.StructuralParseException;
import com.flamingo.ai.curriculum.service.outline.materialize.TreeMaterializer;
import com.flamingo.ai.curriculum.service.outline.model.OutlineNode;
import com.flamingo.ai.curriculum.service.outline.model.SubjectKey;
import com.flamingo.ai.curriculum.service.subject.SubjectDetails;
import com.flamingo.ai.curriculum.service.subject.SubjectService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Upserts a subject and replaces its stored tree with a freshly parsed one.
 *
 * <p>The new tree is checked before anything is deleted: an empty tree, one below {@code
 * outline.sync.min-node-count}, or one that fails structural validation aborts with {@link
 * SyncStatus#GUARD_ABORTED} and leaves the stored tree as it was. Syncs of the same subject are
 * serialized within this process; the writer's row lock covers other processes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopicTreeSynchronizer {

  private final SubjectService subjectService;
  private final TopicTreeWriter topicTreeWriter;
  private final OutlineConfig outlineConfig;
  private final MeterRegistry meterRegistry;

  private final ConcurrentMap<SubjectKey, SubjectLock> locks = new ConcurrentHashMap<>();

  /**
   * Synchronizes {@code nodes} into the store for {@code key}.
   *
   * @throws StoreWriteException if the replacement fails; the transaction is rolled back and the
   *     run must be repeated from the start
   */
  @Timed(value = "outline.sync", description = "Time taken to replace a subject's topic tree")
  public SyncResult sync(SubjectKey key, SubjectDetails details, List<OutlineNode> nodes) {
    SubjectLock lock = acquire(key);
    try {
      Subject subject = upsertSubject(key, details);

      String rejection = checkGuard(nodes);
      if (rejection != null) {
        meterRegistry.counter("outline.sync.guard_aborted").increment();
        log.warn("Sync of {} aborted, stored tree kept: {}", key, rejection);
        return SyncResult.guardAborted(subject.getId(), rejection);
      }

      TopicTreeWriter.ReplaceSummary summary;
      try {
        summary = topicTreeWriter.replaceTree(subject.getId(), nodes);
      } catch (DataAccessException e) {
        log.error("Store write failed for {}: {}", key, e.getMessage(), e);
        throw new StoreWriteException(key, "Tree replacement failed: " + e.getMessage(), e);
      }
      meterRegistry.counter("outline.sync.persisted").increment(summary.inserted());
      return SyncResult.synced(subject.getId(), summary);
    } finally {
      release(key, lock);
    }
  }

  private SubjectLock acquire(SubjectKey key) {
    SubjectLock lock =
        locks.compute(
            key,
            (k, existing) -> {
              SubjectLock held = existing != null ? existing : new SubjectLock();
              held.users++;
              return held;
            });
    lock.mutex.lock();
    return lock;
  }

  private void release(SubjectKey key, SubjectLock lock) {
    lock.mutex.unlock();
    locks.computeIfPresent(key, (k, held) -> --held.users == 0 ? null : held);
  }

  /** Subjects with a sync running or waiting. */
  int lockedSubjectCount() {
    return locks.size();
  }

  private Subject upsertSubject(SubjectKey key, SubjectDetails details) {
    try {
      return subjectService.upsert(key, details);
    } catch (DataIntegrityViolationException e) {
      // another process inserted the same natural key first; the second attempt finds it
      log.info("Concurrent insert of subject {}, retrying upsert", key);
      return subjectService.upsert(key, details);
    }
  }

  private String checkGuard(List<OutlineNode> nodes) {
    if (nodes == null || nodes.isEmpty()) {
      return "parsed tree is empty";
    }
    int minimum = outlineConfig.getSync().getMinNodeCount();
    if (nodes.size() < minimum) {
      return "parsed tree has " + nodes.size() + " node(s), minimum is " + minimum;
    }
    try {
      TreeMaterializer.validate(nodes);
    } catch (StructuralParseException e) {
      return "parsed tree is invalid: " + String.join("; ", e.getViolations());
    }
    return null;
  }

  /** Per-subject mutex; {@code users} is only touched inside the map's atomic compute calls. */
  private static final class SubjectLock {
    private final ReentrantLock mutex = new ReentrantLock();
    private int users;
  }
}
