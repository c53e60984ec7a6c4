package com.flamingo.ai.curriculum.service.subject;

import com.flamingo.ai.curriculum.domain.entity.TopicNode;
import com.flamingo.ai.curriculum.domain.repository.SubjectRepository;
import com.flamingo.ai.curriculum.domain.repository.TopicNodeRepository;
import com.flamingo.ai.curriculum.exception.SubjectNotFoundException;
import com.flamingo.ai.curriculum.exception.TopicNotFoundException;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the TopicService. */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TopicServiceImpl implements TopicService {

  private final SubjectRepository subjectRepository;
  private final TopicNodeRepository topicNodeRepository;

  @Override
  public List<TopicNode> getTopics(UUID subjectId) {
    requireSubject(subjectId);
    return topicNodeRepository.findBySubjectIdOrderBySortOrderAsc(subjectId);
  }

  @Override
  public List<TopicNode> getRootTopics(UUID subjectId) {
    requireSubject(subjectId);
    return topicNodeRepository.findBySubjectIdAndParentIdIsNullOrderBySortOrderAsc(subjectId);
  }

  @Override
  public List<TopicNode> getChildren(UUID topicId) {
    if (!topicNodeRepository.existsById(topicId)) {
      throw new TopicNotFoundException(topicId);
    }
    return topicNodeRepository.findByParentIdOrderBySortOrderAsc(topicId);
  }

  @Override
  public SortedMap<Integer, Long> getLevelCounts(UUID subjectId) {
    requireSubject(subjectId);
    SortedMap<Integer, Long> counts = new TreeMap<>();
    for (Object[] row : topicNodeRepository.countByLevel(subjectId)) {
      counts.put(((Number) row[0]).intValue(), ((Number) row[1]).longValue());
    }
    return counts;
  }

  private void requireSubject(UUID subjectId) {
    if (!subjectRepository.existsById(subjectId)) {
      throw new SubjectNotFoundException(subjectId);
    }
  }
}
