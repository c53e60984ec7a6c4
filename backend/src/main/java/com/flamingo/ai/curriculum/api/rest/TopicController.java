package com.flamingo.ai.curriculum.api.rest;

import com.flamingo.ai.curriculum.api.dto.response.TopicResponse;
import com.flamingo.ai.curriculum.service.subject.TopicService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for browsing a tree one level at a time. */
@RestController
@RequestMapping("/api/topics")
@RequiredArgsConstructor
public class TopicController {

  private final TopicService topicService;

  /** Gets the direct children of a topic. */
  @GetMapping("/{topicId}/children")
  public ResponseEntity<List<TopicResponse>> getChildren(@PathVariable UUID topicId) {
    return ResponseEntity.ok(
        topicService.getChildren(topicId).stream().map(TopicResponse::fromEntity).toList());
  }
}
