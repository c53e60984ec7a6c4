package com.flamingo.ai.curriculum.exception;

import java.util.UUID;

/** Exception thrown when a topic node is not found. */
public class TopicNotFoundException extends RuntimeException {

  private final UUID topicId;

  public TopicNotFoundException(UUID topicId) {
    super("Topic not found: " + topicId);
    this.topicId = topicId;
  }

  public UUID getTopicId() {
    return topicId;
  }
}
