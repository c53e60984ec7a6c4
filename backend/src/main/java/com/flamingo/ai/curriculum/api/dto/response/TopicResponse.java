package com.flamingo.ai.curriculum.api.dto.response;

import com.flamingo.ai.curriculum.domain.entity.TopicNode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one topic node. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicResponse {

  private UUID id;
  private String code;
  private String title;
  private int level;
  private UUID parentId;

  /** Only filled when the parent is part of the same response. */
  private String parentCode;

  /** Creates a TopicResponse from a TopicNode entity. */
  public static TopicResponse fromEntity(TopicNode node) {
    return TopicResponse.builder()
        .id(node.getId())
        .code(node.getCode())
        .title(node.getTitle())
        .level(node.getLevel())
        .parentId(node.getParentId())
        .build();
  }

  /** Converts a whole tree, resolving parent codes within it. */
  public static List<TopicResponse> fromTree(List<TopicNode> nodes) {
    Map<UUID, String> codes = new HashMap<>();
    nodes.forEach(n -> codes.put(n.getId(), n.getCode()));
    return nodes.stream()
        .map(
            n -> {
              TopicResponse response = fromEntity(n);
              response.setParentCode(n.getParentId() == null ? null : codes.get(n.getParentId()));
              return response;
            })
        .toList();
  }
}
