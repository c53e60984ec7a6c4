package com.flamingo.ai.curriculum.service.source;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Routes a MIME type to the highest-priority {@link SourceExtractor} that supports it.
 *
 * <p>Extractors are injected in {@code @Order} order; {@link TikaSourceExtractor} is the
 * catch-all.
 */
@Service
@RequiredArgsConstructor
public class SourceExtractorRouter {

  private final List<SourceExtractor> extractors;

  public SourceExtractor route(String mimeType) {
    return extractors.stream()
        .filter(e -> e.supports(mimeType))
        .findFirst()
        .orElseThrow(
            () -> new IllegalStateException("No SourceExtractor found for MIME type: " + mimeType));
  }
}
