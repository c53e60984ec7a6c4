package com.flamingo.ai.curriculum.service.source;

import com.flamingo.ai.curriculum.service.outline.model.ExtractedSource;

/**
 * Extracts text lines, and where the format allows word geometry, from a source document.
 *
 * <p>Implementations must be stateless so one instance can serve concurrent imports.
 */
public interface SourceExtractor {

  /**
   * Extracts the document.
   *
   * @throws com.flamingo.ai.curriculum.exception.SourceDocumentException if the bytes cannot be
   *     read as {@code document.mimeType()}
   */
  ExtractedSource extract(SourceDocument document);

  /** Returns {@code true} if this extractor can handle the given MIME type. */
  boolean supports(String mimeType);
}
