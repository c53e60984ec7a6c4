package com.flamingo.ai.curriculum.service.source;

/**
 * Raw bytes of a fetched source document.
 *
 * @param uri where the document came from
 * @param content document bytes
 * @param mimeType detected MIME type, e.g. {@code application/pdf}
 */
public record SourceDocument(String uri, byte[] content, String mimeType) {

  public int size() {
    return content.length;
  }
}
