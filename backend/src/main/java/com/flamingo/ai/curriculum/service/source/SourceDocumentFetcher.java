package com.flamingo.ai.curriculum.service.source;

import com.flamingo.ai.curriculum.config.OutlineConfig;
import com.flamingo.ai.curriculum.exception.SourceDocumentException;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

/**
 * Loads a source document from an {@code http(s)} URL, a {@code file:} URI or a plain path.
 *
 * <p>Remote documents are fetched with a single blocking call; there is no retry.
 */
@Component
@Slf4j
public class SourceDocumentFetcher {

  private static final Tika TIKA = new Tika();

  private final WebClient webClient;
  private final int fetchTimeoutMs;
  private final int maxDocumentBytes;

  public SourceDocumentFetcher(OutlineConfig outlineConfig) {
    OutlineConfig.Source source = outlineConfig.getSource();
    this.fetchTimeoutMs = source.getFetchTimeoutMs();
    this.maxDocumentBytes = source.getMaxDocumentBytes();
    this.webClient =
        WebClient.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxDocumentBytes))
            .build();
  }

  /**
   * Fetches {@code uri}.
   *
   * @throws SourceDocumentException if the document cannot be read or is too large
   */
  public SourceDocument fetch(String uri) {
    if (uri == null || uri.isBlank()) {
      throw new SourceDocumentException(uri, "Source URI is blank", "A source URI is required");
    }
    String lower = uri.toLowerCase(Locale.ROOT);
    byte[] content =
        lower.startsWith("http://") || lower.startsWith("https://")
            ? download(uri)
            : readFile(uri);
    if (content.length > maxDocumentBytes) {
      throw new SourceDocumentException(
          uri,
          "Document is " + content.length + " bytes, limit is " + maxDocumentBytes,
          "Source document is too large");
    }
    String mimeType = TIKA.detect(content, fileName(uri));
    log.info("Fetched {} ({} bytes, {})", uri, content.length, mimeType);
    return new SourceDocument(uri, content, mimeType);
  }

  private byte[] download(String uri) {
    byte[] body;
    try {
      body =
          webClient
              .get()
              .uri(URI.create(uri))
              .retrieve()
              .bodyToMono(byte[].class)
              .timeout(Duration.ofMillis(fetchTimeoutMs))
              .block();
    } catch (WebClientException e) {
      log.error("Download failed for {}: {}", uri, e.getMessage());
      throw new SourceDocumentException(uri, "Download failed: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      // timeouts surface from block() as a propagated TimeoutException
      log.error("Download of {} did not complete: {}", uri, e.toString());
      throw new SourceDocumentException(uri, "Download did not complete: " + e, e);
    }
    if (body == null) {
      throw new SourceDocumentException(uri, "Empty response body", "Source document is empty");
    }
    return body;
  }

  private byte[] readFile(String uri) {
    Path path = uri.startsWith("file:") ? Path.of(URI.create(uri)) : Path.of(uri);
    if (!Files.isRegularFile(path)) {
      throw new SourceDocumentException(
          uri, "No such file: " + path, "Source document was not found");
    }
    try {
      return Files.readAllBytes(path);
    } catch (IOException e) {
      log.error("Could not read {}: {}", path, e.getMessage());
      throw new SourceDocumentException(uri, "Could not read file: " + e.getMessage(), e);
    }
  }

  private static String fileName(String uri) {
    String trimmed = uri.replaceAll("[?#].*$", "");
    int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
    return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
  }
}
