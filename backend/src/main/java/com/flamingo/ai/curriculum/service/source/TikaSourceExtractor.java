package com.flamingo.ai.curriculum.service.source;

import com.flamingo.ai.curriculum.exception.SourceDocumentException;
import com.flamingo.ai.curriculum.service.outline.model.ExtractedSource;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Fallback {@link SourceExtractor} that flattens any format Tika understands (DOCX, HTML, ODT, …)
 * to text lines. No word geometry is produced, so tables in these sources are only split by the
 * keyword heuristic.
 */
@Service
@Order(100)
@Slf4j
public class TikaSourceExtractor implements SourceExtractor {

  private final Tika tika;

  public TikaSourceExtractor() {
    this.tika = new Tika();
    this.tika.setMaxStringLength(-1);
  }

  @Override
  public ExtractedSource extract(SourceDocument document) {
    log.debug("Tika extraction for {} ({})", document.uri(), document.mimeType());
    try {
      String text = tika.parseToString(new ByteArrayInputStream(document.content()));
      return ExtractedSource.ofLines(PlainTextSourceExtractor.toLines(text));
    } catch (IOException | TikaException e) {
      log.error("Tika extraction failed for {}: {}", document.uri(), e.getMessage());
      throw new SourceDocumentException(
          document.uri(), "Failed to extract text: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    // Catch-all fallback
    return true;
  }
}
