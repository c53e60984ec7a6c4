package com.flamingo.ai.curriculum.service.source;

import com.flamingo.ai.curriculum.service.outline.model.ExtractedSource;
import com.flamingo.ai.curriculum.service.outline.model.SourceLine;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/** Reads {@code text/plain} sources; a form feed starts a new page. */
@Service
@Order(20)
public class PlainTextSourceExtractor implements SourceExtractor {

  @Override
  public ExtractedSource extract(SourceDocument document) {
    String text = new String(document.content(), StandardCharsets.UTF_8);
    return ExtractedSource.ofLines(toLines(text));
  }

  @Override
  public boolean supports(String mimeType) {
    return mimeType != null && mimeType.startsWith("text/plain");
  }

  static List<SourceLine> toLines(String text) {
    List<SourceLine> lines = new ArrayList<>();
    String[] pages = text.split("\f", -1);
    for (int page = 0; page < pages.length; page++) {
      for (String line : pages[page].split("\\r?\\n")) {
        lines.add(new SourceLine(page + 1, line));
      }
    }
    return lines;
  }
}
