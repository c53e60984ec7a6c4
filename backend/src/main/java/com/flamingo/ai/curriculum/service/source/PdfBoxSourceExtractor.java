package com.flamingo.ai.curriculum.service.source;

import com.flamingo.ai.curriculum.exception.SourceDocumentException;
import com.flamingo.ai.curriculum.service.outline.model.ExtractedSource;
import com.flamingo.ai.curriculum.service.outline.model.PositionedWord;
import com.flamingo.ai.curriculum.service.outline.model.SourceLine;
import com.flamingo.ai.curriculum.service.outline.model.TableRegion;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * {@link SourceExtractor} for PDF documents.
 *
 * <p>Uses Apache PDFBox 3.x with position sorting to emit both text lines and per-word bounding
 * boxes, then asks {@link TableRegionLocator} for table regions.
 */
@Service
@Order(10)
@RequiredArgsConstructor
@Slf4j
public class PdfBoxSourceExtractor implements SourceExtractor {

  private final TableRegionLocator tableRegionLocator;

  @Override
  public ExtractedSource extract(SourceDocument document) {
    try (PDDocument pdf = Loader.loadPDF(document.content())) {
      GeometryStripper stripper = new GeometryStripper();
      stripper.getText(pdf);
      List<PositionedWord> words = stripper.getWords();
      List<TableRegion> regions = tableRegionLocator.locate(words);
      log.debug(
          "PDF {}: {} pages, {} lines, {} words, {} table region(s)",
          document.uri(),
          pdf.getNumberOfPages(),
          stripper.getLines().size(),
          words.size(),
          regions.size());
      return new ExtractedSource(stripper.getLines(), words, regions);
    } catch (IOException e) {
      log.error("PDFBox parsing failed for {}: {}", document.uri(), e.getMessage());
      throw new SourceDocumentException(
          document.uri(), "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    return "application/pdf".equalsIgnoreCase(mimeType);
  }

  /** Collects words with bounding boxes and groups them into lines by baseline. */
  private static final class GeometryStripper extends PDFTextStripper {

    private static final float SAME_LINE_TOLERANCE = 2.0f;

    private final List<SourceLine> lines = new ArrayList<>();
    private final List<PositionedWord> words = new ArrayList<>();
    private final List<PositionedWord> currentLine = new ArrayList<>();
    private final List<TextPosition> currentWord = new ArrayList<>();

    GeometryStripper() throws IOException {
      super();
      setSortByPosition(true);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
      for (TextPosition position : textPositions) {
        if (!currentWord.isEmpty()
            && Math.abs(position.getYDirAdj() - currentWord.get(0).getYDirAdj())
                > SAME_LINE_TOLERANCE) {
          flushWord();
        }
        if (position.getUnicode() == null || position.getUnicode().isBlank()) {
          flushWord();
        } else {
          currentWord.add(position);
        }
      }
      // segments handed over separately are separate words
      flushWord();
      super.writeString(text, textPositions);
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
      flushWord();
      flushLine();
      super.endPage(page);
    }

    private void flushWord() {
      if (currentWord.isEmpty()) {
        return;
      }
      String text =
          currentWord.stream().map(TextPosition::getUnicode).collect(Collectors.joining());
      TextPosition first = currentWord.get(0);
      TextPosition last = currentWord.get(currentWord.size() - 1);
      float top = Float.MAX_VALUE;
      float bottom = 0;
      for (TextPosition p : currentWord) {
        top = Math.min(top, p.getYDirAdj() - p.getHeightDir());
        bottom = Math.max(bottom, p.getYDirAdj());
      }
      PositionedWord word =
          new PositionedWord(
              text.strip(),
              first.getXDirAdj(),
              last.getXDirAdj() + last.getWidthDirAdj(),
              top,
              bottom,
              getCurrentPageNo());
      currentWord.clear();

      if (!currentLine.isEmpty()
          && Math.abs(word.bottom() - currentLine.get(0).bottom()) > SAME_LINE_TOLERANCE) {
        flushLine();
      }
      currentLine.add(word);
      words.add(word);
    }

    private void flushLine() {
      if (currentLine.isEmpty()) {
        return;
      }
      String text =
          currentLine.stream().map(PositionedWord::text).collect(Collectors.joining(" "));
      float top = (float) currentLine.stream().mapToDouble(PositionedWord::top).min().orElse(0);
      lines.add(new SourceLine(currentLine.get(0).pageNumber(), text, top));
      currentLine.clear();
    }

    List<SourceLine> getLines() {
      return lines;
    }

    List<PositionedWord> getWords() {
      return words;
    }
  }
}
