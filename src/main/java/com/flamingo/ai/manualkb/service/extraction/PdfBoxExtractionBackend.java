package com.flamingo.ai.manualkb.service.extraction;

import com.flamingo.ai.manualkb.domain.enums.ExtractionEngine;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Component;

/**
 * {@link TextExtractionBackend} built on Apache PDFBox 3.x.
 *
 * <p>Pages are stripped one at a time so a broken content stream only costs its own page. While
 * stripping, glyph runs are regrouped into visual lines for the structured layout scanner.
 */
@Component
@Slf4j
public class PdfBoxExtractionBackend implements TextExtractionBackend {

  private static final float LINE_TOLERANCE = 2.0f;

  @Override
  public ExtractionEngine engine() {
    return ExtractionEngine.PDFBOX;
  }

  @Override
  public BackendExtraction extract(Path pdf) throws IOException {
    try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
      int pageCount = document.getNumberOfPages();
      Map<Integer, String> pageTexts = new HashMap<>();
      Map<Integer, List<PositionedLine>> pageLines = new HashMap<>();
      Set<Integer> failedPages = new HashSet<>();

      for (int page = 1; page <= pageCount; page++) {
        try {
          LineCollectingStripper stripper = new LineCollectingStripper();
          stripper.setStartPage(page);
          stripper.setEndPage(page);
          String text = stripper.getText(document);
          if (text == null || text.isBlank()) {
            failedPages.add(page);
            continue;
          }
          pageTexts.put(page, text);
          pageLines.put(page, stripper.getLines());
        } catch (IOException | RuntimeException e) {
          log.warn("PDFBox could not extract page {} of {}: {}", page, pdf, e.getMessage());
          failedPages.add(page);
        }
      }

      PDDocumentInformation info = document.getDocumentInformation();
      String rawDate = info.getCOSObject().getString(COSName.CREATION_DATE);
      log.debug(
          "PDFBox extracted {}/{} pages from {}", pageTexts.size(), pageCount, pdf.getFileName());
      return new BackendExtraction(
          ExtractionEngine.PDFBOX,
          pageTexts,
          pageLines,
          failedPages,
          pageCount,
          blankToNull(info.getTitle()),
          blankToNull(info.getAuthor()),
          PdfDates.parse(rawDate));
    }
  }

  // ---- private helpers ----

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.strip();
  }

  // ---- inner types ----

  /** Rebuilds visual lines from the stripper's positioned glyph runs. */
  private static final class LineCollectingStripper extends PDFTextStripper {

    private final List<PositionedLine> lines = new ArrayList<>();
    private final StringBuilder currentLine = new StringBuilder();
    private float lastY = Float.NaN;

    LineCollectingStripper() {
      super();
      setSortByPosition(true);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
      if (!textPositions.isEmpty()) {
        float y = textPositions.get(0).getYDirAdj();
        if (!Float.isNaN(lastY) && Math.abs(y - lastY) > LINE_TOLERANCE) {
          flushLine();
        }
        if (currentLine.length() == 0) {
          lastY = y;
        }
      }
      currentLine.append(text);
      super.writeString(text, textPositions);
    }

    @Override
    protected void writeWordSeparator() throws IOException {
      currentLine.append(' ');
      super.writeWordSeparator();
    }

    @Override
    protected void writeLineSeparator() throws IOException {
      flushLine();
      super.writeLineSeparator();
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
      flushLine();
      super.endPage(page);
    }

    private void flushLine() {
      String text = currentLine.toString().strip();
      if (!text.isEmpty()) {
        lines.add(new PositionedLine(lastY, text));
      }
      currentLine.setLength(0);
      lastY = Float.NaN;
    }

    List<PositionedLine> getLines() {
      return List.copyOf(lines);
    }
  }
}
