package com.flamingo.ai.manualkb.service.extraction;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

/**
 * Renders failed pages with PDFBox and hands them to the {@link OcrEngine}, one page at a time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OcrFallback {

  private final ManualKbConfig config;
  private final Optional<OcrEngine> ocrEngine;

  public boolean isAvailable() {
    return config.getOcr().isEnabled() && ocrEngine.isPresent();
  }

  /**
   * Recognizes the given pages.
   *
   * @param pdf PDF file
   * @param pages 1-based pages to recover
   * @return recognized non-blank text per page; pages that fail again are absent
   */
  public Map<Integer, String> recover(Path pdf, Collection<Integer> pages) {
    Map<Integer, String> recovered = new LinkedHashMap<>();
    if (!isAvailable() || pages.isEmpty()) {
      return recovered;
    }
    OcrEngine engine = ocrEngine.get();
    try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
      PDFRenderer renderer = new PDFRenderer(document);
      for (int page : pages) {
        if (page < 1 || page > document.getNumberOfPages()) {
          continue;
        }
        try {
          BufferedImage image =
              renderer.renderImageWithDPI(page - 1, config.getOcr().getRenderDpi(), ImageType.GRAY);
          String text = engine.recognize(image, page);
          if (text != null && !text.isBlank()) {
            recovered.put(page, text);
          }
        } catch (IOException | RuntimeException e) {
          log.warn("OCR failed for page {} of {}: {}", page, pdf.getFileName(), e.getMessage());
        }
      }
    } catch (IOException e) {
      log.warn("OCR fallback could not open {}: {}", pdf.getFileName(), e.getMessage());
    }
    log.info("OCR recovered {}/{} pages of {}", recovered.size(), pages.size(), pdf.getFileName());
    return recovered;
  }
}
