package com.flamingo.ai.manualkb.service.extraction;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import java.awt.image.BufferedImage;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * {@link OcrEngine} backed by a local Tesseract installation through tess4j. Only created when
 * {@code manualkb.ocr.enabled=true}; the native library is loaded on the first page.
 */
@Component
@ConditionalOnProperty(name = "manualkb.ocr.enabled", havingValue = "true")
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

  private final ITesseract tesseract;

  @Autowired
  public TesseractOcrEngine(ManualKbConfig config) {
    this(new Tesseract(), config.getOcr());
  }

  TesseractOcrEngine(ITesseract tesseract, ManualKbConfig.Ocr ocr) {
    this.tesseract = tesseract;
    if (ocr.getDataPath() != null && !ocr.getDataPath().isBlank()) {
      tesseract.setDatapath(ocr.getDataPath());
    }
    tesseract.setLanguage(ocr.getLanguage());
    log.info(
        "Tesseract OCR enabled (language={}, dataPath={})",
        ocr.getLanguage(),
        ocr.getDataPath() == null || ocr.getDataPath().isBlank() ? "default" : ocr.getDataPath());
  }

  @Override
  public String recognize(BufferedImage pageImage, int pageNumber) throws IOException {
    // one Tesseract handle per engine, not safe for concurrent pages
    synchronized (tesseract) {
      try {
        String text = tesseract.doOCR(pageImage);
        if (text == null) {
          return "";
        }
        log.debug("Tesseract recognized {} chars on page {}", text.length(), pageNumber);
        return text.strip();
      } catch (TesseractException e) {
        throw new IOException("Tesseract failed on page " + pageNumber, e);
      }
    }
  }
}
