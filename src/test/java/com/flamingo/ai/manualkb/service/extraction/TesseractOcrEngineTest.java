package com.flamingo.ai.manualkb.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import java.awt.image.BufferedImage;
import java.io.IOException;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.TesseractException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class TesseractOcrEngineTest {

  private ITesseract tesseract;
  private ManualKbConfig.Ocr ocr;
  private BufferedImage page;

  @BeforeEach
  void setUp() {
    tesseract = mock(ITesseract.class);
    ocr = new ManualKbConfig.Ocr();
    page = new BufferedImage(20, 20, BufferedImage.TYPE_BYTE_GRAY);
  }

  @Test
  @DisplayName("Should configure language and data path from the OCR settings")
  void shouldConfigureTesseract() {
    // Given
    ocr.setLanguage("eng+deu");
    ocr.setDataPath("/opt/tessdata");

    // When
    new TesseractOcrEngine(tesseract, ocr);

    // Then
    verify(tesseract).setLanguage("eng+deu");
    verify(tesseract).setDatapath("/opt/tessdata");
  }

  @Test
  @DisplayName("Should keep the default data path when none is configured")
  void shouldKeepDefaultDataPath_whenBlank() {
    new TesseractOcrEngine(tesseract, ocr);

    verify(tesseract).setLanguage("eng");
    verify(tesseract, never()).setDatapath(any());
  }

  @Test
  @DisplayName("Should return the recognized text without surrounding whitespace")
  void shouldRecognizeText() throws Exception {
    // Given
    when(tesseract.doOCR(page)).thenReturn("\n Error 13.A1.B2 Paper jam \n\n");
    TesseractOcrEngine engine = new TesseractOcrEngine(tesseract, ocr);

    // When
    String text = engine.recognize(page, 4);

    // Then
    assertThat(text).isEqualTo("Error 13.A1.B2 Paper jam");
  }

  @Test
  @DisplayName("Should report a Tesseract failure as an IOException naming the page")
  void shouldWrapTesseractFailure() throws Exception {
    // Given
    when(tesseract.doOCR(page)).thenThrow(new TesseractException("no traineddata"));
    TesseractOcrEngine engine = new TesseractOcrEngine(tesseract, ocr);

    // When / Then
    assertThatThrownBy(() -> engine.recognize(page, 7))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("page 7")
        .hasCauseInstanceOf(TesseractException.class);
  }

  @Test
  @DisplayName("Should only register the engine when OCR is enabled")
  void shouldBeConditionalOnOcrEnabled() {
    ApplicationContextRunner runner =
        new ApplicationContextRunner()
            .withBean(ManualKbConfig.class)
            .withUserConfiguration(TesseractOcrEngine.class);

    runner.run(context -> assertThat(context).doesNotHaveBean(OcrEngine.class));
    runner
        .withPropertyValues("manualkb.ocr.enabled=true")
        .run(context -> assertThat(context).hasSingleBean(OcrEngine.class));
  }
}
