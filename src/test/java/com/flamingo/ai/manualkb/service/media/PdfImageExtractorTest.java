package com.flamingo.ai.manualkb.service.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import com.flamingo.ai.manualkb.domain.model.ContentHash;
import com.flamingo.ai.manualkb.domain.model.PageImage;
import com.flamingo.ai.manualkb.support.TestPdfs;
import java.awt.Color;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfImageExtractorTest {

  @TempDir Path tempDir;

  private ManualKbConfig config;
  private PdfImageExtractor extractor;

  @BeforeEach
  void setUp() {
    config = new ManualKbConfig();
    extractor = new PdfImageExtractor(config);
  }

  @Test
  @DisplayName("Should extract painted images, skipping small ones and repeated content")
  void shouldExtractUniqueImages() throws Exception {
    // Given
    Path pdf =
        TestPdfs.builder()
            .page("Fuser location")
            .page("Fuser location again")
            .page("Tray 2")
            .image(1, 200, 100, Color.RED)
            .image(1, 50, 50, Color.GREEN)
            .image(2, 200, 100, Color.RED)
            .image(3, 120, 120, Color.BLUE)
            .writeTo(tempDir, "images.pdf");

    // When
    List<PageImage> images = extractor.extract(pdf);

    // Then
    assertThat(images).hasSize(2);
    assertThat(images).extracting(PageImage::pageNumber).containsExactly(1, 3);
    assertThat(images).extracting(PageImage::imageIndex).containsExactly(0, 1);
    PageImage first = images.get(0);
    assertThat(first.width()).isEqualTo(200);
    assertThat(first.height()).isEqualTo(100);
    assertThat(first.mimeType()).isEqualTo("image/png");
    assertThat(first.fileHash()).isEqualTo(ContentHash.sha256Hex(first.data()));
    assertThat(first.storageUrl()).isNull();
  }

  @Test
  @DisplayName("Should stop at the per-document image limit")
  void shouldRespectImageLimit() throws Exception {
    // Given
    config.getImages().setMaxImagesPerDocument(1);
    Path pdf =
        TestPdfs.builder()
            .page("One")
            .page("Two")
            .image(1, 200, 100, Color.RED)
            .image(2, 200, 100, Color.BLUE)
            .writeTo(tempDir, "limit.pdf");

    // When / Then
    assertThat(extractor.extract(pdf)).hasSize(1);
  }

  @Test
  @DisplayName("Should return nothing when image extraction is disabled")
  void shouldReturnEmpty_whenDisabled() throws Exception {
    config.getImages().setEnabled(false);

    assertThat(extractor.extract(tempDir.resolve("never-read.pdf"))).isEmpty();
  }

  @Test
  @DisplayName("Should fail when the file cannot be opened")
  void shouldThrow_whenFileMissing() {
    assertThatThrownBy(() -> extractor.extract(tempDir.resolve("missing.pdf")))
        .isInstanceOf(IOException.class);
  }
}
