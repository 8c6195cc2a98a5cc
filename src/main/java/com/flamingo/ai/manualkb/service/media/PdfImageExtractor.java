package com.flamingo.ai.manualkb.service.media;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import com.flamingo.ai.manualkb.domain.model.ContentHash;
import com.flamingo.ai.manualkb.domain.model.PageImage;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import javax.imageio.ImageIO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.contentstream.operator.OperatorProcessor;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;

/**
 * Extracts the images drawn on each PDF page.
 *
 * <p>Images are found by intercepting "Do" (draw XObject) operators, so only images that are
 * actually painted are returned; images inside form XObjects are followed. Each image is keyed by
 * the SHA-256 of its encoded bytes and a document never yields the same hash twice.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfImageExtractor {

  private final ManualKbConfig config;

  /**
   * Extracts images from a PDF.
   *
   * @param pdf PDF file
   * @return unique images in page order
   * @throws IOException when the file cannot be opened
   */
  public List<PageImage> extract(Path pdf) throws IOException {
    ManualKbConfig.Images settings = config.getImages();
    if (!settings.isEnabled()) {
      return List.of();
    }
    try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
      ImageCollector collector =
          new ImageCollector(settings.getMinPixelArea(), settings.getMaxImagesPerDocument());
      int pageNumber = 1;
      for (PDPage page : document.getPages()) {
        if (collector.isFull()) {
          log.warn(
              "Image limit {} reached at page {}",
              settings.getMaxImagesPerDocument(),
              pageNumber);
          break;
        }
        collector.currentPage = pageNumber;
        try {
          collector.processPage(page);
        } catch (IOException e) {
          log.warn("Could not read images on page {}: {}", pageNumber, e.getMessage());
        }
        pageNumber++;
      }
      log.debug("Extracted {} images from {}", collector.images.size(), pdf.getFileName());
      return collector.images;
    }
  }

  // ---- inner types ----

  /** Stream engine that converts every painted image XObject into a {@link PageImage}. */
  private static final class ImageCollector extends PDFStreamEngine {

    private final List<PageImage> images = new ArrayList<>();
    private final Set<String> seenHashes = new HashSet<>();
    private final int minPixelArea;
    private final int maxImages;
    private int currentPage;

    ImageCollector(int minPixelArea, int maxImages) {
      this.minPixelArea = minPixelArea;
      this.maxImages = maxImages;
      addOperator(new DrawObject(this));
    }

    boolean isFull() {
      return images.size() >= maxImages;
    }

    void accept(PDImageXObject image) {
      if (isFull() || (long) image.getWidth() * image.getHeight() < minPixelArea) {
        return;
      }
      try {
        BufferedImage buffered = image.getImage();
        if (buffered == null) {
          return;
        }
        String format = image.getSuffix();
        if (format == null || format.isBlank() || "jpx".equals(format) || "jb2".equals(format)) {
          format = "png";
        }
        format = format.toLowerCase(Locale.ROOT);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(buffered, format, out)) {
          format = "png";
          out.reset();
          ImageIO.write(buffered, format, out);
        }
        byte[] data = out.toByteArray();
        String hash = ContentHash.sha256Hex(data);
        if (!seenHashes.add(hash)) {
          return;
        }
        images.add(
            PageImage.builder()
                .pageNumber(currentPage)
                .imageIndex(images.size())
                .fileHash(hash)
                .mimeType("image/" + ("jpg".equals(format) ? "jpeg" : format))
                .data(data)
                .width(buffered.getWidth())
                .height(buffered.getHeight())
                .build());
      } catch (IOException e) {
        log.warn("Could not decode image on page {}: {}", currentPage, e.getMessage());
      }
    }
  }

  /** Processes "Do" commands; descends into forms, converts images. */
  private static final class DrawObject extends OperatorProcessor {

    private final ImageCollector collector;

    DrawObject(ImageCollector collector) {
      super(collector);
      this.collector = collector;
    }

    @Override
    public void process(Operator operator, List<COSBase> operands) throws IOException {
      if (operands.isEmpty() || !(operands.get(0) instanceof COSName name)) {
        return;
      }
      PDXObject xObject = collector.getResources().getXObject(name);
      if (xObject instanceof PDImageXObject image) {
        collector.accept(image);
      } else if (xObject instanceof PDFormXObject form) {
        collector.showForm(form);
      }
    }

    @Override
    public String getName() {
      return OperatorName.DRAW_OBJECT;
    }
  }
}
