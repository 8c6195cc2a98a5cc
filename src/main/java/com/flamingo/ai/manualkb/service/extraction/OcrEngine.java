package com.flamingo.ai.manualkb.service.extraction;

import java.awt.image.BufferedImage;
import java.io.IOException;

/** Optical character recognition collaborator used for pages without a text layer. */
public interface OcrEngine {

  /**
   * Recognizes the text of a rendered page.
   *
   * @param pageImage page rendered as a grayscale image
   * @param pageNumber 1-based page number, for logging
   * @return recognized text, empty when nothing was recognized
   * @throws IOException when the engine fails
   */
  String recognize(BufferedImage pageImage, int pageNumber) throws IOException;
}
