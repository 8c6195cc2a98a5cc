package com.flamingo.ai.manualkb.service.collaborator;

import java.util.Optional;

/** Describes images with a vision-capable model. */
public interface VisionAnalysisService {

  /**
   * Describes an image for search.
   *
   * @param image encoded image bytes
   * @param mimeType image MIME type
   * @return a short description, empty when the model returns nothing useful
   */
  Optional<String> describe(byte[] image, String mimeType);
}
