package com.flamingo.ai.manualkb.service.extraction;

import com.flamingo.ai.manualkb.domain.model.DocumentMetadata;

/**
 * Language detection outcome.
 *
 * @param language ISO 639-1 code, or {@code unknown}
 * @param confidence detector probability, 0 when unknown
 */
public record DetectedLanguage(String language, double confidence) {

  public static DetectedLanguage unknown() {
    return new DetectedLanguage(DocumentMetadata.UNKNOWN_LANGUAGE, 0.0);
  }

  public boolean isKnown() {
    return !DocumentMetadata.UNKNOWN_LANGUAGE.equals(language);
  }
}
