package com.flamingo.ai.manualkb.service.extraction;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.langdetect.optimaize.OptimaizeLangDetector;
import org.apache.tika.language.detect.LanguageDetector;
import org.apache.tika.language.detect.LanguageResult;
import org.springframework.stereotype.Service;

/**
 * Detects a document's language from a bounded sample of its first pages using Tika's Optimaize
 * detector.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LanguageDetectionService {

  private final ManualKbConfig config;

  private volatile LanguageDetector detector;

  /**
   * Detects the language of the leading pages.
   *
   * @param pageTexts cleaned page texts in page order
   * @return detected language, or unknown when the detector is unsure or unavailable
   */
  public DetectedLanguage detect(Map<Integer, String> pageTexts) {
    ManualKbConfig.Language settings = config.getLanguage();
    if (!settings.isEnabled() || pageTexts == null || pageTexts.isEmpty()) {
      return DetectedLanguage.unknown();
    }

    String sample = buildSample(pageTexts, settings.getSamplePages(), settings.getSampleChars());
    if (sample.isBlank()) {
      return DetectedLanguage.unknown();
    }

    LanguageDetector languageDetector = detector();
    if (languageDetector == null) {
      return DetectedLanguage.unknown();
    }

    LanguageResult result;
    synchronized (languageDetector) {
      languageDetector.reset();
      languageDetector.addText(sample);
      result = languageDetector.detect();
    }
    if (result == null
        || result.isUnknown()
        || result.getRawScore() < settings.getMinProbability()) {
      log.debug(
          "Language undetermined (best={}, score={})",
          result == null ? null : result.getLanguage(),
          result == null ? 0.0 : result.getRawScore());
      return DetectedLanguage.unknown();
    }
    return new DetectedLanguage(result.getLanguage(), result.getRawScore());
  }

  // ---- private helpers ----

  static String buildSample(Map<Integer, String> pageTexts, int maxPages, int maxChars) {
    StringBuilder sb = new StringBuilder();
    pageTexts.values().stream()
        .limit(Math.max(1, maxPages))
        .forEach(
            text -> {
              if (sb.length() < maxChars && text != null) {
                sb.append(text).append('\n');
              }
            });
    return sb.length() > maxChars ? sb.substring(0, maxChars) : sb.toString();
  }

  private LanguageDetector detector() {
    if (detector == null) {
      synchronized (this) {
        if (detector == null) {
          try {
            detector = new OptimaizeLangDetector().loadModels();
          } catch (RuntimeException e) {
            log.warn(
                "Language models could not be loaded, language stays unknown: {}",
                e.getMessage());
            return null;
          }
        }
      }
    }
    return detector;
  }
}
