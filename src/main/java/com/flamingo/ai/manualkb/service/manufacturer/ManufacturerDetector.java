package com.flamingo.ai.manualkb.service.manufacturer;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import com.flamingo.ai.manualkb.domain.enums.ConfidenceTier;
import com.flamingo.ai.manualkb.domain.enums.SignalSource;
import com.flamingo.ai.manualkb.domain.model.ManufacturerDetection;
import com.flamingo.ai.manualkb.domain.model.ManufacturerSignal;
import com.flamingo.ai.manualkb.service.rules.ManufacturerCatalog;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores weak signals into a single manufacturer.
 *
 * <p>Each candidate's score is the sum of its filename, author and title matches plus a saturating
 * count of mentions in the first pages. The highest score wins; equal scores are resolved by
 * canonical name so the outcome never depends on iteration order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManufacturerDetector {

  private final ManufacturerNormalizer normalizer;
  private final ManualKbConfig config;

  /**
   * Detects the manufacturer of a document.
   *
   * @param fileName original filename, may be null
   * @param author PDF author metadata, may be null
   * @param title PDF title metadata, may be null
   * @param pageTexts page texts in page order
   * @return detection with the winner, or {@link ManufacturerDetection#none()}
   */
  public ManufacturerDetection detect(
      String fileName, String author, String title, Map<Integer, String> pageTexts) {
    ManualKbConfig.Detection weights = config.getDetection();
    String fileNameText = fileName == null ? null : fileName.replaceAll("[_.\\-]+", " ");
    String sampleText = leadingText(pageTexts, weights.getTextSamplePages());

    Map<String, Double> scores = new LinkedHashMap<>();
    Map<String, List<ManufacturerSignal>> signalsByName = new LinkedHashMap<>();
    for (ManufacturerCatalog.Entry entry : normalizer.entries()) {
      List<ManufacturerSignal> signals = new ArrayList<>();
      if (normalizer.countMentions(entry, fileNameText) > 0) {
        signals.add(signal(entry, SignalSource.FILENAME, weights.getFilenameWeight()));
      }
      if (normalizer.countMentions(entry, author) > 0) {
        signals.add(signal(entry, SignalSource.AUTHOR, weights.getAuthorWeight()));
      }
      if (normalizer.countMentions(entry, title) > 0) {
        signals.add(signal(entry, SignalSource.TITLE, weights.getTitleWeight()));
      }
      int mentions = normalizer.countMentions(entry, sampleText);
      if (mentions > 0) {
        double weight =
            Math.min(mentions * weights.getTextMentionWeight(), weights.getTextMentionCap());
        signals.add(signal(entry, SignalSource.TEXT_MENTIONS, weight));
      }

      double score = signals.stream().mapToDouble(ManufacturerSignal::weight).sum();
      if (score > 0) {
        scores.put(entry.name(), score);
        signalsByName.put(entry.name(), List.copyOf(signals));
      }
    }

    if (scores.isEmpty()) {
      log.info("No manufacturer signals found for {}", fileName);
      return ManufacturerDetection.none();
    }

    String winner =
        scores.entrySet().stream()
            .sorted(
                Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                    .thenComparing(Map.Entry.comparingByKey()))
            .findFirst()
            .map(Map.Entry::getKey)
            .orElseThrow();
    double score = scores.get(winner);
    ConfidenceTier tier = tierOf(score);
    log.info("Detected manufacturer {} (score={}, tier={}) for {}", winner, score, tier, fileName);
    return new ManufacturerDetection(
        winner, score, tier, signalsByName.get(winner), Map.copyOf(scores));
  }

  /**
   * Maps a score to its telemetry tier.
   *
   * @param score detection score
   * @return tier from the configured thresholds
   */
  public ConfidenceTier tierOf(double score) {
    ManualKbConfig.Detection thresholds = config.getDetection();
    if (score >= thresholds.getExcellentThreshold()) {
      return ConfidenceTier.EXCELLENT;
    }
    if (score >= thresholds.getVeryHighThreshold()) {
      return ConfidenceTier.VERY_HIGH;
    }
    if (score >= thresholds.getHighThreshold()) {
      return ConfidenceTier.HIGH;
    }
    if (score >= thresholds.getMediumThreshold()) {
      return ConfidenceTier.MEDIUM;
    }
    return ConfidenceTier.LOW;
  }

  // ---- private helpers ----

  private static ManufacturerSignal signal(
      ManufacturerCatalog.Entry entry, SignalSource source, double weight) {
    return new ManufacturerSignal(entry.name(), source, weight);
  }

  private static String leadingText(Map<Integer, String> pageTexts, int pages) {
    if (pageTexts == null || pageTexts.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    pageTexts.values().stream().limit(Math.max(1, pages)).forEach(t -> sb.append(t).append('\n'));
    return sb.toString();
  }
}
