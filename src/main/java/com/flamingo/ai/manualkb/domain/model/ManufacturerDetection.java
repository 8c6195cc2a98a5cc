package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.ConfidenceTier;
import java.util.List;
import java.util.Map;

/**
 * Outcome of manufacturer detection.
 *
 * @param manufacturer winning canonical name, null when no candidate scored
 * @param score winning total score
 * @param tier telemetry tier of the score
 * @param signals signals that contributed to the winner
 * @param scores total score of every candidate that scored
 */
public record ManufacturerDetection(
    String manufacturer,
    double score,
    ConfidenceTier tier,
    List<ManufacturerSignal> signals,
    Map<String, Double> scores) {

  public static ManufacturerDetection none() {
    return new ManufacturerDetection(null, 0.0, ConfidenceTier.LOW, List.of(), Map.of());
  }

  public static ManufacturerDetection configured(String manufacturer) {
    return new ManufacturerDetection(
        manufacturer, 0.0, ConfidenceTier.EXCELLENT, List.of(), Map.of());
  }

  public boolean isDetected() {
    return manufacturer != null;
  }
}
