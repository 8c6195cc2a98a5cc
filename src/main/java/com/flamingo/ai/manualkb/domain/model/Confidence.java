package com.flamingo.ai.manualkb.domain.model;

/** Helpers for [0,1] confidence scores. */
public final class Confidence {

  private Confidence() {}

  /**
   * Clamps a raw additive score into [0,1] and rounds it to two decimals.
   *
   * @param raw unbounded score
   * @return clamped score
   */
  public static double clamp(double raw) {
    double bounded = Math.max(0.0, Math.min(1.0, raw));
    return Math.round(bounded * 100.0) / 100.0;
  }

  /**
   * Rejects scores outside [0,1].
   *
   * @param confidence score to check
   * @return the same score
   * @throws IllegalArgumentException when out of range or NaN
   */
  public static double requireValid(double confidence) {
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("Confidence must lie in [0,1] but was " + confidence);
    }
    return confidence;
  }
}
