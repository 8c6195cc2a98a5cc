package com.flamingo.ai.manualkb.domain.enums;

/**
 * Telemetry tier for a manufacturer detection score. Tiers are reported to callers and logs only;
 * no pipeline decision depends on them.
 */
public enum ConfidenceTier {
  EXCELLENT,
  VERY_HIGH,
  HIGH,
  MEDIUM,
  LOW
}
