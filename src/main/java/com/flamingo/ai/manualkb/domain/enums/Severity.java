package com.flamingo.ai.manualkb.domain.enums;

import java.util.Locale;

/** Severity assigned to an error code from keywords in its description and solution. */
public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
