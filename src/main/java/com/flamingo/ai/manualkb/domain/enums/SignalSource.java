package com.flamingo.ai.manualkb.domain.enums;

/** Origin of a weak manufacturer-detection signal. */
public enum SignalSource {
  FILENAME,
  AUTHOR,
  TITLE,
  TEXT_MENTIONS
}
