package com.flamingo.ai.manualkb.domain.enums;

/** Severity of a validation issue collected during a pipeline run. */
public enum IssueSeverity {
  /** Informational; the entity is kept. */
  WARNING,

  /** The entity is excluded from the result. */
  ERROR,

  /** A whole stage produced no usable output. */
  CRITICAL
}
