package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.IssueSeverity;

/**
 * A non-fatal problem recorded during a pipeline run.
 *
 * @param stage pipeline stage that raised the issue
 * @param field offending field, or the stage name for stage-level failures
 * @param value offending value, may be null
 * @param message human-readable explanation
 * @param severity issue severity
 */
public record ValidationIssue(
    String stage, String field, String value, String message, IssueSeverity severity) {

  public static ValidationIssue stageFailure(String stage, Exception e) {
    return new ValidationIssue(
        stage, stage, null, stage + " failed: " + e.getMessage(), IssueSeverity.CRITICAL);
  }

  public boolean isBlocking() {
    return severity != IssueSeverity.WARNING;
  }
}
