package com.flamingo.ai.manualkb.exception;

import com.flamingo.ai.manualkb.domain.model.ValidationIssue;
import java.util.List;

/** Exception thrown when an entity violates a format constraint and cannot be kept. */
public class ValidationException extends RuntimeException {

  private final List<ValidationIssue> issues;

  public ValidationException(String message, List<ValidationIssue> issues) {
    super(message);
    this.issues = List.copyOf(issues);
  }

  public List<ValidationIssue> getIssues() {
    return issues;
  }
}
