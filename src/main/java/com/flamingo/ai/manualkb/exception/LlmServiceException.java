package com.flamingo.ai.manualkb.exception;

/** Exception thrown when the local inference server fails or returns unusable output. */
public class LlmServiceException extends RuntimeException {

  private final String operation;

  public LlmServiceException(String operation, String message, Throwable cause) {
    super(message, cause);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }
}
