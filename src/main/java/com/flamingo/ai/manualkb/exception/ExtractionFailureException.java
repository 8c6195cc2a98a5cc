package com.flamingo.ai.manualkb.exception;

import java.util.UUID;

/**
 * Exception thrown when text extraction fails, either for a single page or, when neither backend
 * nor OCR yields text, for the whole document.
 */
public class ExtractionFailureException extends RuntimeException {

  private final UUID documentId;
  private final Integer pageNumber;

  public ExtractionFailureException(UUID documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.pageNumber = null;
  }

  public ExtractionFailureException(UUID documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.pageNumber = null;
  }

  public ExtractionFailureException(
      UUID documentId, int pageNumber, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.pageNumber = pageNumber;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  /** Failing page, or null when the whole document failed. */
  public Integer getPageNumber() {
    return pageNumber;
  }
}
