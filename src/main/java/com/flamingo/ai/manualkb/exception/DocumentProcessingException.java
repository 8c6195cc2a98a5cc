package com.flamingo.ai.manualkb.exception;

import java.util.UUID;

/** Exception thrown when a document cannot be processed at all. */
public class DocumentProcessingException extends RuntimeException {

  private final UUID documentId;
  private final String userMessage;

  public DocumentProcessingException(UUID documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.userMessage = "Failed to process manual";
  }

  public DocumentProcessingException(UUID documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to process manual";
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
