package com.flamingo.ai.manualkb.domain.enums;

/** Processing status of a manual in the knowledge base. */
public enum DocumentStatus {
  /** Registered but not yet processed. */
  PENDING,

  /** Pipeline is running. */
  PROCESSING,

  /** Pipeline finished; partial extraction gaps are listed as validation issues. */
  COMPLETED,

  /** No text could be extracted from the document. */
  FAILED
}
