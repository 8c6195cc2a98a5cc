package com.flamingo.ai.manualkb.domain.enums;

/** Kind of technical document, guessed from title and filename keywords. */
public enum DocumentType {
  SERVICE_MANUAL("service_manual"),
  PARTS_CATALOG("parts_catalog"),
  USER_GUIDE("user_guide"),
  TROUBLESHOOTING("troubleshooting");

  private final String value;

  DocumentType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
