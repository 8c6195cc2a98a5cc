package com.flamingo.ai.manualkb.domain.enums;

/** Text extraction backend that produced a document's page texts. */
public enum ExtractionEngine {
  PDFBOX("pdfbox"),
  TIKA("tika");

  private final String value;

  ExtractionEngine(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Resolves a configured engine name, case-insensitively.
   *
   * @param value configured name
   * @return matching engine, {@link #PDFBOX} when unknown
   */
  public static ExtractionEngine fromValue(String value) {
    for (ExtractionEngine engine : values()) {
      if (engine.value.equalsIgnoreCase(value)) {
        return engine;
      }
    }
    return PDFBOX;
  }

  public ExtractionEngine alternate() {
    return this == PDFBOX ? TIKA : PDFBOX;
  }
}
