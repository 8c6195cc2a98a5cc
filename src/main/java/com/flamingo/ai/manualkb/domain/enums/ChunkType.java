package com.flamingo.ai.manualkb.domain.enums;

/** Classification assigned to a text chunk from the domain cues it contains. */
public enum ChunkType {
  /** Plain running text without a stronger cue. */
  TEXT("text"),

  /** Chunk listing or explaining error codes. */
  ERROR_CODE("error_code"),

  /** Numbered step-by-step procedure. */
  PROCEDURE("procedure"),

  /** Technical data such as dimensions, weights or capacities. */
  SPECIFICATION("specification"),

  /** Opening chunk of a document (cover, preface, safety notes). */
  INTRODUCTION("introduction"),

  /** Symptom / cause / remedy discussion. */
  TROUBLESHOOTING("troubleshooting");

  private final String value;

  ChunkType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
