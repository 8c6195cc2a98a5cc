package com.flamingo.ai.manualkb.domain.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Output of the text extraction stage.
 *
 * @param pageTexts cleaned text per 1-based page, in page order
 * @param structuredTexts recovered table lines per page; pages without any are absent
 * @param metadata document metadata and extraction metrics
 */
public record TextExtractionResult(
    Map<Integer, String> pageTexts,
    Map<Integer, String> structuredTexts,
    DocumentMetadata metadata) {

  public TextExtractionResult {
    pageTexts = Collections.unmodifiableMap(new TreeMap<>(pageTexts));
    structuredTexts = Collections.unmodifiableMap(new TreeMap<>(structuredTexts));
  }

  public boolean hasText() {
    return pageTexts.values().stream().anyMatch(text -> text != null && !text.isBlank());
  }

  public Optional<String> structuredText(int pageNumber) {
    return Optional.ofNullable(structuredTexts.get(pageNumber));
  }

  /** Page text joined with structured lines, as fed to the entity extractors. */
  public String extractionText(int pageNumber) {
    String text = pageTexts.getOrDefault(pageNumber, "");
    return structuredText(pageNumber).map(s -> text + "\n\n" + s).orElse(text);
  }

  public String fullText() {
    return String.join("\n\n", pageTexts.values());
  }
}
