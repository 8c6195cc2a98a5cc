package com.flamingo.ai.manualkb.service.extraction;

import com.flamingo.ai.manualkb.domain.enums.ExtractionEngine;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Raw output of one extraction backend, before cleaning and language detection.
 *
 * @param engine backend that produced the output
 * @param pageTexts uncleaned text per 1-based page; failed pages are absent
 * @param pageLines positioned lines per page, empty when the backend has no layout
 * @param failedPages pages that threw or produced no text
 * @param pageCount number of pages in the document
 * @param title document title metadata, may be null
 * @param author document author metadata, may be null
 * @param creationDate parsed creation date, may be null
 */
public record BackendExtraction(
    ExtractionEngine engine,
    Map<Integer, String> pageTexts,
    Map<Integer, List<PositionedLine>> pageLines,
    Set<Integer> failedPages,
    int pageCount,
    String title,
    String author,
    LocalDateTime creationDate) {

  public BackendExtraction {
    pageTexts = new TreeMap<>(pageTexts);
    pageLines = Map.copyOf(pageLines);
    failedPages = new TreeSet<>(failedPages);
  }

  public boolean hasText() {
    return pageTexts.values().stream().anyMatch(text -> !text.isBlank());
  }
}
