package com.flamingo.ai.manualkb.service.extraction;

import com.flamingo.ai.manualkb.domain.enums.DocumentType;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** Guesses the document type from title and filename keywords. */
public final class DocumentTypeClassifier {

  private static final Set<String> PARTS_TOKENS =
      Set.of("pc", "pl", "parts", "catalog", "catalogue");
  private static final Set<String> USER_TOKENS = Set.of("ug", "um", "user", "operator", "owner");
  private static final Set<String> TROUBLESHOOTING_TOKENS =
      Set.of("troubleshooting", "troubleshoot", "diagnostics");

  private DocumentTypeClassifier() {}

  /**
   * Classifies a document.
   *
   * @param title PDF title, may be null
   * @param fileName filename, may be null
   * @return classified type, {@link DocumentType#SERVICE_MANUAL} when nothing else matches
   */
  public static DocumentType classify(String title, String fileName) {
    String combined = ((title == null ? "" : title) + " " + (fileName == null ? "" : fileName));
    Set<String> tokens =
        Arrays.stream(combined.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
            .filter(t -> !t.isEmpty())
            .collect(Collectors.toSet());

    if (tokens.stream().anyMatch(TROUBLESHOOTING_TOKENS::contains)) {
      return DocumentType.TROUBLESHOOTING;
    }
    if (tokens.stream().anyMatch(PARTS_TOKENS::contains)) {
      return DocumentType.PARTS_CATALOG;
    }
    if (tokens.stream().anyMatch(USER_TOKENS::contains)) {
      return DocumentType.USER_GUIDE;
    }
    return DocumentType.SERVICE_MANUAL;
  }
}
