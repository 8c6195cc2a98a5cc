package com.flamingo.ai.manualkb.service.rules;

import java.util.List;
import java.util.Map;

/**
 * Error-code rule set: global limits, confidence weights, keyword lists and per-manufacturer
 * patterns.
 */
public record ErrorCodeRules(
    Limits extractionRules,
    ConfidenceWeights confidenceWeights,
    List<String> rejectCodes,
    List<String> technicalTerms,
    List<String> actionVerbs,
    Map<String, List<String>> severityKeywords,
    List<String> genericPhrases,
    List<String> jamKeywords,
    Map<String, ManufacturerRules> manufacturers) {

  public ErrorCodeRules {
    extractionRules = extractionRules == null ? Limits.defaults() : extractionRules;
    confidenceWeights =
        confidenceWeights == null ? ConfidenceWeights.defaults() : confidenceWeights;
    rejectCodes = RuleLists.lower(rejectCodes);
    technicalTerms = RuleLists.lower(technicalTerms);
    actionVerbs = RuleLists.lower(actionVerbs);
    severityKeywords = severityKeywords == null ? Map.of() : Map.copyOf(severityKeywords);
    genericPhrases = RuleLists.lower(genericPhrases);
    jamKeywords = RuleLists.lower(jamKeywords);
    manufacturers = manufacturers == null ? Map.of() : Map.copyOf(manufacturers);
  }

  public static ErrorCodeRules empty() {
    return new ErrorCodeRules(null, null, null, null, null, null, null, null, null);
  }

  /** Extraction-wide limits. */
  public record Limits(
      int maxCodesPerPage,
      double minConfidence,
      int contextWindow,
      int minDescriptionLength,
      int maxDescriptionLength,
      int solutionLookahead,
      int maxSolutionLength) {

    public Limits {
      maxCodesPerPage = maxCodesPerPage > 0 ? maxCodesPerPage : 20;
      minConfidence = minConfidence > 0 ? minConfidence : 0.70;
      contextWindow = contextWindow > 0 ? contextWindow : 500;
      minDescriptionLength = minDescriptionLength > 0 ? minDescriptionLength : 20;
      maxDescriptionLength = maxDescriptionLength > 0 ? maxDescriptionLength : 500;
      solutionLookahead = solutionLookahead > 0 ? solutionLookahead : 5000;
      maxSolutionLength = maxSolutionLength > 0 ? maxSolutionLength : 3000;
    }

    public static Limits defaults() {
      return new Limits(0, 0, 0, 0, 0, 0, 0);
    }
  }

  /** Additive confidence weights; thresholds are character counts unless named otherwise. */
  public record ConfidenceWeights(
      double base,
      double descriptionPresent,
      int descriptionPresentLength,
      double descriptionDetailed,
      int descriptionDetailedLength,
      double descriptionRich,
      int descriptionRichLength,
      double solutionPresent,
      double solutionStructured,
      double technicalTermsPresent,
      double technicalTermsDense,
      int technicalTermsDenseCount,
      double repeatedCode,
      double contextLengthSane,
      int contextMinLength,
      int contextMaxLength) {

    public static ConfidenceWeights defaults() {
      return new ConfidenceWeights(
          0.30, 0.10, 15, 0.10, 30, 0.10, 100, 0.20, 0.10, 0.10, 0.10, 3, 0.10, 0.05, 200, 2000);
    }
  }

  /**
   * Manufacturer-specific error-code rules.
   *
   * @param patterns regular expressions; group 1 holds the code when present
   * @param validationRegex full-code validation, may be null
   * @param requiredContext context must contain at least one of these
   * @param excludedContext context must contain none of these
   * @param minConfidence overrides the global minimum when set
   * @param maxCodesPerPage overrides the global cap when set
   */
  public record ManufacturerRules(
      List<String> patterns,
      String validationRegex,
      List<String> requiredContext,
      List<String> excludedContext,
      Double minConfidence,
      Integer maxCodesPerPage) {

    public ManufacturerRules {
      patterns = patterns == null ? List.of() : List.copyOf(patterns);
      requiredContext = RuleLists.lower(requiredContext);
      excludedContext = RuleLists.lower(excludedContext);
    }
  }
}
