package com.flamingo.ai.manualkb.service.rules;

import java.util.List;
import java.util.Map;

/** Product-model rule set: reject words, scoring weights and per-manufacturer series patterns. */
public record ProductRules(
    List<String> rejectWords,
    Scoring scoring,
    List<String> filenameStopTokens,
    Map<String, ManufacturerRules> manufacturers) {

  public ProductRules {
    rejectWords = RuleLists.lower(rejectWords);
    scoring = scoring == null ? Scoring.defaults() : scoring;
    filenameStopTokens = RuleLists.lower(filenameStopTokens);
    manufacturers = manufacturers == null ? Map.of() : Map.copyOf(manufacturers);
  }

  public static ProductRules empty() {
    return new ProductRules(null, null, null, null);
  }

  /** Confidence weights for product matches. */
  public record Scoring(
      double base,
      double fullNameSeriesBonus,
      double repeatedBonus,
      double frequentBonus,
      int frequentCount,
      double keywordBonus,
      int keywordWindow,
      List<String> keywords,
      double filenameConfidence,
      double minConfidence,
      int maxProductsPerPage) {

    public Scoring {
      keywords = RuleLists.lower(keywords);
      keywordWindow = keywordWindow > 0 ? keywordWindow : 100;
      frequentCount = frequentCount > 0 ? frequentCount : 3;
      maxProductsPerPage = maxProductsPerPage > 0 ? maxProductsPerPage : 30;
    }

    public static Scoring defaults() {
      return new Scoring(
          0.6,
          0.2,
          0.1,
          0.1,
          3,
          0.05,
          100,
          List.of("model", "product", "printer", "scanner"),
          0.4,
          0.6,
          30);
    }
  }

  /** Series patterns for one manufacturer. */
  public record ManufacturerRules(List<SeriesPattern> series) {

    public ManufacturerRules {
      series = series == null ? List.of() : List.copyOf(series);
    }
  }

  /**
   * A product series pattern.
   *
   * @param name pattern name
   * @param series series display name, null for bare model numbers
   * @param fullName whether the match includes the series name
   * @param pattern regular expression matching the model
   */
  public record SeriesPattern(String name, String series, boolean fullName, String pattern) {}
}
