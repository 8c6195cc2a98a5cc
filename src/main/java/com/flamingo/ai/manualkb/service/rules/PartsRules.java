package com.flamingo.ai.manualkb.service.rules;

import java.util.List;
import java.util.Map;

/** Parts rule set: global extraction rules and per-manufacturer part-number patterns. */
public record PartsRules(Limits extractionRules, Map<String, ManufacturerRules> manufacturers) {

  public PartsRules {
    extractionRules = extractionRules == null ? Limits.defaults() : extractionRules;
    manufacturers = manufacturers == null ? Map.of() : Map.copyOf(manufacturers);
  }

  public static PartsRules empty() {
    return new PartsRules(null, null);
  }

  /** Extraction-wide parts limits and keyword lists. */
  public record Limits(
      int maxPartsPerPage,
      double minConfidence,
      int contextWindow,
      double defaultPatternConfidence,
      double nameBonus,
      double descriptionBonus,
      double indicatorBonus,
      List<String> requireContextKeywords,
      List<String> excludeIfNear,
      List<String> partNumberIndicators,
      List<String> consumableTypes) {

    public Limits {
      maxPartsPerPage = maxPartsPerPage > 0 ? maxPartsPerPage : 50;
      minConfidence = minConfidence > 0 ? minConfidence : 0.70;
      contextWindow = contextWindow > 0 ? contextWindow : 200;
      defaultPatternConfidence = defaultPatternConfidence > 0 ? defaultPatternConfidence : 0.75;
      requireContextKeywords = RuleLists.lower(requireContextKeywords);
      excludeIfNear = RuleLists.lower(excludeIfNear);
      partNumberIndicators = RuleLists.lower(partNumberIndicators);
      consumableTypes = RuleLists.lower(consumableTypes);
    }

    public static Limits defaults() {
      return new Limits(0, 0, 0, 0, 0.05, 0.03, 0.05, null, null, null, null);
    }
  }

  /** Patterns for one manufacturer. */
  public record ManufacturerRules(List<PartPattern> patterns) {

    public ManufacturerRules {
      patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }
  }

  /**
   * A named part-number pattern.
   *
   * @param name pattern name, also used to infer the part category
   * @param pattern regular expression matching the whole part number
   * @param confidence base confidence, null for the global default
   */
  public record PartPattern(String name, String pattern, Double confidence) {}
}
