package com.flamingo.ai.manualkb.service.rules;

import com.flamingo.ai.manualkb.domain.enums.VersionType;
import java.util.List;
import java.util.Map;

/** Version rule set: ordered patterns per manufacturer plus a generic fallback list. */
public record VersionRules(
    int contextWindow,
    List<String> forbiddenContext,
    Map<String, List<VersionPattern>> manufacturers,
    List<VersionPattern> generic) {

  public VersionRules {
    contextWindow = contextWindow > 0 ? contextWindow : 50;
    forbiddenContext = RuleLists.lower(forbiddenContext);
    manufacturers = manufacturers == null ? Map.of() : Map.copyOf(manufacturers);
    generic = generic == null ? List.of() : List.copyOf(generic);
  }

  public static VersionRules empty() {
    return new VersionRules(0, null, null, null);
  }

  /**
   * A version pattern; the whole match is the version string.
   *
   * @param name pattern name
   * @param pattern regular expression
   * @param type version shape
   * @param confidence confidence assigned to matches
   */
  public record VersionPattern(String name, String pattern, VersionType type, double confidence) {}
}
