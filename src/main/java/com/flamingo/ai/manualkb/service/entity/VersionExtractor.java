package com.flamingo.ai.manualkb.service.entity;

import com.flamingo.ai.manualkb.domain.model.Confidence;
import com.flamingo.ai.manualkb.domain.model.DocumentVersion;
import com.flamingo.ai.manualkb.service.manufacturer.ManufacturerNormalizer;
import com.flamingo.ai.manualkb.service.rules.ExtractionRules;
import com.flamingo.ai.manualkb.service.rules.VersionRules;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds the edition, date or revision string of a document. Manufacturer patterns are tried in
 * order, then the generic list; the first acceptable match on a page wins.
 */
@Service
@Slf4j
public class VersionExtractor {

  private static final int MIN_TEXT_LENGTH = 10;
  private static final int MAX_VERSION_LENGTH = 50;

  private final VersionRules rules;
  private final ManufacturerNormalizer normalizer;
  private final Map<String, List<CompiledVersion>> byManufacturer = new LinkedHashMap<>();
  private final List<CompiledVersion> generic;

  public VersionExtractor(ExtractionRules extractionRules, ManufacturerNormalizer normalizer) {
    this.rules = extractionRules.versions();
    this.normalizer = normalizer;
    rules.manufacturers().forEach((key, patterns) -> byManufacturer.put(key, compile(patterns)));
    this.generic = compile(rules.generic());
  }

  /**
   * Extracts the version printed on one page.
   *
   * @param text page text
   * @param pageNumber 1-based page
   * @param manufacturer manufacturer name, may be null for generic patterns only
   * @return first acceptable match, empty when none
   */
  public Optional<DocumentVersion> extract(String text, int pageNumber, String manufacturer) {
    if (text == null || text.strip().length() < MIN_TEXT_LENGTH) {
      return Optional.empty();
    }
    for (CompiledVersion candidate : patternsFor(manufacturer)) {
      Matcher m = candidate.regex().matcher(text);
      while (m.find()) {
        String version = m.group().strip();
        if (version.length() > MAX_VERSION_LENGTH || isForbidden(version)) {
          continue;
        }
        log.debug("Version '{}' found on page {} by {}", version, pageNumber, candidate.name());
        return Optional.of(
            DocumentVersion.builder()
                .version(version)
                .versionType(candidate.rule().type())
                .confidence(Confidence.clamp(candidate.rule().confidence()))
                .pageNumber(pageNumber)
                .context(context(text, m.start(), m.end()))
                .extractionMethod(candidate.name())
                .build());
      }
    }
    return Optional.empty();
  }

  /**
   * Picks the document version among per-page candidates: highest confidence, earliest page on
   * ties.
   */
  public static Optional<DocumentVersion> best(Collection<DocumentVersion> candidates) {
    return candidates.stream()
        .min(
            Comparator.comparingDouble(DocumentVersion::confidence)
                .reversed()
                .thenComparingInt(DocumentVersion::pageNumber));
  }

  // ---- private helpers ----

  private List<CompiledVersion> patternsFor(String manufacturer) {
    if (manufacturer == null || manufacturer.isBlank()) {
      return generic;
    }
    Optional<String> key = normalizer.ruleKey(manufacturer).filter(byManufacturer::containsKey);
    if (key.isEmpty()) {
      return generic;
    }
    List<CompiledVersion> ordered = new ArrayList<>(byManufacturer.get(key.get()));
    ordered.addAll(generic);
    return ordered;
  }

  private boolean isForbidden(String version) {
    String lower = version.toLowerCase(Locale.ROOT);
    return rules.forbiddenContext().stream().anyMatch(lower::contains);
  }

  private String context(String text, int start, int end) {
    int window = rules.contextWindow();
    return text.substring(Math.max(0, start - window), Math.min(text.length(), end + window))
        .strip();
  }

  private List<CompiledVersion> compile(List<VersionRules.VersionPattern> patterns) {
    List<CompiledVersion> compiled = new ArrayList<>();
    for (VersionRules.VersionPattern pattern : patterns) {
      if (pattern.pattern() == null || pattern.type() == null) {
        log.error("Version pattern '{}' lacks a regex or a type", pattern.name());
        continue;
      }
      try {
        compiled.add(
            new CompiledVersion(
                pattern, Pattern.compile(pattern.pattern(), Pattern.CASE_INSENSITIVE)));
      } catch (PatternSyntaxException e) {
        log.error("Invalid version pattern '{}': {}", pattern.name(), e.getDescription());
      }
    }
    return List.copyOf(compiled);
  }

  private record CompiledVersion(VersionRules.VersionPattern rule, Pattern regex) {

    String name() {
      return rule.name();
    }
  }
}
