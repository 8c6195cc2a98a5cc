package com.flamingo.ai.manualkb.service.entity;

import com.flamingo.ai.manualkb.domain.model.Confidence;
import com.flamingo.ai.manualkb.domain.model.Part;
import com.flamingo.ai.manualkb.service.manufacturer.ManufacturerNormalizer;
import com.flamingo.ai.manualkb.service.rules.ExtractionRules;
import com.flamingo.ai.manualkb.service.rules.PartsRules;
import java.util.ArrayList;
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
 * Extracts spare parts and consumables with manufacturer-specific part-number patterns.
 *
 * <p>A manufacturer without parts patterns yields an empty list.
 */
@Service
@Slf4j
public class PartsExtractor {

  private static final int MIN_TEXT_LENGTH = 10;
  private static final int MIN_PART_NUMBER_LENGTH = 3;
  private static final int MAX_NAME_LENGTH = 255;
  private static final int MAX_DESCRIPTION_LENGTH = 500;
  private static final int MAX_CONTEXT_LENGTH = 500;
  private static final List<String> NAME_LABELS =
      List.of("Description:", "Desc:", "Part Name:", "Name:");
  private static final Pattern NAME_DELIMITER = Pattern.compile("\\||\\t| {2,}");
  private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[\\s:|\\-\\u2013]+");

  private final PartsRules.Limits limits;
  private final ManufacturerNormalizer normalizer;
  private final Map<String, List<CompiledPattern>> compiled = new LinkedHashMap<>();

  public PartsExtractor(ExtractionRules extractionRules, ManufacturerNormalizer normalizer) {
    PartsRules rules = extractionRules.parts();
    this.limits = rules.extractionRules();
    this.normalizer = normalizer;
    rules.manufacturers().forEach((key, mfr) -> compiled.put(key, compile(key, mfr)));
  }

  /**
   * Extracts parts from one page.
   *
   * @param text page text
   * @param pageNumber 1-based page
   * @param manufacturer manufacturer name, may be null
   * @return parts sorted by confidence, empty when the manufacturer has no patterns
   */
  public List<Part> extract(String text, int pageNumber, String manufacturer) {
    if (text == null || text.strip().length() < MIN_TEXT_LENGTH) {
      return List.of();
    }
    Optional<String> key = resolveKey(manufacturer);
    if (key.isEmpty()) {
      if (manufacturer != null) {
        log.debug("No parts patterns configured for '{}'", manufacturer);
      }
      return List.of();
    }

    Map<String, Part> best = new LinkedHashMap<>();
    for (CompiledPattern pattern : compiled.get(key.get())) {
      Matcher m = pattern.regex().matcher(text);
      while (m.find()) {
        Part part = toPart(text, m, pattern, pageNumber);
        if (part != null) {
          best.merge(part.partNumber(), part, (a, b) -> b.confidence() > a.confidence() ? b : a);
        }
      }
    }

    List<Part> parts = new ArrayList<>(best.values());
    parts.sort(Comparator.comparingDouble(Part::confidence).reversed());
    if (parts.size() > limits.maxPartsPerPage()) {
      log.warn(
          "Extracted {} parts on page {}, keeping {}",
          parts.size(),
          pageNumber,
          limits.maxPartsPerPage());
      parts = new ArrayList<>(parts.subList(0, limits.maxPartsPerPage()));
    }
    return parts;
  }

  // ---- private helpers ----

  private Part toPart(String text, Matcher m, CompiledPattern pattern, int pageNumber) {
    String partNumber = m.group().strip();
    if (partNumber.length() < MIN_PART_NUMBER_LENGTH) {
      return null;
    }
    int half = limits.contextWindow() / 2;
    String context =
        text.substring(Math.max(0, m.start() - half), Math.min(text.length(), m.end() + half))
            .strip();
    String contextLower = context.toLowerCase(Locale.ROOT);
    if (!contextMatches(contextLower)) {
      return null;
    }

    String[] info = nameAndDescription(context, partNumber);
    double confidence = pattern.confidence();
    if (info[0] != null) {
      confidence += limits.nameBonus();
    }
    if (info[1] != null) {
      confidence += limits.descriptionBonus();
    }
    if (limits.partNumberIndicators().stream().anyMatch(contextLower::contains)) {
      confidence += limits.indicatorBonus();
    }
    confidence = Confidence.clamp(confidence);
    if (confidence < limits.minConfidence()) {
      return null;
    }

    return Part.builder()
        .partNumber(partNumber)
        .name(info[0])
        .description(info[1])
        .category(category(contextLower, pattern.name()))
        .confidence(confidence)
        .pageNumber(pageNumber)
        .context(truncate(context, MAX_CONTEXT_LENGTH))
        .extractionMethod(pattern.name())
        .build();
  }

  private boolean contextMatches(String contextLower) {
    boolean hasRequired =
        limits.requireContextKeywords().isEmpty()
            || limits.requireContextKeywords().stream().anyMatch(contextLower::contains);
    boolean hasExcluded = limits.excludeIfNear().stream().anyMatch(contextLower::contains);
    return hasRequired && !hasExcluded;
  }

  /** Name from the rest of the part-number line or the next line, description from a later line. */
  static String[] nameAndDescription(String context, String partNumber) {
    String[] lines = context.split("\\n");
    String name = null;
    String description = null;
    for (int i = 0; i < lines.length; i++) {
      int at = lines[i].toUpperCase(Locale.ROOT).indexOf(partNumber.toUpperCase(Locale.ROOT));
      if (at < 0) {
        continue;
      }
      String remaining = lines[i].substring(at + partNumber.length());
      remaining = LEADING_SEPARATORS.matcher(remaining).replaceFirst("").strip();
      if (remaining.length() > 3) {
        remaining = NAME_DELIMITER.split(remaining, 2)[0].strip();
        name = truncate(remaining, MAX_NAME_LENGTH);
      }
      if ((name == null || name.length() <= 3) && i + 1 < lines.length) {
        String next = lines[i + 1].strip();
        for (String label : NAME_LABELS) {
          if (next.startsWith(label)) {
            next = next.substring(label.length()).strip();
          }
        }
        name = next.length() > 3 ? truncate(next, MAX_NAME_LENGTH) : null;
      }
      for (int j = i + 1; j < Math.min(i + 4, lines.length); j++) {
        String line = lines[j].strip();
        if (line.length() > 10 && !line.equals(name)) {
          description = truncate(line, MAX_DESCRIPTION_LENGTH);
          break;
        }
      }
      break;
    }
    return new String[] {name, description};
  }

  private String category(String contextLower, String patternName) {
    String name = patternName == null ? "" : patternName.toLowerCase(Locale.ROOT);
    if (name.contains("waste") && name.contains("toner")) {
      return "waste_toner_box";
    }
    if (name.contains("toner")) {
      return "toner_cartridge";
    }
    if (name.contains("developer")) {
      return "developer_unit";
    }
    if (name.contains("drum") || name.contains("imaging")) {
      return "drum_unit";
    }
    if (name.contains("fuser")) {
      return "fuser_assembly";
    }
    if (name.contains("maintenance")) {
      return "maintenance_kit";
    }
    if (name.contains("ink")) {
      return "ink_cartridge";
    }
    return limits.consumableTypes().stream()
        .filter(contextLower::contains)
        .findFirst()
        .map(type -> type.replace(' ', '_'))
        .orElse(null);
  }

  private Optional<String> resolveKey(String manufacturer) {
    if (manufacturer == null || manufacturer.isBlank()) {
      return Optional.empty();
    }
    Optional<String> key = normalizer.ruleKey(manufacturer).filter(compiled::containsKey);
    if (key.isPresent()) {
      return key;
    }
    String direct = manufacturer.strip().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
    return compiled.containsKey(direct) ? Optional.of(direct) : Optional.empty();
  }

  private static String truncate(String value, int max) {
    return value.length() > max ? value.substring(0, max) : value;
  }

  private List<CompiledPattern> compile(String key, PartsRules.ManufacturerRules mfr) {
    List<CompiledPattern> patterns = new ArrayList<>();
    for (PartsRules.PartPattern pattern : mfr.patterns()) {
      if (pattern.pattern() == null || pattern.pattern().isBlank()) {
        continue;
      }
      try {
        double confidence =
            pattern.confidence() != null
                ? pattern.confidence()
                : limits.defaultPatternConfidence();
        patterns.add(
            new CompiledPattern(
                pattern.name(),
                Pattern.compile(pattern.pattern(), Pattern.CASE_INSENSITIVE | Pattern.MULTILINE),
                confidence));
      } catch (PatternSyntaxException e) {
        log.error("Invalid parts pattern for {} '{}': {}", key, pattern.name(), e.getDescription());
      }
    }
    return List.copyOf(patterns);
  }

  private record CompiledPattern(String name, Pattern regex, double confidence) {}
}
