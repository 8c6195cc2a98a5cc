package com.flamingo.ai.manualkb.service.manufacturer;

import com.flamingo.ai.manualkb.service.rules.ExtractionRules;
import com.flamingo.ai.manualkb.service.rules.ManufacturerCatalog;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps manufacturer names, aliases and strong series names to canonical manufacturers.
 *
 * <p>Aliases are matched on word boundaries only. Aliases of three characters or fewer are ignored
 * unless whitelisted, since tokens such as "oki" or "ta" occur inside ordinary words and part
 * numbers.
 */
@Component
@Slf4j
public class ManufacturerNormalizer {

  private static final int SHORT_ALIAS_LENGTH = 3;

  private final List<ManufacturerCatalog.Entry> entries;
  private final Map<String, ManufacturerCatalog.Entry> byLookupName = new LinkedHashMap<>();
  private final Map<ManufacturerCatalog.Entry, List<Pattern>> aliasPatterns = new LinkedHashMap<>();

  public ManufacturerNormalizer(ExtractionRules rules) {
    ManufacturerCatalog catalog = rules.catalog();
    Set<String> whitelist = new LinkedHashSet<>();
    catalog.shortAliasWhitelist().forEach(a -> whitelist.add(a.toLowerCase(Locale.ROOT)));
    this.entries = catalog.manufacturers();

    for (ManufacturerCatalog.Entry entry : entries) {
      Set<String> names = new LinkedHashSet<>();
      names.add(entry.name().toLowerCase(Locale.ROOT));
      names.add(entry.key().toLowerCase(Locale.ROOT));
      names.add(entry.key().replace('_', ' ').toLowerCase(Locale.ROOT));
      entry.aliases().forEach(a -> names.add(a.toLowerCase(Locale.ROOT)));

      List<Pattern> patterns = new ArrayList<>();
      for (String name : names) {
        byLookupName.putIfAbsent(name, entry);
        if (name.length() <= SHORT_ALIAS_LENGTH && !whitelist.contains(name)) {
          continue;
        }
        patterns.add(
            Pattern.compile(
                "(?<![\\p{L}\\p{N}])" + Pattern.quote(name) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
      }
      aliasPatterns.put(entry, patterns);
    }
    log.debug("Manufacturer catalog loaded with {} manufacturers", entries.size());
  }

  /** Catalog entries in declaration order. */
  public List<ManufacturerCatalog.Entry> entries() {
    return entries;
  }

  /**
   * Resolves a name, key or alias exactly (case-insensitive, surrounding whitespace ignored).
   *
   * @param name manufacturer name as configured or detected
   * @return catalog entry, empty when unknown
   */
  public Optional<ManufacturerCatalog.Entry> resolve(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    String lookup = name.strip().toLowerCase(Locale.ROOT);
    ManufacturerCatalog.Entry exact = byLookupName.get(lookup);
    if (exact != null) {
      return Optional.of(exact);
    }
    return entries.stream().filter(e -> countMentions(e, name) > 0).findFirst();
  }

  /**
   * Normalizes a manufacturer name to its canonical form.
   *
   * @param name any known spelling
   * @return canonical name, empty when unknown
   */
  public Optional<String> normalize(String name) {
    return resolve(name).map(ManufacturerCatalog.Entry::name);
  }

  /**
   * Rule-set key of a manufacturer, e.g. {@code hp} for "HP Inc.".
   *
   * @param name any known spelling
   * @return rule key, empty when unknown
   */
  public Optional<String> ruleKey(String name) {
    return resolve(name).map(ManufacturerCatalog.Entry::key);
  }

  /**
   * Counts word-boundary alias mentions of one manufacturer.
   *
   * @param entry catalog entry
   * @param text text to search, may be null
   * @return number of mentions
   */
  public int countMentions(ManufacturerCatalog.Entry entry, String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    int count = 0;
    for (Pattern pattern : aliasPatterns.getOrDefault(entry, List.of())) {
      Matcher m = pattern.matcher(text);
      while (m.find()) {
        count++;
      }
    }
    return count;
  }
}
