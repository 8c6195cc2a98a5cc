package com.flamingo.ai.manualkb.service.entity;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import com.flamingo.ai.manualkb.domain.model.Confidence;
import com.flamingo.ai.manualkb.domain.model.ExtractedEntity;
import com.flamingo.ai.manualkb.domain.model.ProductModel;
import com.flamingo.ai.manualkb.service.collaborator.LocalInferenceService;
import com.flamingo.ai.manualkb.service.manufacturer.ManufacturerNormalizer;
import com.flamingo.ai.manualkb.service.rules.ExtractionRules;
import com.flamingo.ai.manualkb.service.rules.ManufacturerCatalog;
import com.flamingo.ai.manualkb.service.rules.ProductRules;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts product models with per-manufacturer series patterns.
 *
 * <p>Patterns that carry a series name are matched case-insensitively; bare model-number patterns
 * (e.g. {@code [EM]\d{3,5}}) are case-sensitive so that lowercase prose does not match.
 */
@Service
@Slf4j
public class ProductExtractor {

  static final String FILENAME_METHOD = "filename_parsing";
  static final String INFERENCE_METHOD = "llm_inference";

  private static final int MIN_TEXT_LENGTH = 10;
  private static final int MIN_MODEL_LENGTH = 3;
  private static final int MAX_MODEL_LENGTH = 50;
  private static final int MAX_UPPERCASE_TOKEN = 12;
  private static final int CONTEXT_RADIUS = 100;
  private static final Pattern FILENAME_CHARS = Pattern.compile("[._/\\\\:*?]");
  private static final Pattern FILENAME_SEPARATORS = Pattern.compile("[_\\-\\s]+");
  private static final Pattern EXTENSION = Pattern.compile("\\.[A-Za-z0-9]{1,4}$");
  private static final Pattern HAS_DIGIT = Pattern.compile("\\d");
  private static final double INFERENCE_CONFIDENCE = 0.6;

  private final ProductRules rules;
  private final ManufacturerNormalizer normalizer;
  private final ManualKbConfig config;
  private final Optional<LocalInferenceService> inference;
  private final Map<String, List<CompiledSeries>> compiled = new LinkedHashMap<>();

  public ProductExtractor(
      ExtractionRules extractionRules,
      ManufacturerNormalizer normalizer,
      ManualKbConfig config,
      Optional<LocalInferenceService> inference) {
    this.rules = extractionRules.products();
    this.normalizer = normalizer;
    this.config = config;
    this.inference = inference;
    rules.manufacturers().forEach((key, mfr) -> compiled.put(key, compile(key, mfr)));
  }

  /**
   * Extracts product models from one page.
   *
   * @param text page text
   * @param pageNumber 1-based page
   * @param manufacturer manufacturer name, may be null
   * @param documentTitle title used to resolve the series of bare model numbers, may be null
   * @return products sorted by confidence, empty when the manufacturer has no patterns
   */
  public List<ProductModel> extract(
      String text, int pageNumber, String manufacturer, String documentTitle) {
    if (text == null || text.strip().length() < MIN_TEXT_LENGTH) {
      return List.of();
    }
    Optional<String> key = resolveKey(manufacturer);
    if (key.isEmpty()) {
      return List.of();
    }
    String canonical = normalizer.normalize(manufacturer).orElse(manufacturer);
    List<String> titleSeries = seriesInTitle(key.get(), documentTitle);
    ProductRules.Scoring scoring = rules.scoring();

    List<ProductModel> found = new ArrayList<>();
    for (CompiledSeries series : compiled.get(key.get())) {
      Matcher m = series.regex().matcher(text);
      while (m.find()) {
        String match = m.group().strip();
        if (!isValidModel(match)) {
          log.debug("Rejected product candidate '{}' on page {}", match, pageNumber);
          continue;
        }
        double confidence = confidence(match, text, m.start(), series.rule());
        if (confidence < scoring.minConfidence()) {
          continue;
        }
        String seriesName =
            series.rule().series() != null
                ? series.rule().series()
                : titleSeries.isEmpty() ? null : titleSeries.get(0);
        found.add(
            ProductModel.builder()
                .model(bareModel(match))
                .series(seriesName)
                .productType(productType(match + " " + (seriesName == null ? "" : seriesName)))
                .manufacturer(canonical)
                .confidence(confidence)
                .pageNumber(pageNumber)
                .context(window(text, m.start(), m.end()))
                .extractionMethod(series.rule().name())
                .build());
      }
    }
    List<ProductModel> products = deduplicate(found);
    if (products.size() > scoring.maxProductsPerPage()) {
      products = new ArrayList<>(products.subList(0, scoring.maxProductsPerPage()));
    }
    if (!products.isEmpty()) {
      log.debug("Extracted {} products from page {}", products.size(), pageNumber);
    }
    return products;
  }

  /**
   * Derives a product from a filename such as {@code HP_E475_SM.pdf}.
   *
   * <p>Manufacturer aliases and document-kind tokens are skipped; a token matching one of the
   * manufacturer's series patterns wins over the first token that merely looks like a model.
   *
   * @param fileName file name, with or without extension
   * @param manufacturer manufacturer name, may be null
   * @return product on {@link ExtractedEntity#FILENAME_PAGE}, empty when nothing qualifies
   */
  public Optional<ProductModel> extractFromFilename(String fileName, String manufacturer) {
    if (fileName == null || fileName.isBlank()) {
      return Optional.empty();
    }
    Optional<String> key = resolveKey(manufacturer);
    if (key.isEmpty()) {
      return Optional.empty();
    }
    String stem = EXTENSION.matcher(fileName.strip()).replaceFirst("");
    Set<String> aliases = aliasTokens(key.get());
    List<String> candidates = new ArrayList<>();
    for (String token : FILENAME_SEPARATORS.split(stem)) {
      String lower = token.toLowerCase(Locale.ROOT);
      if (token.isEmpty()
          || aliases.contains(lower)
          || rules.filenameStopTokens().contains(lower)
          || !isValidModel(token)) {
        continue;
      }
      candidates.add(token);
    }
    if (candidates.isEmpty()) {
      log.debug("No product model in filename '{}'", fileName);
      return Optional.empty();
    }

    String model = candidates.get(0);
    String seriesName = null;
    outer:
    for (String candidate : candidates) {
      for (CompiledSeries series : compiled.get(key.get())) {
        if (series.regex().matcher(candidate).matches()) {
          model = candidate;
          seriesName = series.rule().series();
          break outer;
        }
      }
    }
    log.info("Product '{}' derived from filename '{}'", model, fileName);
    return Optional.of(
        ProductModel.builder()
            .model(model)
            .series(seriesName)
            .productType(productType(model + " " + (seriesName == null ? "" : seriesName)))
            .manufacturer(normalizer.normalize(manufacturer).orElse(manufacturer))
            .confidence(Confidence.clamp(rules.scoring().filenameConfidence()))
            .pageNumber(ExtractedEntity.FILENAME_PAGE)
            .context(fileName)
            .extractionMethod(FILENAME_METHOD)
            .build());
  }

  /**
   * Asks the local inference collaborator for model numbers when pattern extraction found nothing.
   * Suggestions go through the same model validation as pattern matches.
   *
   * @param text text sample, truncated to the configured budget
   * @param pageNumber page the sample starts on
   * @param manufacturer manufacturer name
   * @return validated suggestions, empty when inference is disabled or fails
   */
  public List<ProductModel> extractWithInference(String text, int pageNumber, String manufacturer) {
    ManualKbConfig.Inference settings = config.getInference();
    if (inference.isEmpty() || !settings.isEnabled() || text == null || text.isBlank()) {
      return List.of();
    }
    String canonical = normalizer.normalize(manufacturer).orElse(manufacturer);
    String sample =
        text.length() > settings.getMaxTextChars()
            ? text.substring(0, settings.getMaxTextChars())
            : text;
    List<String> suggestions;
    try {
      suggestions = inference.get().suggestProductModels(sample, canonical);
    } catch (RuntimeException e) {
      log.warn("Product inference failed for page {}: {}", pageNumber, e.getMessage());
      return List.of();
    }
    List<ProductModel> products = new ArrayList<>();
    for (String suggestion : suggestions == null ? List.<String>of() : suggestions) {
      String model = suggestion == null ? "" : suggestion.strip();
      if (!isValidModel(model)) {
        continue;
      }
      products.add(
          ProductModel.builder()
              .model(bareModel(model))
              .productType(productType(model))
              .manufacturer(canonical)
              .confidence(INFERENCE_CONFIDENCE)
              .pageNumber(pageNumber)
              .context(model)
              .extractionMethod(INFERENCE_METHOD)
              .build());
    }
    return deduplicate(products);
  }

  public boolean supports(String manufacturer) {
    return resolveKey(manufacturer).isPresent();
  }

  /** Letters and digits, 3 to 50 chars, no filename characters, no long all-caps token. */
  boolean isValidModel(String model) {
    if (model == null) {
      return false;
    }
    String candidate = model.strip();
    if (candidate.length() < MIN_MODEL_LENGTH || candidate.length() > MAX_MODEL_LENGTH) {
      return false;
    }
    if (rules.rejectWords().contains(candidate.toLowerCase(Locale.ROOT))) {
      return false;
    }
    boolean hasLetter = candidate.chars().anyMatch(Character::isLetter);
    boolean hasDigit = candidate.chars().anyMatch(Character::isDigit);
    if (!hasLetter || !hasDigit) {
      return false;
    }
    if (FILENAME_CHARS.matcher(candidate).find()) {
      return false;
    }
    return !(candidate.length() > MAX_UPPERCASE_TOKEN
        && candidate.indexOf(' ') < 0
        && candidate.equals(candidate.toUpperCase(Locale.ROOT)));
  }

  // ---- private helpers ----

  private double confidence(
      String match, String text, int position, ProductRules.SeriesPattern rule) {
    ProductRules.Scoring scoring = rules.scoring();
    double confidence = scoring.base();
    if (rule.fullName()) {
      confidence += scoring.fullNameSeriesBonus();
    }
    int appearances = countOccurrences(text, match);
    if (appearances > 1) {
      confidence += scoring.repeatedBonus();
    }
    if (appearances > scoring.frequentCount()) {
      confidence += scoring.frequentBonus();
    }
    int start = Math.max(0, position - scoring.keywordWindow());
    int end = Math.min(text.length(), position + scoring.keywordWindow());
    String context = text.substring(start, end).toLowerCase(Locale.ROOT);
    if (scoring.keywords().stream().anyMatch(context::contains)) {
      confidence += scoring.keywordBonus();
    }
    return Confidence.clamp(confidence);
  }

  private static int countOccurrences(String text, String token) {
    int count = 0;
    int from = 0;
    while ((from = text.indexOf(token, from)) >= 0) {
      count++;
      from += token.length();
    }
    return count;
  }

  /** Strips series words: {@code LaserJet Pro M455} becomes {@code M455}. */
  static String bareModel(String match) {
    String[] tokens = match.strip().split("\\s+");
    for (int i = 0; i < tokens.length; i++) {
      if (HAS_DIGIT.matcher(tokens[i]).find()) {
        return String.join(" ", Arrays.copyOfRange(tokens, i, tokens.length));
      }
    }
    return match.strip();
  }

  static String productType(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    boolean laser =
        containsAny(lower, "laserjet", "laser", "accurio", "bizhub", "imagerunner", "phaser");
    boolean inkjet =
        containsAny(lower, "officejet", "inkjet", "pagewide", "pixma", "workforce", "ecotank");
    if (lower.contains("designjet")) {
      return lower.contains("latex") ? "latex_plotter" : "inkjet_plotter";
    }
    if (containsAny(lower, "accuriopress", "press")) {
      return "production_printer";
    }
    if (containsAny(lower, "mfp", "multifunction", "all-in-one")) {
      return inkjet && !laser ? "inkjet_multifunction" : "laser_multifunction";
    }
    if (containsAny(lower, "scanner", "scanjet")) {
      return "scanner";
    }
    if (lower.contains("copier")) {
      return "copier";
    }
    return inkjet && !laser ? "inkjet_printer" : "laser_printer";
  }

  private static boolean containsAny(String text, String... needles) {
    for (String needle : needles) {
      if (text.contains(needle)) {
        return true;
      }
    }
    return false;
  }

  /** Dedup by bare model, keeping the highest confidence and preferring a resolved series. */
  private static List<ProductModel> deduplicate(List<ProductModel> products) {
    Map<String, ProductModel> best = new LinkedHashMap<>();
    for (ProductModel product : products) {
      best.merge(
          product.model().toLowerCase(Locale.ROOT),
          product,
          (existing, candidate) -> {
            if (candidate.confidence() > existing.confidence()) {
              return candidate;
            }
            if (candidate.confidence() == existing.confidence()
                && existing.series() == null
                && candidate.series() != null) {
              return candidate;
            }
            return existing;
          });
    }
    List<ProductModel> result = new ArrayList<>(best.values());
    result.sort(Comparator.comparingDouble(ProductModel::confidence).reversed());
    return result;
  }

  private List<String> seriesInTitle(String key, String title) {
    if (title == null || title.isBlank()) {
      return List.of();
    }
    String compactTitle = title.toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-]+", "");
    List<String> found = new ArrayList<>();
    for (CompiledSeries series : compiled.get(key)) {
      String name = series.rule().series();
      if (name != null
          && compactTitle.contains(name.toLowerCase(Locale.ROOT).replace(" ", ""))
          && !found.contains(name)) {
        found.add(name);
      }
    }
    return found;
  }

  private Set<String> aliasTokens(String key) {
    Set<String> tokens = new HashSet<>();
    for (ManufacturerCatalog.Entry entry : normalizer.entries()) {
      if (!entry.key().equals(key)) {
        continue;
      }
      tokens.add(entry.key());
      for (String alias : entry.aliases()) {
        for (String part : FILENAME_SEPARATORS.split(alias.toLowerCase(Locale.ROOT))) {
          tokens.add(part);
        }
      }
      for (String part : FILENAME_SEPARATORS.split(entry.name().toLowerCase(Locale.ROOT))) {
        tokens.add(part);
      }
    }
    return tokens;
  }

  private static String window(String text, int start, int end) {
    return text.substring(
            Math.max(0, start - CONTEXT_RADIUS), Math.min(text.length(), end + CONTEXT_RADIUS))
        .strip();
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

  private List<CompiledSeries> compile(String key, ProductRules.ManufacturerRules mfr) {
    List<CompiledSeries> patterns = new ArrayList<>();
    for (ProductRules.SeriesPattern series : mfr.series()) {
      if (series.pattern() == null || series.pattern().isBlank()) {
        continue;
      }
      try {
        int flags = series.series() != null ? Pattern.CASE_INSENSITIVE : 0;
        patterns.add(new CompiledSeries(series, Pattern.compile(series.pattern(), flags)));
      } catch (PatternSyntaxException e) {
        log.error(
            "Invalid product pattern for {} '{}': {}", key, series.name(), e.getDescription());
      }
    }
    return List.copyOf(patterns);
  }

  private record CompiledSeries(ProductRules.SeriesPattern rule, Pattern regex) {}
}
