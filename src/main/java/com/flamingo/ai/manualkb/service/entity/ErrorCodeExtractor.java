package com.flamingo.ai.manualkb.service.entity;

import com.flamingo.ai.manualkb.domain.enums.IssueSeverity;
import com.flamingo.ai.manualkb.domain.enums.Severity;
import com.flamingo.ai.manualkb.domain.model.Confidence;
import com.flamingo.ai.manualkb.domain.model.ErrorCode;
import com.flamingo.ai.manualkb.domain.model.ValidationIssue;
import com.flamingo.ai.manualkb.exception.UnknownManufacturerException;
import com.flamingo.ai.manualkb.exception.ValidationException;
import com.flamingo.ai.manualkb.service.manufacturer.ManufacturerNormalizer;
import com.flamingo.ai.manualkb.service.rules.ErrorCodeRules;
import com.flamingo.ai.manualkb.service.rules.ExtractionRules;
import java.util.ArrayList;
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
 * Extracts error codes with manufacturer-specific patterns.
 *
 * <p>There is deliberately no generic fallback pattern set: generic code shapes collide with part
 * numbers, page references and dates. A manufacturer without a rule set yields {@link
 * ErrorCodeExtraction.Kind#UNKNOWN_MANUFACTURER}.
 */
@Service
@Slf4j
public class ErrorCodeExtractor {

  static final String STAGE = "error_codes";

  private static final int MIN_TEXT_LENGTH = 20;
  private static final Pattern JAM_SHAPE = Pattern.compile("^\\d{2}-\\d{2}$");
  private static final List<String> ENRICH_CUES =
      List.of("error", "code", "trouble", "fault", "alarm", "jam");
  private static final int ENRICH_MATCH_LIMIT = 10;
  private static final int ENRICH_FALLBACK_MATCHES = 3;
  private static final int ENRICH_CONTEXT = 100;
  private static final int GOOD_SOLUTION_LENGTH = 100;
  private static final int RICH_SOLUTION_LENGTH = 200;
  private static final double ENRICHED_CONFIDENCE_CAP = 0.95;
  private static final double MIN_VALID_CONFIDENCE = 0.6;
  private static final int MIN_VALID_DESCRIPTION = 20;

  private final ErrorCodeRules rules;
  private final ManufacturerNormalizer normalizer;
  private final SolutionRecovery recovery;
  private final Map<String, CompiledRules> compiled = new LinkedHashMap<>();

  public ErrorCodeExtractor(ExtractionRules extractionRules, ManufacturerNormalizer normalizer) {
    this.rules = extractionRules.errorCodes();
    this.normalizer = normalizer;
    this.recovery =
        new SolutionRecovery(rules.actionVerbs(), rules.extractionRules().maxSolutionLength());
    rules.manufacturers().forEach((key, mfr) -> compiled.put(key, compile(key, mfr)));
  }

  /**
   * Whether a manufacturer has an error-code rule set.
   *
   * @param manufacturer any known spelling of the manufacturer
   * @return true when codes can be extracted
   */
  public boolean supports(String manufacturer) {
    return resolveKey(manufacturer).isPresent();
  }

  /**
   * Extracts error codes from one page.
   *
   * @param text page text
   * @param pageNumber 1-based page
   * @param manufacturer manufacturer name, may be null
   * @return extracted codes or the reason none were attempted
   */
  public ErrorCodeExtraction extract(String text, int pageNumber, String manufacturer) {
    if (manufacturer == null || manufacturer.isBlank()) {
      log.warn("No manufacturer given for error code extraction on page {}, skipping", pageNumber);
      return ErrorCodeExtraction.noManufacturer();
    }
    Optional<String> key = resolveKey(manufacturer);
    if (key.isEmpty()) {
      return ErrorCodeExtraction.unknownManufacturer(manufacturer);
    }
    if (text == null || text.length() < MIN_TEXT_LENGTH) {
      return ErrorCodeExtraction.extracted(manufacturer, List.of());
    }
    List<ErrorCode> codes = scan(text, pageNumber, compiled.get(key.get()));
    return ErrorCodeExtraction.extracted(manufacturer, codes);
  }

  /**
   * Extracts error codes from one page, throwing for manufacturers without a rule set.
   *
   * @throws UnknownManufacturerException when the manufacturer has no rule set
   */
  public List<ErrorCode> extractOrThrow(String text, int pageNumber, String manufacturer) {
    return extract(text, pageNumber, manufacturer).orElseThrow();
  }

  /**
   * Searches the whole document for codes whose remediation is missing or short and fills in
   * richer descriptions and solutions, typically found in a detail section far from a code list.
   *
   * @param codes codes extracted page by page
   * @param fullText full document text
   * @param manufacturer manufacturer name
   * @return codes in the same order, enriched where a better section was found
   */
  public List<ErrorCode> enrichFromDocument(
      List<ErrorCode> codes, String fullText, String manufacturer) {
    Optional<String> key = resolveKey(manufacturer);
    if (key.isEmpty() || fullText == null || fullText.isEmpty()) {
      return codes;
    }
    CompiledRules mfr = compiled.get(key.get());
    long needing = codes.stream().filter(ErrorCodeExtractor::needsEnrichment).count();
    if (needing == 0) {
      log.debug("All error codes already have good solutions, skipping enrichment");
      return codes;
    }
    log.info("Enriching {}/{} error codes from the full document", needing, codes.size());

    ErrorCodeRules.Limits limits = rules.extractionRules();
    List<ErrorCode> enriched = new ArrayList<>(codes.size());
    for (ErrorCode code : codes) {
      if (!needsEnrichment(code)) {
        enriched.add(code);
        continue;
      }
      String bestDescription = code.description();
      String bestSolution = code.solution();
      double confidence = code.confidence();
      boolean changed = false;
      for (int[] span : occurrences(fullText, code.code())) {
        int limit = boundary(fullText, span[1], code.code(), mfr);
        SolutionRecovery.Description description =
            recovery.description(
                fullText,
                span[1],
                limit,
                limits.minDescriptionLength(),
                limits.maxDescriptionLength());
        if (description != null && description.text().length() > length(bestDescription)) {
          bestDescription = description.text();
          confidence = raise(confidence);
          changed = true;
        }
        String solution = solutionAt(fullText, span[1], limit, description);
        if (solution != null && solution.length() > length(bestSolution)) {
          bestSolution = solution;
          confidence = raise(confidence);
          changed = true;
          if (bestSolution.length() > RICH_SOLUTION_LENGTH) {
            break;
          }
        }
      }
      if (!changed) {
        enriched.add(code);
      } else {
        enriched.add(
            code.toBuilder()
                .description(bestDescription)
                .solution(bestSolution)
                .severity(severityOf(bestDescription, bestSolution))
                .confidence(Confidence.clamp(confidence))
                .extractionMethod(code.extractionMethod() + "_enriched")
                .build());
      }
    }
    return enriched;
  }

  /**
   * Checks an extracted code.
   *
   * @param code extracted code
   * @param manufacturer manufacturer the code was extracted for
   * @return issues, empty when the code is clean
   */
  public List<ValidationIssue> validate(ErrorCode code, String manufacturer) {
    List<ValidationIssue> issues = new ArrayList<>();
    Optional<CompiledRules> mfr = resolveKey(manufacturer).map(compiled::get);
    if (mfr.isPresent()
        && mfr.get().validation() != null
        && !mfr.get().validation().matcher(code.code()).matches()) {
      issues.add(
          new ValidationIssue(
              STAGE,
              "error_code",
              code.code(),
              "Error code does not match the " + mfr.get().key() + " format",
              IssueSeverity.ERROR));
    }
    if (code.description() == null || code.description().length() < MIN_VALID_DESCRIPTION) {
      issues.add(
          new ValidationIssue(
              STAGE,
              "error_description",
              code.description(),
              "Description too short (< " + MIN_VALID_DESCRIPTION + " chars)",
              IssueSeverity.WARNING));
    }
    if (code.confidence() < MIN_VALID_CONFIDENCE) {
      issues.add(
          new ValidationIssue(
              STAGE,
              "confidence",
              String.valueOf(code.confidence()),
              "Confidence below threshold (" + MIN_VALID_CONFIDENCE + ")",
              IssueSeverity.ERROR));
    }
    return issues;
  }

  /**
   * Validates a code and rejects it when any issue is blocking.
   *
   * @throws ValidationException carrying all issues when one of them is blocking
   */
  public List<ValidationIssue> requireValid(ErrorCode code, String manufacturer) {
    List<ValidationIssue> issues = validate(code, manufacturer);
    if (issues.stream().anyMatch(ValidationIssue::isBlocking)) {
      throw new ValidationException("Error code " + code.code() + " failed validation", issues);
    }
    return issues;
  }

  // ---- private helpers ----

  private List<ErrorCode> scan(String text, int pageNumber, CompiledRules mfr) {
    ErrorCodeRules.Limits limits = rules.extractionRules();
    double minConfidence =
        mfr.minConfidence() != null ? mfr.minConfidence() : limits.minConfidence();
    List<ErrorCode> found = new ArrayList<>();
    Set<String> seen = new HashSet<>();

    for (Pattern pattern : mfr.patterns()) {
      Matcher m = pattern.matcher(text);
      while (m.find()) {
        String code = (m.groupCount() > 0 && m.group(1) != null ? m.group(1) : m.group()).strip();
        if (code.isEmpty() || seen.contains(code)) {
          continue;
        }
        if (mfr.validation() != null && !mfr.validation().matcher(code).matches()) {
          continue;
        }
        if (rules.rejectCodes().contains(code.toLowerCase(Locale.ROOT))) {
          continue;
        }

        String context = context(text, m.start(), m.end(), limits.contextWindow());
        String contextLower = context.toLowerCase(Locale.ROOT);
        if (JAM_SHAPE.matcher(code).matches()
            && rules.jamKeywords().stream().noneMatch(contextLower::contains)) {
          log.debug("Skipping '{}' on page {}: no jam context", code, pageNumber);
          continue;
        }
        if (!contextMatches(contextLower, mfr)) {
          continue;
        }

        int limit = boundary(text, m.end(), code, mfr);
        SolutionRecovery.Description description =
            recovery.description(
                text,
                m.end(),
                limit,
                limits.minDescriptionLength(),
                limits.maxDescriptionLength());
        if (description == null || isGeneric(description.text())) {
          continue;
        }
        String solution = solutionAt(text, m.end(), limit, description);
        double confidence = confidence(code, description.text(), solution, context);
        if (confidence < minConfidence) {
          log.debug("Skipping '{}' on page {}: confidence {}", code, pageNumber, confidence);
          continue;
        }

        found.add(
            ErrorCode.builder()
                .code(code)
                .description(description.text())
                .solution(solution)
                .severity(severityOf(description.text(), solution))
                .confidence(confidence)
                .pageNumber(pageNumber)
                .context(context)
                .extractionMethod(mfr.key() + "_pattern")
                .build());
        seen.add(code);
      }
    }

    List<ErrorCode> unique = deduplicate(found);
    int cap = mfr.maxCodesPerPage() != null ? mfr.maxCodesPerPage() : limits.maxCodesPerPage();
    if (unique.size() > cap) {
      log.warn("Extracted {} error codes on page {}, keeping {}", unique.size(), pageNumber, cap);
      unique = new ArrayList<>(unique.subList(0, cap));
    }
    return unique;
  }

  /** End of the text that belongs to a code: the solution lookahead, cut at the next code. */
  private int boundary(String text, int codeEnd, String code, CompiledRules mfr) {
    int limit = Math.min(text.length(), codeEnd + rules.extractionRules().solutionLookahead());
    return Math.min(limit, nextOtherCode(text, codeEnd, limit, code, mfr));
  }

  private String solutionAt(
      String text, int codeEnd, int limit, SolutionRecovery.Description description) {
    String following = text.substring(codeEnd, limit);
    String afterDescription =
        description != null && description.end() < limit
            ? text.substring(description.end(), limit)
            : "";
    return recovery.solution(following, afterDescription);
  }

  /** Offset of the next different code. */
  private static int nextOtherCode(
      String text, int from, int limit, String code, CompiledRules mfr) {
    int next = limit;
    for (Pattern pattern : mfr.patterns()) {
      Matcher m = pattern.matcher(text);
      m.region(from, limit);
      while (m.find()) {
        String candidate = m.groupCount() > 0 && m.group(1) != null ? m.group(1) : m.group();
        if (!candidate.strip().equals(code)) {
          next = Math.min(next, m.start());
          break;
        }
      }
    }
    return next;
  }

  private double confidence(String code, String description, String solution, String context) {
    ErrorCodeRules.ConfidenceWeights w = rules.confidenceWeights();
    double score = w.base();
    int descriptionLength = length(description);
    if (descriptionLength > w.descriptionPresentLength()) {
      score += w.descriptionPresent();
    }
    if (descriptionLength > w.descriptionDetailedLength()) {
      score += w.descriptionDetailed();
    }
    if (descriptionLength > w.descriptionRichLength()) {
      score += w.descriptionRich();
    }
    if (solution != null) {
      score += w.solutionPresent();
      if (SolutionRecovery.isStructured(solution)) {
        score += w.solutionStructured();
      }
    }
    String contextLower = context.toLowerCase(Locale.ROOT);
    long terms = rules.technicalTerms().stream().filter(contextLower::contains).count();
    if (terms > 0) {
      score += w.technicalTermsPresent();
    }
    if (terms > w.technicalTermsDenseCount()) {
      score += w.technicalTermsDense();
    }
    if (countOccurrences(context, code) > 1) {
      score += w.repeatedCode();
    }
    if (context.length() > w.contextMinLength() && context.length() < w.contextMaxLength()) {
      score += w.contextLengthSane();
    }
    return Confidence.clamp(score);
  }

  Severity severityOf(String description, String solution) {
    String lower =
        ((description == null ? "" : description) + " " + (solution == null ? "" : solution))
            .toLowerCase(Locale.ROOT);
    for (Severity severity : List.of(Severity.CRITICAL, Severity.HIGH, Severity.LOW)) {
      List<String> keywords = rules.severityKeywords().getOrDefault(severity.getValue(), List.of());
      if (keywords.stream().anyMatch(kw -> lower.contains(kw.toLowerCase(Locale.ROOT)))) {
        return severity;
      }
    }
    return Severity.MEDIUM;
  }

  private boolean isGeneric(String description) {
    if (description.length() >= 50) {
      return false;
    }
    String lower = description.toLowerCase(Locale.ROOT);
    return rules.genericPhrases().stream().anyMatch(lower::contains);
  }

  private static boolean contextMatches(String contextLower, CompiledRules mfr) {
    boolean hasRequired =
        mfr.requiredContext().isEmpty()
            || mfr.requiredContext().stream().anyMatch(contextLower::contains);
    boolean hasExcluded = mfr.excludedContext().stream().anyMatch(contextLower::contains);
    return hasRequired && !hasExcluded;
  }

  private static List<ErrorCode> deduplicate(List<ErrorCode> codes) {
    Map<String, ErrorCode> best = new LinkedHashMap<>();
    for (ErrorCode code : codes) {
      best.merge(code.code(), code, (a, b) -> b.confidence() > a.confidence() ? b : a);
    }
    List<ErrorCode> unique = new ArrayList<>(best.values());
    unique.sort(Comparator.comparingDouble(ErrorCode::confidence).reversed());
    return unique;
  }

  private List<int[]> occurrences(String fullText, String code) {
    Pattern exact =
        Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(code) + "(?![\\p{L}\\p{N}])");
    List<int[]> all = new ArrayList<>();
    List<int[]> cued = new ArrayList<>();
    Matcher m = exact.matcher(fullText);
    while (m.find() && cued.size() < ENRICH_MATCH_LIMIT) {
      int[] span = {m.start(), m.end()};
      all.add(span);
      String before =
          fullText
              .substring(Math.max(0, m.start() - ENRICH_CONTEXT), m.start())
              .toLowerCase(Locale.ROOT);
      if (ENRICH_CUES.stream().anyMatch(before::contains)) {
        cued.add(span);
      }
    }
    return cued.isEmpty() ? all.subList(0, Math.min(ENRICH_FALLBACK_MATCHES, all.size())) : cued;
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

  private static boolean needsEnrichment(ErrorCode code) {
    return !code.hasSolution() || code.solution().length() <= GOOD_SOLUTION_LENGTH;
  }

  private static double raise(double confidence) {
    return Math.max(confidence, Math.min(ENRICHED_CONFIDENCE_CAP, confidence + 0.1));
  }

  private static String context(String text, int start, int end, int window) {
    return text.substring(Math.max(0, start - window), Math.min(text.length(), end + window))
        .strip();
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

  private static int length(String value) {
    return value == null ? 0 : value.length();
  }

  private static CompiledRules compile(String key, ErrorCodeRules.ManufacturerRules mfr) {
    List<Pattern> patterns = new ArrayList<>();
    for (String pattern : mfr.patterns()) {
      try {
        patterns.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.MULTILINE));
      } catch (PatternSyntaxException e) {
        log.error("Invalid error code pattern for {} '{}': {}", key, pattern, e.getDescription());
      }
    }
    Pattern validation = null;
    if (mfr.validationRegex() != null && !mfr.validationRegex().isBlank()) {
      try {
        validation = Pattern.compile(mfr.validationRegex());
      } catch (PatternSyntaxException e) {
        log.error("Invalid validation regex for {}: {}", key, e.getDescription());
      }
    }
    return new CompiledRules(
        key,
        List.copyOf(patterns),
        validation,
        mfr.requiredContext(),
        mfr.excludedContext(),
        mfr.minConfidence(),
        mfr.maxCodesPerPage());
  }

  private record CompiledRules(
      String key,
      List<Pattern> patterns,
      Pattern validation,
      List<String> requiredContext,
      List<String> excludedContext,
      Double minConfidence,
      Integer maxCodesPerPage) {}
}
