package com.flamingo.ai.manualkb.service.entity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristics that recover a human-readable description and a remediation text following an error
 * code.
 *
 * <p>Remediation heuristics are tried in order and the first hit wins:
 *
 * <ol>
 *   <li>technician tier of a two-tier (customer / technician) action block,
 *   <li>a labeled action section followed by numbered or bulleted steps,
 *   <li>a generic {@code Solution:} / {@code Fix:} / {@code Remedy:} block, cut at the next header,
 *   <li>bare numbered steps,
 *   <li>bare bullet lists,
 *   <li>an imperative sentence right after the description.
 * </ol>
 */
final class SolutionRecovery {

  private static final Pattern CLASSIFICATION =
      Pattern.compile(
          "Classification\\s*\\n\\s*(.+?)(?:\\n\\s*Cause|\\n\\s*Measures|$)",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?\\n]{1,2}");
  private static final Pattern DESCRIPTION_PREFIX =
      Pattern.compile("^(?:[\\s:#\\-\\u2013\\u2014]|error\\b|code\\b)+", Pattern.CASE_INSENSITIVE);

  private static final Pattern ACTION_HEADER =
      Pattern.compile(
          "\\b(?:recommended\\s+action|corrective\\s+action|troubleshooting\\s+steps?"
              + "|service\\s+procedure|repair\\s+procedure|procedure|remedy|measures\\s+to\\s+take"
              + "|measures|correction)"
              + "(?:\\s+for\\s+(?:customers?|technicians?|agents?|users?"
              + "|when\\s+an\\s+alert\\s+occurs))?[ \\t]*(?::|\\n)",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern SOLUTION_LABEL =
      Pattern.compile(
          "\\b(?:solution|fix|remedy|resolution|procedure|action|steps?)\\s*:\\s*",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern SECTION_END_NOTE =
      Pattern.compile("\\n\\s*(?:note|warning|caution|important|tip)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern SECTION_END_TITLE = Pattern.compile("\\n\\s*[A-Z][a-z]+\\s+[A-Z]");
  private static final Pattern SECTION_END_NUMBERED = Pattern.compile("\\n\\s*\\d+\\.\\d+\\s");

  private static final Pattern SENTENCE =
      Pattern.compile("[.!?](?=\\s|$)|\\n");
  private static final Pattern STEP_LINE =
      Pattern.compile(
          "^\\s{0,4}(?:\\d+[.)]|[\\u2022*\\-\\u2013]|[a-z][.)]|step\\s+\\d+[:.]?)\\s+\\S",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern NUMBERED_LINE =
      Pattern.compile("^\\s*(?:\\d+[.)]|step\\s+\\d+[:.]?)\\s+\\S", Pattern.CASE_INSENSITIVE);
  private static final Pattern BULLET_LINE = Pattern.compile("^\\s*[\\u2022*\\-\\u2013]\\s+\\S");
  private static final Pattern STRUCTURED =
      Pattern.compile("(?m)^\\s*(?:\\d+[.)]|[\\u2022*\\-\\u2013])\\s");

  private static final Pattern CUSTOMER_TIER =
      Pattern.compile("recommended\\s+action\\s+for\\s+customers?", Pattern.CASE_INSENSITIVE);
  private static final Pattern TECHNICIAN_TIER =
      Pattern.compile(
          "recommended\\s+action\\s+for\\s+(?:onsite\\s+|call-center\\s+)?"
              + "(?:technicians?|agents?)[^\\n]*\\n",
          Pattern.CASE_INSENSITIVE);

  private static final int MAX_ACTION_LINES = 50;
  private static final int MAX_NUMBERED_LINES = 30;
  private static final int MAX_BULLET_LINES = 8;

  private final List<String> actionVerbs;
  private final int maxSolutionLength;

  SolutionRecovery(List<String> actionVerbs, int maxSolutionLength) {
    this.actionVerbs = actionVerbs;
    this.maxSolutionLength = maxSolutionLength;
  }

  /**
   * A description and the offset in the source text where it ends.
   *
   * @param text description text
   * @param end offset just after the sentence terminator
   */
  record Description(String text, int end) {}

  /**
   * Recovers the description following a code.
   *
   * @param text page or document text
   * @param codeEnd offset where the code ends
   * @param limit offset the description may not cross, usually the next code
   * @param minLength minimum length of the raw sentence
   * @param maxLength maximum description length
   * @return description, or null when too short
   */
  Description description(String text, int codeEnd, int limit, int minLength, int maxLength) {
    int end = Math.min(Math.min(text.length(), limit), codeEnd + maxLength * 2);
    String remaining = text.substring(codeEnd, Math.max(codeEnd, end));

    Matcher classification = CLASSIFICATION.matcher(remaining);
    if (classification.find()) {
      String description = truncateAtWord(classification.group(1).strip(), maxLength);
      if (!description.isEmpty()) {
        return new Description(description, codeEnd + classification.end(1));
      }
    }

    String window = remaining.substring(0, Math.min(remaining.length(), maxLength));
    Matcher sentenceEnd = SENTENCE_END.matcher(window);
    String raw;
    int endOffset;
    if (sentenceEnd.find()) {
      raw = window.substring(0, sentenceEnd.start()).strip();
      endOffset = codeEnd + sentenceEnd.end();
    } else {
      raw = window.strip();
      endOffset = codeEnd + window.length();
    }
    if (raw.length() < minLength) {
      return null;
    }
    String description = DESCRIPTION_PREFIX.matcher(raw).replaceFirst("").strip();
    return description.isEmpty() ? null : new Description(description, endOffset);
  }

  /**
   * Recovers remediation text.
   *
   * @param following text after the code, already bounded
   * @param afterDescription text after the description sentence, may be empty
   * @return remediation text, or null when no heuristic applies
   */
  String solution(String following, String afterDescription) {
    String solution = technicianTier(following);
    if (solution == null) {
      solution = labeledSteps(following);
    }
    if (solution == null) {
      solution = labeledBlock(following);
    }
    if (solution == null) {
      solution = numberedSteps(following);
    }
    if (solution == null) {
      solution = bulletList(following);
    }
    if (solution == null) {
      solution = imperativeSentence(afterDescription);
    }
    if (solution == null || solution.isBlank()) {
      return null;
    }
    return solution.length() > maxSolutionLength
        ? solution.substring(0, maxSolutionLength).strip()
        : solution.strip();
  }

  static boolean isStructured(String solution) {
    return solution != null && STRUCTURED.matcher(solution).find();
  }

  static boolean isMultiTier(String text) {
    return CUSTOMER_TIER.matcher(text).find() && TECHNICIAN_TIER.matcher(text).find();
  }

  // ---- heuristics ----

  private String technicianTier(String text) {
    if (!isMultiTier(text)) {
      return null;
    }
    Matcher tier = TECHNICIAN_TIER.matcher(text);
    if (!tier.find()) {
      return null;
    }
    List<String> steps = collectSteps(text.substring(tier.end()), STEP_LINE, MAX_ACTION_LINES);
    return steps.isEmpty() ? null : String.join("\n", steps);
  }

  private String labeledSteps(String text) {
    Matcher header = ACTION_HEADER.matcher(text);
    while (header.find()) {
      List<String> steps = collectSteps(text.substring(header.end()), STEP_LINE, MAX_ACTION_LINES);
      if (!steps.isEmpty()) {
        return String.join("\n", steps);
      }
    }
    return null;
  }

  private String labeledBlock(String text) {
    Matcher label = SOLUTION_LABEL.matcher(text);
    if (!label.find()) {
      return null;
    }
    String block = text.substring(label.end(), Math.min(text.length(), label.end() + 1500));
    for (Pattern end : List.of(SECTION_END_NOTE, SECTION_END_TITLE, SECTION_END_NUMBERED)) {
      Matcher m = end.matcher(block);
      if (m.find()) {
        block = block.substring(0, m.start());
        break;
      }
    }
    block = block.strip();
    return block.length() < 20 ? null : block;
  }

  private String numberedSteps(String text) {
    List<String> steps = stepsFromFirstMatch(text, NUMBERED_LINE, MAX_NUMBERED_LINES);
    return steps.size() >= 2 ? String.join("\n", steps) : null;
  }

  private String bulletList(String text) {
    List<String> bullets = stepsFromFirstMatch(text, BULLET_LINE, MAX_BULLET_LINES);
    return bullets.size() >= 2 ? String.join("\n", bullets) : null;
  }

  private String imperativeSentence(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    String stripped = text.stripLeading();
    Matcher end = SENTENCE.matcher(stripped);
    String sentence = end.find() ? stripped.substring(0, end.end()) : stripped;
    sentence = sentence.strip();
    String lower = sentence.toLowerCase(Locale.ROOT);
    for (String verb : actionVerbs) {
      if (lower.startsWith(verb + " ") && sentence.length() > verb.length() + 3) {
        return sentence;
      }
    }
    return null;
  }

  // ---- line helpers ----

  private static List<String> stepsFromFirstMatch(String text, Pattern stepLine, int maxLines) {
    String[] lines = text.split("\\n");
    for (int i = 0; i < lines.length; i++) {
      if (stepLine.matcher(lines[i]).find()) {
        String rest = String.join("\n", List.of(lines).subList(i, lines.length));
        return collectSteps(rest, stepLine, maxLines);
      }
    }
    return List.of();
  }

  /**
   * Collects step lines from the start of {@code text}. Blank lines between steps are skipped,
   * other lines continue the previous step unless they look like a new section header.
   */
  private static List<String> collectSteps(String text, Pattern stepLine, int maxLines) {
    List<String> steps = new ArrayList<>();
    String[] lines = text.split("\\n");
    int seen = 0;
    for (String line : lines) {
      if (seen++ >= maxLines) {
        break;
      }
      String stripped = line.strip();
      if (stepLine.matcher(line).find()) {
        steps.add(stripped);
      } else if (stripped.isEmpty()) {
        if (steps.isEmpty()) {
          continue;
        }
      } else if (steps.isEmpty()) {
        break;
      } else if (looksLikeHeader(stripped, steps.get(steps.size() - 1))) {
        break;
      } else {
        steps.set(steps.size() - 1, steps.get(steps.size() - 1) + " " + stripped);
      }
    }
    return steps;
  }

  private static boolean looksLikeHeader(String line, String previousStep) {
    char last = previousStep.charAt(previousStep.length() - 1);
    boolean previousClosed = last == '.' || last == '!' || last == '?' || last == ':';
    return previousClosed && Character.isUpperCase(line.charAt(0)) && !line.endsWith(".");
  }

  private static String truncateAtWord(String text, int maxLength) {
    if (text.length() <= maxLength) {
      return text;
    }
    String cut = text.substring(0, maxLength);
    int space = cut.lastIndexOf(' ');
    return (space > 0 ? cut.substring(0, space) : cut) + "...";
  }
}
