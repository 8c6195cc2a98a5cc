package com.flamingo.ai.manualkb.service.extraction;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Recovers table rows that list error codes from a page's positioned lines.
 *
 * <p>Printed code tables often use dot leaders between the code and its description
 * ({@code 13.A1.B2 ........ Paper jam}). Plain text flattening interleaves such columns; reading
 * the rebuilt visual lines keeps each code next to its description.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StructuredLayoutScanner {

  private static final Pattern CODE_TOKEN =
      Pattern.compile("\\d{2}\\.[0-9A-Za-z]{2,3}\\.[0-9A-Za-z]{2}");
  private static final Pattern LEADER_RUN = Pattern.compile("(?:\\.{2,}|[\\u00B7\\u2022\\u2026]+)");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final String ELLIPSIS = "…";

  private final ManualKbConfig config;

  /**
   * Scans one page.
   *
   * @param lines positioned lines of the page, in reading order
   * @return matching lines joined by newlines, or empty when no line qualifies
   */
  public Optional<String> scan(List<PositionedLine> lines) {
    List<String> kept = scanLines(lines);
    return kept.isEmpty() ? Optional.empty() : Optional.of(String.join("\n", kept));
  }

  /**
   * Returns the qualifying lines of a page, deduplicated and capped.
   *
   * @param lines positioned lines of the page
   * @return at most {@code maxLines} lines, none longer than {@code maxLineLength}
   */
  public List<String> scanLines(List<PositionedLine> lines) {
    ManualKbConfig.StructuredScan settings = config.getStructuredScan();
    if (lines == null || lines.isEmpty() || settings.getMaxLines() <= 0) {
      return List.of();
    }

    Set<String> kept = new LinkedHashSet<>();
    for (PositionedLine line : lines) {
      String normalized = normalize(line.text());
      if (normalized.isEmpty()) {
        continue;
      }
      String compact = WHITESPACE.matcher(normalized).replaceAll("");
      if (!CODE_TOKEN.matcher(compact).find()) {
        continue;
      }
      kept.add(truncate(normalized, settings.getMaxLineLength()));
      if (kept.size() >= settings.getMaxLines()) {
        log.debug("Structured scan hit the {} line cap", settings.getMaxLines());
        break;
      }
    }
    return new ArrayList<>(kept);
  }

  // ---- private helpers ----

  static String normalize(String text) {
    if (text == null) {
      return "";
    }
    String withoutLeaders = LEADER_RUN.matcher(text).replaceAll(" ");
    return WHITESPACE.matcher(withoutLeaders).replaceAll(" ").strip();
  }

  private static String truncate(String line, int maxLength) {
    if (maxLength <= 0 || line.length() <= maxLength) {
      return line;
    }
    if (maxLength == 1) {
      return ELLIPSIS;
    }
    return line.substring(0, maxLength - 1).stripTrailing() + ELLIPSIS;
  }
}
