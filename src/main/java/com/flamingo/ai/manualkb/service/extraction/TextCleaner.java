package com.flamingo.ai.manualkb.service.extraction;

import java.util.regex.Pattern;

/** Normalizes raw page text before it reaches the extractors and the chunker. */
public final class TextCleaner {

  private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");
  private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

  private TextCleaner() {}

  /**
   * Strips NUL characters, collapses horizontal whitespace, trims every line and collapses runs of
   * blank lines to a single blank line.
   *
   * @param raw raw page text, may be null
   * @return cleaned text, never null
   */
  public static String clean(String raw) {
    if (raw == null || raw.isEmpty()) {
      return "";
    }
    String text = raw.replace("\u0000", "").replace("\r\n", "\n").replace('\r', '\n');
    text = HORIZONTAL_WHITESPACE.matcher(text).replaceAll(" ");

    StringBuilder sb = new StringBuilder(text.length());
    for (String line : text.split("\n", -1)) {
      sb.append(line.strip()).append('\n');
    }
    return EXCESS_NEWLINES.matcher(sb).replaceAll("\n\n").strip();
  }
}
