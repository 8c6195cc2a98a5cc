package com.flamingo.ai.manualkb.service.extraction;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses PDF ({@code D:YYYYMMDDHHmmSS...}) and ISO-8601 date strings. */
final class PdfDates {

  private static final Pattern PDF_DATE =
      Pattern.compile("^D:(\\d{4})(\\d{2})?(\\d{2})?(\\d{2})?(\\d{2})?(\\d{2})?");

  private PdfDates() {}

  /**
   * Parses a date, returning null for blank or unparseable input.
   *
   * @param raw PDF date string or ISO-8601 timestamp
   * @return local date-time, timezone offset ignored
   */
  static LocalDateTime parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    String value = raw.strip();
    Matcher m = PDF_DATE.matcher(value);
    if (m.find()) {
      try {
        return LocalDateTime.of(
            Integer.parseInt(m.group(1)),
            part(m.group(2), 1),
            part(m.group(3), 1),
            part(m.group(4), 0),
            part(m.group(5), 0),
            part(m.group(6), 0));
      } catch (DateTimeException e) {
        return null;
      }
    }
    try {
      return value.length() > 19
          ? OffsetDateTime.parse(value).toLocalDateTime()
          : LocalDateTime.parse(value);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static int part(String group, int fallback) {
    return group == null ? fallback : Integer.parseInt(group);
  }
}
