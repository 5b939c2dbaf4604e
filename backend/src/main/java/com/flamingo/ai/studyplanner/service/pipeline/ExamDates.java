package com.flamingo.ai.studyplanner.service.pipeline;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;

/** Lenient exam date parsing shared by request mapping and the scope stage. */
public final class ExamDates {

  private static final Set<String> UNKNOWN = Set.of("unknown", "n/a", "na", "none", "tbd", "tba");

  private ExamDates() {}

  /**
   * Parses an ISO date, tolerating a trailing time part.
   *
   * @return the date, or null when the text is blank, a placeholder such as "unknown", or not a
   *     date
   */
  public static LocalDate parse(String text) {
    if (text == null) {
      return null;
    }
    String trimmed = text.trim();
    if (trimmed.isEmpty() || UNKNOWN.contains(trimmed.toLowerCase(Locale.ROOT))) {
      return null;
    }
    if (trimmed.length() > 10 && trimmed.charAt(10) == 'T') {
      trimmed = trimmed.substring(0, 10);
    }
    try {
      return LocalDate.parse(trimmed);
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
