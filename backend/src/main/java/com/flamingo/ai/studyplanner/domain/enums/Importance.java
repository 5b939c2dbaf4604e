package com.flamingo.ai.studyplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** How strongly a topic is weighted on the exam. Declaration order is the scheduling order. */
public enum Importance {
  HIGH,
  MEDIUM,
  LOW;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Lenient parse: anything unrecognised (including null) is {@link #MEDIUM}. */
  public static Importance fromLabel(String value) {
    if (value == null) {
      return MEDIUM;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "high", "critical", "essential" -> HIGH;
      case "low", "minor", "optional" -> LOW;
      default -> MEDIUM;
    };
  }
}
