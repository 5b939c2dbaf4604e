package com.flamingo.ai.studyplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** How far after a topic's practice session its review session should land. */
public enum ReviewCadence {
  DAILY("daily", 1),
  EVERY_2_DAYS("every_2_days", 2),
  WEEKLY("weekly", 7);

  private final String label;
  private final int gapDays;

  ReviewCadence(String label, int gapDays) {
    this.label = label;
    this.gapDays = gapDays;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public int gapDays() {
    return gapDays;
  }

  /** Parses a wire label; null or blank means {@link #DAILY}. */
  @JsonCreator
  public static ReviewCadence fromLabel(String value) {
    if (value == null || value.isBlank()) {
      return DAILY;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ReviewCadence cadence : values()) {
      if (cadence.label.equals(normalized)) {
        return cadence;
      }
    }
    throw new IllegalArgumentException("Unknown review frequency: " + value);
  }
}
