package com.flamingo.ai.studyplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Kind of study session. Declaration order is the order sessions happen for one topic. */
public enum TaskKind {
  LEARN,
  PRACTICE,
  REVIEW;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static TaskKind fromLabel(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Task type is required");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
