package com.flamingo.ai.studyplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Kind of course document a student can upload. */
public enum DocumentKind {
  SYLLABUS("syllabus"),
  EXAM_OVERVIEW("exam_overview"),
  TEXTBOOK("textbook");

  private final String label;

  DocumentKind(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /**
   * Parses a wire label. {@code midterm_overview} is accepted as an alias of {@link
   * #EXAM_OVERVIEW}.
   *
   * @throws IllegalArgumentException if the label is unknown
   */
  @JsonCreator
  public static DocumentKind fromLabel(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Document kind is required");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    if ("midterm_overview".equals(normalized)) {
      return EXAM_OVERVIEW;
    }
    for (DocumentKind kind : values()) {
      if (kind.label.equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown document kind: " + value);
  }
}
