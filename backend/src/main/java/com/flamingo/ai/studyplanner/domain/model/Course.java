package com.flamingo.ai.studyplanner.domain.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A course being planned for. The {@code id} is stable for the lifetime of a plan and never
 * derived from the display {@code code}.
 *
 * @param examDate user-entered exam date, or null when the user left it blank
 */
public record Course(String id, String code, String name, LocalDate examDate, String color) {

  public Course {
    Objects.requireNonNull(id, "id");
    code = code == null || code.isBlank() ? id : code;
    name = name == null ? "" : name;
  }

  public Course withExamDate(LocalDate date) {
    return new Course(id, code, name, date, color);
  }
}
