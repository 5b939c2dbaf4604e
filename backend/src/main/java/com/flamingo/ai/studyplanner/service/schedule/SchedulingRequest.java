package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.domain.model.Constraints;
import java.time.LocalDate;
import java.util.List;

/**
 * Input of one scheduling pass.
 *
 * @param today first day that may hold study sessions
 * @param courses in the order the student listed them
 */
public record SchedulingRequest(
    LocalDate today, List<CourseWorkload> courses, Constraints constraints) {

  public SchedulingRequest {
    courses = courses == null ? List.of() : List.copyOf(courses);
  }
}
