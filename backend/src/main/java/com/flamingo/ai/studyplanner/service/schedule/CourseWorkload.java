package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.domain.model.Course;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything the scheduler needs about one course.
 *
 * @param examDate resolved exam date, or null when unknown
 * @param topics in extraction order
 */
public record CourseWorkload(Course course, LocalDate examDate, List<TopicWorkload> topics) {

  public CourseWorkload {
    topics = topics == null ? List.of() : List.copyOf(topics);
  }
}
