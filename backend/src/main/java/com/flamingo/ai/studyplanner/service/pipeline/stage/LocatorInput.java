package com.flamingo.ai.studyplanner.service.pipeline.stage;

import com.flamingo.ai.studyplanner.domain.model.Course;
import java.util.List;

/**
 * @param tocText text of the textbook's leading pages, or null without a textbook
 * @param totalPages page count of the textbook, 0 when unknown
 * @param topics effective topic names to locate
 */
public record LocatorInput(Course course, String tocText, int totalPages, List<String> topics)
    implements StageInput {

  public LocatorInput {
    topics = topics == null ? List.of() : List.copyOf(topics);
  }
}
