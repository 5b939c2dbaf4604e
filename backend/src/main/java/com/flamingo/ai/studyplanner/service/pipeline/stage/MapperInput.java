package com.flamingo.ai.studyplanner.service.pipeline.stage;

import com.flamingo.ai.studyplanner.domain.model.Course;
import java.util.List;

/**
 * @param sampledText page text sampled from the located sections, or null when nothing was located
 * @param topics effective topic names; the mapping holds exactly one entry per name
 */
public record MapperInput(Course course, String sampledText, List<String> topics)
    implements StageInput {

  public MapperInput {
    topics = topics == null ? List.of() : List.copyOf(topics);
  }
}
