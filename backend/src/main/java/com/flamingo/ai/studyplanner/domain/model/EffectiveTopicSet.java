package com.flamingo.ai.studyplanner.domain.model;

import com.flamingo.ai.studyplanner.domain.model.ScopeRecord.ScopedTopic;
import java.util.List;

/**
 * Topics actually scheduled for a course.
 *
 * @param fromFallback true when the topics were derived from the syllabus modules
 */
public record EffectiveTopicSet(List<ScopedTopic> topics, boolean fromFallback) {

  public EffectiveTopicSet {
    topics = topics == null ? List.of() : List.copyOf(topics);
  }

  public boolean isEmpty() {
    return topics.isEmpty();
  }

  public List<String> names() {
    return topics.stream().map(ScopedTopic::name).toList();
  }
}
