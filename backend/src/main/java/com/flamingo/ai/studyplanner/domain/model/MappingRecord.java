package com.flamingo.ai.studyplanner.domain.model;

import java.util.List;
import java.util.Optional;

/** Study resource and effort estimate for each effective topic. */
public record MappingRecord(List<TopicMapping> mappings) {

  public MappingRecord {
    mappings = mappings == null ? List.of() : List.copyOf(mappings);
  }

  public Optional<TopicMapping> find(String topic) {
    return mappings.stream().filter(m -> m.topic().equalsIgnoreCase(topic)).findFirst();
  }

  public double totalHours() {
    return mappings.stream().mapToDouble(TopicMapping::estimatedHours).sum();
  }

  /** Resource label and positive hour estimate for one topic. */
  public record TopicMapping(String topic, String resource, double estimatedHours) {}
}
