package com.flamingo.ai.studyplanner.agent.dto;

import java.util.List;

/** Structured output from ResourceMapperAgent. */
public record ResourceMapping(List<MappingItem> mappings) {

  /** resource is a human-readable pointer such as "Ch 3.2-3.4 (pp. 45-67)". */
  public record MappingItem(String topic, String resource, Double estimatedHours) {}
}
