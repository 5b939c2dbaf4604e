package com.flamingo.ai.studyplanner.service.pipeline.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Renders topic names as the JSON array embedded in extraction prompts. */
@Component
@RequiredArgsConstructor
public class TopicListFormatter {

  private final ObjectMapper objectMapper;

  public String toJson(List<String> topics) {
    try {
      return objectMapper.writeValueAsString(topics);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize topic list", e);
    }
  }
}
