package com.flamingo.ai.studyplanner.agent.dto;

import java.util.List;

/** Structured output from ExamScopeAgent. */
public record ExamScopeAnalysis(
    String examDate, // YYYY-MM-DD, or "unknown"
    List<TopicItem> topics) {

  /** importance is one of high, medium, low. */
  public record TopicItem(String name, String importance) {}
}
