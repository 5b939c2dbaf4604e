package com.flamingo.ai.studyplanner.agent.dto;

import java.util.List;

/** Structured output from TocLocatorAgent. */
public record TocLocation(List<SectionItem> relevantSections) {

  /** A chapter or section range; pages are the textbook's 1-indexed page numbers. */
  public record SectionItem(
      String chapter, Integer startPage, Integer endPage, List<String> coversTopics) {}
}
