package com.flamingo.ai.studyplanner.domain.model;

import java.util.List;

/** Textbook sections matched against the exam topics from the table of contents. */
public record LocatorRecord(List<Section> sections) {

  public LocatorRecord {
    sections = sections == null ? List.of() : List.copyOf(sections);
  }

  public static LocatorRecord empty() {
    return new LocatorRecord(List.of());
  }

  /** One chapter or section; pages are 1-indexed and inclusive. */
  public record Section(String chapter, int startPage, int endPage, List<String> coveredTopics) {
    public Section {
      coveredTopics = coveredTopics == null ? List.of() : List.copyOf(coveredTopics);
    }
  }
}
