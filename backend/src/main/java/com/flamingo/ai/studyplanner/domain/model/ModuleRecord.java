package com.flamingo.ai.studyplanner.domain.model;

import java.util.List;

/**
 * Course structure detected in a syllabus. Immutable; doubles as the fallback topic source when
 * the exam overview yields nothing.
 */
public record ModuleRecord(
    String courseName, String courseCode, List<Module> modules, List<Assessment> assessments) {

  public ModuleRecord {
    modules = modules == null ? List.of() : List.copyOf(modules);
    assessments = assessments == null ? List.of() : List.copyOf(assessments);
  }

  public static ModuleRecord empty() {
    return new ModuleRecord(null, null, List.of(), List.of());
  }

  public int topicCount() {
    return modules.stream().mapToInt(m -> m.topics().size()).sum();
  }

  /** A syllabus module with its topic names. */
  public record Module(String name, List<String> topics, Integer week) {
    public Module {
      name = name == null ? "" : name;
      topics = topics == null ? List.of() : List.copyOf(topics);
    }
  }

  /** A graded item such as a midterm; {@code date} is kept as the raw text the syllabus used. */
  public record Assessment(String type, String weight, String date) {}
}
