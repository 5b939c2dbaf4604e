package com.flamingo.ai.studyplanner.agent.dto;

import java.util.List;

/** Structured output from SyllabusStructureAgent. */
public record SyllabusAnalysis(
    String courseName,
    String courseCode,
    List<ModuleItem> modules,
    List<AssessmentItem> assessments) {

  /** A module as written in the syllabus. */
  public record ModuleItem(String name, List<String> topics, Integer week) {}

  /** A graded item; weight and date are kept as free text, e.g. "30%" and "2026-11-04". */
  public record AssessmentItem(String type, String weight, String date) {}
}
