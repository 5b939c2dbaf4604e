package com.flamingo.ai.studyplanner.domain.model;

import com.flamingo.ai.studyplanner.domain.enums.TaskKind;
import java.time.LocalDate;

/**
 * One dated study session. Identity is {@link #key()}: unique within a plan.
 *
 * @param flagged marked by the student for another look
 */
public record StudyTask(
    LocalDate date,
    String courseId,
    String courseCode,
    String courseColor,
    String topic,
    TaskKind kind,
    double durationHours,
    String resource,
    TaskNotes notes,
    boolean completed,
    boolean flagged) {

  public Key key() {
    return new Key(courseId, topic, kind, date);
  }

  public StudyTask withStatus(boolean completed, boolean flagged) {
    return new StudyTask(
        date,
        courseId,
        courseCode,
        courseColor,
        topic,
        kind,
        durationHours,
        resource,
        notes,
        completed,
        flagged);
  }

  /** Task identity. */
  public record Key(String courseId, String topic, TaskKind kind, LocalDate date) {}
}
