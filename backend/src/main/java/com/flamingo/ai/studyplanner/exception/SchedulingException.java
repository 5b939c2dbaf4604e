package com.flamingo.ai.studyplanner.exception;

/** Exception thrown when no valid plan can be produced. Fatal for a run. */
public class SchedulingException extends RuntimeException {

  public SchedulingException(String message) {
    super(message);
  }

  public static SchedulingException noCourses() {
    return new SchedulingException("No courses to schedule");
  }

  public static SchedulingException noTopics() {
    return new SchedulingException("No topics were found for any course");
  }

  public static SchedulingException noExamDate() {
    return new SchedulingException(
        "No course has a usable exam date. Enter an exam date or upload an exam overview.");
  }

  public static SchedulingException nothingFits() {
    return new SchedulingException(
        "No study time is available before any exam date with the given constraints");
  }
}
