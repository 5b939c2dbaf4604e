package com.flamingo.ai.studyplanner.exception;

import com.flamingo.ai.studyplanner.domain.model.StudyTask;

/** Exception thrown when a plan has no task with the given identity. */
public class TaskNotFoundException extends RuntimeException {

  private final StudyTask.Key key;

  public TaskNotFoundException(StudyTask.Key key) {
    super("Task not found: " + key);
    this.key = key;
  }

  public StudyTask.Key getKey() {
    return key;
  }
}
