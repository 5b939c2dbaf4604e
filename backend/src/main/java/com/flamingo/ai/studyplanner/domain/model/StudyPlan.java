package com.flamingo.ai.studyplanner.domain.model;

import java.time.LocalDate;
import java.util.List;

/** Scheduler output: tasks in chronological order plus what was left out and why. */
public record StudyPlan(
    List<StudyTask> tasks, List<LocalDate> restDays, List<DroppedTopic> droppedTopics) {

  public StudyPlan {
    tasks = List.copyOf(tasks);
    restDays = List.copyOf(restDays);
    droppedTopics = List.copyOf(droppedTopics);
  }

  public long studyDayCount() {
    return tasks.stream().map(StudyTask::date).distinct().count();
  }

  public double totalHours() {
    return tasks.stream().mapToDouble(StudyTask::durationHours).sum();
  }
}
