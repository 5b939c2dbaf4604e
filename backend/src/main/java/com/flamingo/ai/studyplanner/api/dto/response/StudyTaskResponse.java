package com.flamingo.ai.studyplanner.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.studyplanner.domain.model.StudyTask;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one study task. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StudyTaskResponse {

  private String date;
  private String courseId;

  /** Display code of the course. */
  private String course;

  private String courseColor;
  private String topic;

  @JsonProperty("task_type")
  private String taskType;

  @JsonProperty("duration_hours")
  private double durationHours;

  private String resources;
  private String notes;

  @JsonProperty("isCompleted")
  private boolean completed;

  @JsonProperty("isFlagged")
  private boolean flagged;

  /** Creates a StudyTaskResponse from a study task. */
  public static StudyTaskResponse fromTask(StudyTask task) {
    return StudyTaskResponse.builder()
        .date(task.date().toString())
        .courseId(task.courseId())
        .course(task.courseCode())
        .courseColor(task.courseColor())
        .topic(task.topic())
        .taskType(task.kind().label())
        .durationHours(task.durationHours())
        .resources(task.resource())
        .notes(task.notes().render())
        .completed(task.completed())
        .flagged(task.flagged())
        .build();
  }
}
