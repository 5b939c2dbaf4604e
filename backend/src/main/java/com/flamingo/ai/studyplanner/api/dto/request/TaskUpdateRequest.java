package com.flamingo.ai.studyplanner.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for updating the completion and review flags of a task. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskUpdateRequest {

  @NotBlank(message = "Course id is required")
  private String courseId;

  @NotBlank(message = "Topic is required")
  private String topic;

  @NotBlank(message = "Task type is required")
  private String taskType;

  @NotNull(message = "Date is required")
  private LocalDate date;

  @JsonAlias("isCompleted")
  private boolean completed;

  @JsonAlias("isFlagged")
  private boolean flagged;
}
