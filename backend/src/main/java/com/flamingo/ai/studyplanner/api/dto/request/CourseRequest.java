package com.flamingo.ai.studyplanner.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one course of a plan request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourseRequest {

  @NotBlank(message = "Course id is required")
  private String id;

  private String code;

  private String name;

  /** ISO date; blank or "unknown" leaves detection to the exam overview. */
  private String examDate;

  private String color;
}
