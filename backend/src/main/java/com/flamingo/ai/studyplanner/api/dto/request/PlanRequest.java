package com.flamingo.ai.studyplanner.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for generating a study plan. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanRequest {

  @NotBlank(message = "Session id is required")
  private String sessionId;

  @NotNull(message = "Courses are required")
  @Size(min = 1, message = "At least one course is required")
  @Valid
  private List<CourseRequest> courses;

  @NotNull(message = "Constraints are required")
  @Valid
  private ConstraintsRequest constraints;
}
