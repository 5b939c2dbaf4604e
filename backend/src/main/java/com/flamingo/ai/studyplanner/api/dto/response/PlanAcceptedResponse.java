package com.flamingo.ai.studyplanner.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO acknowledging a plan request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanAcceptedResponse {

  private String message;
  private String sessionId;
}
