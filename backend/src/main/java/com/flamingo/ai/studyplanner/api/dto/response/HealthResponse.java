package com.flamingo.ai.studyplanner.api.dto.response;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the health check. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

  private String status;
  private boolean apiKeyConfigured;
  private long activeRuns;
  private Instant timestamp;
}
