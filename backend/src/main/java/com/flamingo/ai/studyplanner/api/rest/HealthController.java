package com.flamingo.ai.studyplanner.api.rest;

import com.flamingo.ai.studyplanner.api.dto.response.HealthResponse;
import com.flamingo.ai.studyplanner.service.run.RunRegistry;
import java.time.Instant;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
public class HealthController {

  private final RunRegistry runRegistry;
  private final boolean apiKeyConfigured;

  public HealthController(
      RunRegistry runRegistry, @Value("${langchain4j.openai.api-key:}") String apiKey) {
    this.runRegistry = runRegistry;
    this.apiKeyConfigured = apiKey != null && !apiKey.isBlank();
  }

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(
        HealthResponse.builder()
            .status("UP")
            .apiKeyConfigured(apiKeyConfigured)
            .activeRuns(runRegistry.activeRunCount())
            .timestamp(Instant.now())
            .build());
  }
}
