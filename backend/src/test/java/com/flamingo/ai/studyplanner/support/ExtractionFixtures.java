package com.flamingo.ai.studyplanner.support;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.Course;
import com.flamingo.ai.studyplanner.exception.ExtractionTransportException;
import com.flamingo.ai.studyplanner.service.pipeline.AgentFactory;
import com.flamingo.ai.studyplanner.service.pipeline.ExternalCallRateLimiter;
import com.flamingo.ai.studyplanner.service.pipeline.ExtractionSupport;
import com.flamingo.ai.studyplanner.service.pipeline.IsolationManager;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;

/** Real extraction plumbing around a mocked agent factory, without waits. */
public final class ExtractionFixtures {

  public static final Course COURSE =
      new Course("course-1", "CS101", "Intro to CS", null, "#4a5d45");

  private ExtractionFixtures() {}

  public static PlannerConfig plannerConfig() {
    PlannerConfig config = new PlannerConfig();
    config.getRateLimit().setMinInterval(Duration.ZERO);
    return config;
  }

  public static ExtractionSupport extractionSupport(
      AgentFactory agentFactory, PlannerConfig config) {
    RetryRegistry retryRegistry =
        RetryRegistry.of(
            RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(ExtractionTransportException.class)
                .build());
    return new ExtractionSupport(
        new ExternalCallRateLimiter(config), new IsolationManager(agentFactory), retryRegistry);
  }
}
