package com.flamingo.ai.studyplanner.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics and the shared clock. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation for method-level timing metrics.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags() {
    return registry -> registry.config().commonTags("application", "study-planner");
  }

  /** Source of "now" for event timestamps, watchdog checks and the scheduler's "today". */
  @Bean
  public Clock clock(PlannerConfig plannerConfig) {
    return Clock.system(plannerConfig.zoneId());
  }
}
