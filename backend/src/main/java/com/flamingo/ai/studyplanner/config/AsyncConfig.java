package com.flamingo.ai.studyplanner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for background plan runs and the run watchdog. */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

  /**
   * Runs one pipeline per task. Runs spend nearly all their time waiting on the shared rate
   * limiter, so a small pool is enough.
   */
  @Bean(name = "planExecutor")
  public AsyncTaskExecutor planExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("plan-run-");
    executor.initialize();
    return executor;
  }
}
