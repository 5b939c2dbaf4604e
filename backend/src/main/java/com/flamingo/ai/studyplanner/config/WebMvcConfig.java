package com.flamingo.ai.studyplanner.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Web MVC configuration for async request handling (SSE progress streams) and CORS. */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final PlannerConfig plannerConfig;

  /**
   * Progress streams stay open for a whole run, which can take many minutes when the rate limiter
   * is tight. The async timeout is therefore tied to the stall timeout instead of a fixed value.
   */
  @Override
  public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
    configurer.setTaskExecutor(asyncTaskExecutor());
    configurer.setDefaultTimeout(
        plannerConfig.getPipeline().getStallTimeout().multipliedBy(2).toMillis());
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry.addMapping("/api/**").allowedOriginPatterns("*").allowedMethods("*");
  }

  /**
   * Creates a thread pool task executor for async request handling.
   *
   * <ul>
   *   <li>Core pool size: 5 - typical number of open progress streams
   *   <li>Max pool size: 20 - accommodates burst traffic
   *   <li>Queue capacity: 50 - buffers requests during high load
   * </ul>
   *
   * @return configured thread pool task executor
   */
  @Bean(name = "asyncTaskExecutor")
  public AsyncTaskExecutor asyncTaskExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(5);
    executor.setMaxPoolSize(20);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("async-sse-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    executor.initialize();
    return executor;
  }
}
