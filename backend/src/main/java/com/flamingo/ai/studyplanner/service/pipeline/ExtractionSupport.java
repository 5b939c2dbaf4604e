package com.flamingo.ai.studyplanner.service.pipeline;

import com.flamingo.ai.studyplanner.exception.ExtractionTransportException;
import com.flamingo.ai.studyplanner.exception.PipelineCancelledException;
import com.flamingo.ai.studyplanner.service.pipeline.IsolationManager.IsolatedCall;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * The one path every external call takes: rate limiter, then a fresh isolated context, with
 * transport failures retried by the {@code extraction} retry instance. Each attempt waits its
 * turn at the limiter and gets a brand-new context.
 */
@Component
@Slf4j
public class ExtractionSupport {

  public static final String RETRY_NAME = "extraction";

  private final ExternalCallRateLimiter rateLimiter;
  private final IsolationManager isolationManager;
  private final Retry retry;

  public ExtractionSupport(
      ExternalCallRateLimiter rateLimiter,
      IsolationManager isolationManager,
      RetryRegistry retryRegistry) {
    this.rateLimiter = rateLimiter;
    this.isolationManager = isolationManager;
    this.retry = retryRegistry.retry(RETRY_NAME);
    this.retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Retrying external call (attempt {}): {}",
                    event.getNumberOfRetryAttempts(),
                    event.getLastThrowable() != null
                        ? event.getLastThrowable().getMessage()
                        : "unknown"));
  }

  /**
   * Performs one logical external call.
   *
   * @param agentName stage name used in errors
   * @param agentType the AI service interface to build per attempt
   * @param call the work to run against the agent
   * @throws ExtractionTransportException once all attempts failed
   * @throws PipelineCancelledException if interrupted while waiting for the limiter
   */
  public <A, T> T call(String agentName, Class<A> agentType, IsolatedCall<A, T> call) {
    return Retry.decorateSupplier(
            retry,
            () -> {
              rateLimiter.acquire();
              try {
                return isolationManager.withFreshContext(agentType, call);
              } catch (PipelineCancelledException e) {
                throw e;
              } catch (RuntimeException e) {
                throw new ExtractionTransportException(agentName, e);
              }
            })
        .get();
  }
}
