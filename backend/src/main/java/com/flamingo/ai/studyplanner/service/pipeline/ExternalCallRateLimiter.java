package com.flamingo.ai.studyplanner.service.pipeline;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.exception.PipelineCancelledException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Process-wide limiter spacing the starts of external calls at least {@code minInterval} apart.
 *
 * <p>Callers are served strictly in arrival order: the fair lock is held while waiting out the
 * interval, so a later caller can never be granted before an earlier one.
 */
@Component
@Slf4j
public class ExternalCallRateLimiter {

  private final ReentrantLock lock = new ReentrantLock(true);
  private final long minIntervalNanos;
  private final LongSupplier nanoClock;
  private final Sleeper sleeper;

  // guarded by lock
  private long lastGrantNanos;
  private boolean hasGranted;

  @Autowired
  public ExternalCallRateLimiter(PlannerConfig plannerConfig) {
    this(
        plannerConfig.getRateLimit().getMinInterval(),
        System::nanoTime,
        TimeUnit.NANOSECONDS::sleep);
  }

  ExternalCallRateLimiter(Duration minInterval, LongSupplier nanoClock, Sleeper sleeper) {
    if (minInterval.isNegative()) {
      throw new IllegalArgumentException("minInterval must not be negative");
    }
    this.minIntervalNanos = minInterval.toNanos();
    this.nanoClock = nanoClock;
    this.sleeper = sleeper;
  }

  /**
   * Blocks until the interval since the previous grant has elapsed, then records a new grant.
   *
   * @return the grant time on the limiter's nano clock
   * @throws PipelineCancelledException if the waiting thread is interrupted
   */
  public long acquire() {
    try {
      lock.lockInterruptibly();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PipelineCancelledException("Interrupted while waiting for the rate limiter");
    }
    try {
      if (hasGranted) {
        long remaining = lastGrantNanos + minIntervalNanos - nanoClock.getAsLong();
        if (remaining > 0) {
          log.debug(
              "Rate limiter delaying call by {} ms", TimeUnit.NANOSECONDS.toMillis(remaining));
        }
        while (remaining > 0) {
          sleeper.sleep(remaining);
          remaining = lastGrantNanos + minIntervalNanos - nanoClock.getAsLong();
        }
      }
      lastGrantNanos = nanoClock.getAsLong();
      hasGranted = true;
      return lastGrantNanos;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PipelineCancelledException("Interrupted while waiting for the rate limiter");
    } finally {
      lock.unlock();
    }
  }

  public Duration minInterval() {
    return Duration.ofNanos(minIntervalNanos);
  }

  /** Pause strategy; replaced in tests. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(long nanos) throws InterruptedException;
  }
}
