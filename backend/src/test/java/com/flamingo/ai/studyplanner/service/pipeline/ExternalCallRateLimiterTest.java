package com.flamingo.ai.studyplanner.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.exception.PipelineCancelledException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ExternalCallRateLimiter Tests")
class ExternalCallRateLimiterTest {

  private static final Duration INTERVAL = Duration.ofSeconds(4);

  @Test
  @DisplayName("consecutive grants are at least the minimum interval apart")
  void shouldSpaceGrants_whenCalledRepeatedly() {
    // Given
    AtomicLong now = new AtomicLong(1_000L);
    ExternalCallRateLimiter limiter =
        new ExternalCallRateLimiter(INTERVAL, now::get, nanos -> now.addAndGet(nanos));

    // When
    List<Long> grants = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      grants.add(limiter.acquire());
      now.addAndGet(TimeUnit.MILLISECONDS.toNanos(500 * i));
    }

    // Then
    for (int i = 1; i < grants.size(); i++) {
      assertThat(grants.get(i) - grants.get(i - 1)).isGreaterThanOrEqualTo(INTERVAL.toNanos());
    }
  }

  @Test
  @DisplayName("first call is granted without waiting")
  void shouldGrantImmediately_whenFirstCall() {
    // Given
    AtomicLong now = new AtomicLong(42L);
    List<Long> sleeps = new ArrayList<>();
    ExternalCallRateLimiter limiter =
        new ExternalCallRateLimiter(
            INTERVAL,
            now::get,
            nanos -> {
              sleeps.add(nanos);
              now.addAndGet(nanos);
            });

    // When
    long grant = limiter.acquire();

    // Then
    assertThat(grant).isEqualTo(42L);
    assertThat(sleeps).isEmpty();
  }

  @Test
  @DisplayName("no wait when the interval already passed")
  void shouldNotSleep_whenIntervalAlreadyElapsed() {
    // Given
    AtomicLong now = new AtomicLong(0L);
    List<Long> sleeps = new ArrayList<>();
    ExternalCallRateLimiter limiter =
        new ExternalCallRateLimiter(INTERVAL, now::get, sleeps::add);
    limiter.acquire();
    now.addAndGet(INTERVAL.toNanos() + 1);

    // When
    limiter.acquire();

    // Then
    assertThat(sleeps).isEmpty();
  }

  @Test
  @DisplayName("concurrent callers are serialized with real time gaps")
  void shouldSerializeGrants_whenCalledConcurrently() throws Exception {
    // Given
    Duration interval = Duration.ofMillis(30);
    ExternalCallRateLimiter limiter =
        new ExternalCallRateLimiter(interval, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    ExecutorService pool = Executors.newFixedThreadPool(4);
    CountDownLatch start = new CountDownLatch(1);
    List<Long> grants = Collections.synchronizedList(new ArrayList<>());

    // When
    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      futures.add(
          pool.submit(
              () -> {
                start.await();
                grants.add(limiter.acquire());
                return null;
              }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(5, TimeUnit.SECONDS);
    }
    pool.shutdown();

    // Then
    List<Long> sorted = new ArrayList<>(grants);
    Collections.sort(sorted);
    assertThat(sorted).hasSize(6);
    for (int i = 1; i < sorted.size(); i++) {
      assertThat(sorted.get(i) - sorted.get(i - 1)).isGreaterThanOrEqualTo(interval.toNanos());
    }
  }

  @Test
  @DisplayName("interruption while waiting surfaces as cancellation")
  void shouldThrowCancellation_whenInterrupted() {
    // Given
    ExternalCallRateLimiter limiter =
        new ExternalCallRateLimiter(INTERVAL, System::nanoTime, TimeUnit.NANOSECONDS::sleep);

    // When
    Thread.currentThread().interrupt();

    // Then
    try {
      assertThatThrownBy(limiter::acquire).isInstanceOf(PipelineCancelledException.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  @DisplayName("interval comes from planner configuration")
  void shouldUseConfiguredInterval_whenBuiltFromConfig() {
    // Given
    PlannerConfig config = new PlannerConfig();
    config.getRateLimit().setMinInterval(Duration.ofMillis(250));

    // When
    ExternalCallRateLimiter limiter = new ExternalCallRateLimiter(config);

    // Then
    assertThat(limiter.minInterval()).isEqualTo(Duration.ofMillis(250));
  }
}
