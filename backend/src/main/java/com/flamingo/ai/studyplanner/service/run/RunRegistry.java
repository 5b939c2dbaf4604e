package com.flamingo.ai.studyplanner.service.run;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.Constraints;
import com.flamingo.ai.studyplanner.domain.model.Course;
import com.flamingo.ai.studyplanner.exception.RunAlreadyActiveException;
import com.flamingo.ai.studyplanner.exception.RunNotFoundException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-memory registry of plan runs keyed by session id. At most one active run per session.
 *
 * <p>A periodic sweep aborts runs that stopped making progress and evicts finished runs once
 * their retention elapsed. Retention counts from the finish or from the latest client access,
 * whichever is later, so a plan that is still being read, exported or edited stays available.
 */
@Component
@Slf4j
public class RunRegistry {

  private final Map<String, PlanRun> runs = new ConcurrentHashMap<>();
  private final PlannerConfig.Pipeline settings;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public RunRegistry(PlannerConfig plannerConfig, Clock clock, MeterRegistry meterRegistry) {
    this.settings = plannerConfig.getPipeline();
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    Gauge.builder("pipeline.runs.active", this, RunRegistry::activeRunCount)
        .description("Plan runs currently executing")
        .register(meterRegistry);
  }

  /**
   * Registers a new run, replacing a finished one for the same session.
   *
   * @throws RunAlreadyActiveException if the session has a run that has not finished
   */
  public PlanRun start(String sessionId, List<Course> courses, Constraints constraints) {
    PlanRun run =
        runs.compute(
            sessionId,
            (id, existing) -> {
              if (existing != null && !existing.isFinished()) {
                throw new RunAlreadyActiveException(id);
              }
              return new PlanRun(id, courses, constraints, clock);
            });
    log.info("Registered run {} for session {}", run.getRunId(), sessionId);
    return run;
  }

  public Optional<PlanRun> find(String sessionId) {
    return Optional.ofNullable(runs.get(sessionId));
  }

  /**
   * Looks up the run of a client request and refreshes its retention.
   *
   * @throws RunNotFoundException if the session has no run
   */
  public PlanRun require(String sessionId) {
    PlanRun run = find(sessionId).orElseThrow(() -> new RunNotFoundException(sessionId));
    run.touch();
    return run;
  }

  public long activeRunCount() {
    return runs.values().stream().filter(run -> !run.isFinished()).count();
  }

  @Scheduled(fixedDelayString = "${planner.pipeline.sweep-interval-ms:30000}")
  public void sweep() {
    Instant now = clock.instant();
    Duration stallTimeout = settings.getStallTimeout();
    Duration resultTtl = settings.getResultTtl();

    runs.forEach(
        (sessionId, run) -> {
          if (!run.isFinished()) {
            if (run.lastActivity().plus(stallTimeout).isBefore(now)) {
              log.warn(
                  "Run {} for session {} made no progress for {}, aborting",
                  run.getRunId(),
                  sessionId,
                  stallTimeout);
              run.requestCancel("stalled");
              String reason =
                  "Run stalled: no progress for " + stallTimeout.toMinutes() + " minutes";
              if (run.fail(reason)) {
                meterRegistry.counter("pipeline.runs.completed", "outcome", "stalled").increment();
              }
            }
            return;
          }
          if (run.retainedSince().plus(resultTtl).isBefore(now)) {
            if (runs.remove(sessionId, run)) {
              log.debug("Evicted run {} for session {}", run.getRunId(), sessionId);
            }
          }
        });
  }
}
