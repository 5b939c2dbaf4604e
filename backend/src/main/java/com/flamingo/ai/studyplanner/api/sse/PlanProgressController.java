package com.flamingo.ai.studyplanner.api.sse;

import com.flamingo.ai.studyplanner.api.dto.response.ProgressEventResponse;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.service.plan.PlanService;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller streaming plan progress with Server-Sent Events. */
@RestController
@RequestMapping("/api/plan/{sessionId}")
@Slf4j
public class PlanProgressController {

  private final PlanService planService;
  private final PlannerConfig plannerConfig;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  public PlanProgressController(
      PlanService planService, PlannerConfig plannerConfig, MeterRegistry meterRegistry) {
    this.planService = planService;
    this.plannerConfig = plannerConfig;
    this.meterRegistry = meterRegistry;
    meterRegistry.gauge("sse.connections.active", activeConnections);
  }

  /**
   * Streams every progress event of the session's run, starting with those already published.
   * Sends a keepalive comment while the run is quiet and completes after the terminal event.
   *
   * @param sessionId the session ID
   * @return a Flux of SSE events
   */
  @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ServerSentEvent<ProgressEventResponse>> streamProgress(
      @PathVariable String sessionId) {

    log.info("Opening progress stream for session {}", sessionId);
    ZoneId zone = plannerConfig.zoneId();

    Flux<ServerSentEvent<ProgressEventResponse>> events =
        planService
            .streamProgress(sessionId)
            .map(
                event ->
                    ServerSentEvent.builder(ProgressEventResponse.fromEvent(event, zone)).build());

    Flux<ServerSentEvent<ProgressEventResponse>> keepalive =
        Flux.interval(plannerConfig.getPipeline().getKeepaliveInterval())
            .map(
                tick ->
                    ServerSentEvent.<ProgressEventResponse>builder().comment("keepalive").build());

    return Flux.merge(events, keepalive)
        .takeUntil(sse -> sse.data() != null && Boolean.TRUE.equals(sse.data().getDone()))
        .doOnSubscribe(subscription -> activeConnections.incrementAndGet())
        .doOnError(
            e -> {
              log.error("Progress stream error for session {}: {}", sessionId, e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doFinally(
            signal -> {
              activeConnections.decrementAndGet();
              log.debug("Progress stream for session {} ended: {}", sessionId, signal);
            });
  }
}
