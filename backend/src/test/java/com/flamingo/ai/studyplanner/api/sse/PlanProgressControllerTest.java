package com.flamingo.ai.studyplanner.api.sse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.enums.ProgressStatus;
import com.flamingo.ai.studyplanner.domain.model.ProgressEvent;
import com.flamingo.ai.studyplanner.service.plan.PlanService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PlanProgressController Tests")
class PlanProgressControllerTest {

  private static final String SESSION = "session-1";
  private static final Instant AT = Instant.parse("2026-10-19T09:30:00Z");

  @Mock private PlanService planService;

  private MeterRegistry meterRegistry;
  private PlannerConfig plannerConfig;
  private PlanProgressController controller;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    plannerConfig = new PlannerConfig();
    plannerConfig.setTimeZone("UTC");
    controller = new PlanProgressController(planService, plannerConfig, meterRegistry);
  }

  @Test
  void shouldStreamEventsAndComplete_whenTerminalEventArrives() {
    // Given
    when(planService.streamProgress(SESSION))
        .thenReturn(
            Flux.just(
                ProgressEvent.of("Syllabus Agent", "Reading", ProgressStatus.LOADING, AT),
                ProgressEvent.of("Syllabus Agent", "Found 4 modules", ProgressStatus.SUCCESS, AT),
                ProgressEvent.finished("Scheduler", "Plan ready", AT)));

    // When / Then
    StepVerifier.create(controller.streamProgress(SESSION))
        .assertNext(sse -> assertThat(sse.data().getStatus()).isEqualTo("loading"))
        .assertNext(sse -> assertThat(sse.data().getMessage()).isEqualTo("Found 4 modules"))
        .assertNext(
            sse -> {
              assertThat(sse.data().getDone()).isTrue();
              assertThat(sse.data().getTimestamp()).isEqualTo("09:30:00 AM");
            })
        .verifyComplete();
  }

  @Test
  void shouldCarryErrorOnFailedTerminalEvent() {
    // Given
    when(planService.streamProgress(SESSION))
        .thenReturn(Flux.just(ProgressEvent.failed("System", "No topics found", AT)));

    // When / Then
    StepVerifier.create(controller.streamProgress(SESSION))
        .assertNext(
            sse -> {
              assertThat(sse.data().getStatus()).isEqualTo("error");
              assertThat(sse.data().getError()).isEqualTo("No topics found");
              assertThat(sse.data().getMessage()).isEqualTo("Pipeline failed: No topics found");
            })
        .verifyComplete();
  }

  @Test
  @DisplayName("Quiet runs get keepalive comments until the terminal event")
  void shouldSendKeepalive_whenRunIsQuiet() {
    // Given
    plannerConfig.getPipeline().setKeepaliveInterval(Duration.ofSeconds(15));
    Sinks.Many<ProgressEvent> sink = Sinks.many().replay().all();
    when(planService.streamProgress(SESSION)).thenReturn(sink.asFlux());

    // When / Then
    StepVerifier.withVirtualTime(() -> controller.streamProgress(SESSION))
        .expectSubscription()
        .thenAwait(Duration.ofSeconds(15))
        .assertNext(
            sse -> {
              assertThat(sse.comment()).isEqualTo("keepalive");
              assertThat(sse.data()).isNull();
            })
        .then(() -> sink.tryEmitNext(ProgressEvent.finished("Scheduler", "Plan ready", AT)))
        .assertNext(sse -> assertThat(sse.data().getDone()).isTrue())
        .verifyComplete();
  }

  @Test
  void shouldTrackActiveConnections() {
    // Given
    Sinks.Many<ProgressEvent> sink = Sinks.many().replay().all();
    when(planService.streamProgress(SESSION)).thenReturn(sink.asFlux());

    // When / Then
    StepVerifier.create(controller.streamProgress(SESSION))
        .then(
            () ->
                assertThat(meterRegistry.get("sse.connections.active").gauge().value())
                    .isEqualTo(1.0))
        .then(() -> sink.tryEmitNext(ProgressEvent.finished("Scheduler", "Plan ready", AT)))
        .expectNextCount(1)
        .verifyComplete();

    assertThat(meterRegistry.get("sse.connections.active").gauge().value()).isZero();
  }
}
