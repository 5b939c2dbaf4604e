package com.flamingo.ai.studyplanner.service.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.flamingo.ai.studyplanner.api.dto.request.ConstraintsRequest;
import com.flamingo.ai.studyplanner.api.dto.request.CourseRequest;
import com.flamingo.ai.studyplanner.api.dto.request.PlanRequest;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.enums.PipelineState;
import com.flamingo.ai.studyplanner.domain.enums.ProgressStatus;
import com.flamingo.ai.studyplanner.domain.enums.ReviewCadence;
import com.flamingo.ai.studyplanner.domain.enums.TaskKind;
import com.flamingo.ai.studyplanner.domain.model.Course;
import com.flamingo.ai.studyplanner.domain.model.ProgressEvent;
import com.flamingo.ai.studyplanner.domain.model.StudyPlan;
import com.flamingo.ai.studyplanner.domain.model.StudyTask;
import com.flamingo.ai.studyplanner.domain.model.TaskNotes;
import com.flamingo.ai.studyplanner.exception.PlanNotReadyException;
import com.flamingo.ai.studyplanner.exception.RunAlreadyActiveException;
import com.flamingo.ai.studyplanner.exception.RunNotFoundException;
import com.flamingo.ai.studyplanner.service.pipeline.PipelineOrchestrator;
import com.flamingo.ai.studyplanner.service.run.PlanRun;
import com.flamingo.ai.studyplanner.service.run.RunRegistry;
import com.flamingo.ai.studyplanner.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.core.task.support.TaskExecutorAdapter;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PlanServiceImpl Tests")
class PlanServiceImplTest {

  private static final LocalDate DAY = LocalDate.of(2026, 10, 20);

  @Mock private PipelineOrchestrator pipelineOrchestrator;

  private PlannerConfig plannerConfig;
  private MutableClock clock;
  private RunRegistry runRegistry;
  private SimpleMeterRegistry meterRegistry;
  private PlanServiceImpl planService;

  @BeforeEach
  void setUp() {
    plannerConfig = new PlannerConfig();
    meterRegistry = new SimpleMeterRegistry();
    clock = new MutableClock(Instant.parse("2026-10-19T09:00:00Z"));
    runRegistry = new RunRegistry(plannerConfig, clock, meterRegistry);
    planService = service(new TaskExecutorAdapter(Runnable::run));
  }

  @Test
  void shouldRegisterAndExecuteRun_whenRequestIsValid() {
    // Given
    PlanRequest request = request("s1", course("c1", "CS101", "2026-11-04", null));

    // When
    String runId = planService.startPlan(request);

    // Then
    ArgumentCaptor<PlanRun> run = ArgumentCaptor.forClass(PlanRun.class);
    verify(pipelineOrchestrator).execute(run.capture());
    assertThat(run.getValue().getRunId()).isEqualTo(runId);
    Course course = run.getValue().getCourses().get(0);
    assertThat(course.examDate()).isEqualTo(LocalDate.of(2026, 11, 4));
    assertThat(course.color()).isEqualTo("#4a5d45");
    assertThat(run.getValue().getConstraints().cadence()).isEqualTo(ReviewCadence.WEEKLY);
    assertThat(run.getValue().getConstraints().blockedDates()).containsExactly(DAY);
    assertThat(meterRegistry.counter("pipeline.runs.started").count()).isEqualTo(1.0);
  }

  @Test
  void shouldAssignPaletteColors_whenCoursesHaveNone() {
    // Given
    PlanRequest request =
        request(
            "s1",
            course("c1", "A", null, " "),
            course("c2", "B", "unknown", null),
            course("c3", "C", null, "#123456"));

    // When
    planService.startPlan(request);

    // Then
    List<Course> courses = runRegistry.require("s1").getCourses();
    assertThat(courses).extracting(Course::color).containsExactly("#4a5d45", "#8c7851", "#123456");
    assertThat(courses).extracting(Course::examDate).containsOnlyNulls();
  }

  @Test
  void shouldRejectRequest_whenCourseIdsRepeat() {
    PlanRequest request =
        request("s1", course("c1", "A", null, null), course("c1", "B", null, null));

    assertThatThrownBy(() -> planService.startPlan(request))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Duplicate course id");
    assertThat(runRegistry.find("s1")).isEmpty();
  }

  @Test
  void shouldRejectSecondStart_whenRunIsActive() {
    // Given
    planService.startPlan(request("s1", course("c1", "A", null, null)));

    // When / Then
    assertThatThrownBy(() -> planService.startPlan(request("s1", course("c1", "A", null, null))))
        .isInstanceOf(RunAlreadyActiveException.class);
  }

  @Test
  void shouldFailRun_whenExecutorIsFull() {
    // Given
    AsyncTaskExecutor executor = mock(AsyncTaskExecutor.class);
    doThrow(new TaskRejectedException("queue full")).when(executor).execute(any(Runnable.class));
    planService = service(executor);

    // When
    planService.startPlan(request("s1", course("c1", "A", null, null)));

    // Then
    PlanRun run = runRegistry.require("s1");
    assertThat(run.getState()).isEqualTo(PipelineState.FAILED);
    assertThat(run.error()).contains("Server is busy, please try again later");
    verify(pipelineOrchestrator, never()).execute(any());
  }

  @Test
  void shouldReturnEmptyLogs_whenSessionIsUnknown() {
    assertThat(planService.getLogs("nobody")).isEmpty();
  }

  @Test
  void shouldReturnPlan_whenFinishedOutcomeIsRead() {
    // Given
    doAnswer(
            invocation -> {
              PlanRun run = invocation.getArgument(0);
              run.complete(plan(), "All agents finished.");
              return null;
            })
        .when(pipelineOrchestrator)
        .execute(any());
    planService.startPlan(request("s1", course("c1", "A", null, null)));

    // When
    PlanOutcome outcome = planService.getOutcome("s1");

    // Then
    assertThat(outcome.isDone()).isTrue();
    assertThat(outcome.plan().tasks()).hasSize(1);
    assertThat(planService.getLogs("s1"))
        .extracting(ProgressEvent::message)
        .containsExactly("All agents finished.");
  }

  @Test
  void shouldReportRunning_whenRunIsStillGoing() {
    // Given
    planService.startPlan(request("s1", course("c1", "A", null, null)));

    // When
    PlanOutcome outcome = planService.getOutcome("s1");

    // Then
    assertThat(outcome.isDone()).isFalse();
    assertThat(outcome.isFailed()).isFalse();
    assertThatThrownBy(() -> planService.getPlan("s1"))
        .isInstanceOf(PlanNotReadyException.class)
        .hasMessage("Plan generation is still in progress");
  }

  @Test
  void shouldExplainFailure_whenPlanOfFailedRunIsRequested() {
    // Given
    doAnswer(
            invocation -> {
              PlanRun run = invocation.getArgument(0);
              run.fail("No topics were found for any course");
              return null;
            })
        .when(pipelineOrchestrator)
        .execute(any());
    planService.startPlan(request("s1", course("c1", "A", null, null)));

    // When / Then
    assertThatThrownBy(() -> planService.getPlan("s1"))
        .isInstanceOf(PlanNotReadyException.class)
        .hasMessage("Plan generation failed: No topics were found for any course");
    assertThat(planService.getOutcome("s1").error())
        .isEqualTo("No topics were found for any course");
  }

  @Test
  void shouldRequestCancel_whenRunIsActive() {
    // Given
    planService.startPlan(request("s1", course("c1", "A", null, null)));

    // When
    planService.cancel("s1");

    // Then
    assertThat(runRegistry.require("s1").isCancelRequested()).isTrue();
  }

  @Test
  void shouldThrowNotFound_whenCancellingUnknownSession() {
    assertThatThrownBy(() -> planService.cancel("nobody")).isInstanceOf(RunNotFoundException.class);
  }

  @Test
  void shouldUpdateTask_whenPlanIsReady() {
    // Given
    doAnswer(
            invocation -> {
              PlanRun run = invocation.getArgument(0);
              run.complete(plan(), "All agents finished.");
              return null;
            })
        .when(pipelineOrchestrator)
        .execute(any());
    planService.startPlan(request("s1", course("c1", "A", null, null)));

    // When
    StudyTask updated =
        planService.updateTask(
            "s1", new StudyTask.Key("c1", "Graphs", TaskKind.LEARN, DAY), true, false);

    // Then
    assertThat(updated.completed()).isTrue();
    assertThat(planService.getPlan("s1").tasks().get(0).completed()).isTrue();
  }

  @Test
  @DisplayName("a plan stays available for export and edits after its result was read")
  void shouldKeepPlan_whenResultWasReadAndSweepRuns() {
    // Given
    doAnswer(
            invocation -> {
              PlanRun run = invocation.getArgument(0);
              run.complete(plan(), "All agents finished.");
              return null;
            })
        .when(pipelineOrchestrator)
        .execute(any());
    planService.startPlan(request("s1", course("c1", "A", null, null)));
    planService.getOutcome("s1");

    // When
    clock.advance(plannerConfig.getPipeline().getResultTtl().minusMinutes(1));
    runRegistry.sweep();
    StudyPlan exported = planService.getPlan("s1");
    clock.advance(plannerConfig.getPipeline().getResultTtl().minusMinutes(1));
    runRegistry.sweep();
    StudyTask updated =
        planService.updateTask(
            "s1", new StudyTask.Key("c1", "Graphs", TaskKind.LEARN, DAY), false, true);
    clock.advance(plannerConfig.getPipeline().getResultTtl().plusMinutes(1));
    runRegistry.sweep();

    // Then
    assertThat(exported.tasks()).hasSize(1);
    assertThat(updated.flagged()).isTrue();
    assertThatThrownBy(() -> planService.getPlan("s1")).isInstanceOf(RunNotFoundException.class);
  }

  @Test
  void shouldRejectTaskUpdate_whenPlanIsNotReady() {
    // Given
    planService.startPlan(request("s1", course("c1", "A", null, null)));

    // When / Then
    assertThatThrownBy(
            () ->
                planService.updateTask(
                    "s1", new StudyTask.Key("c1", "Graphs", TaskKind.LEARN, DAY), true, false))
        .isInstanceOf(PlanNotReadyException.class);
  }

  @Test
  void shouldStreamHistory_whenSubscribingAfterFinish() {
    // Given
    doAnswer(
            invocation -> {
              PlanRun run = invocation.getArgument(0);
              run.publish("StructureAnalyst", "Analyzing", ProgressStatus.LOADING);
              run.complete(plan(), "All agents finished.");
              return null;
            })
        .when(pipelineOrchestrator)
        .execute(any());
    planService.startPlan(request("s1", course("c1", "A", null, null)));

    // When / Then
    StepVerifier.create(planService.streamProgress("s1").map(ProgressEvent::message))
        .expectNext("Analyzing", "All agents finished.")
        .verifyComplete();
  }

  private PlanServiceImpl service(AsyncTaskExecutor executor) {
    return new PlanServiceImpl(
        runRegistry, pipelineOrchestrator, plannerConfig, executor, meterRegistry);
  }

  private static PlanRequest request(String sessionId, CourseRequest... courses) {
    return PlanRequest.builder()
        .sessionId(sessionId)
        .courses(Arrays.asList(courses))
        .constraints(
            ConstraintsRequest.builder()
                .weekdayHours(2)
                .weekendHours(4)
                .noStudyDates(Arrays.asList(DAY, null))
                .reviewFrequency("weekly")
                .build())
        .build();
  }

  private static CourseRequest course(String id, String code, String examDate, String color) {
    return CourseRequest.builder()
        .id(id)
        .code(code)
        .name(code + " course")
        .examDate(examDate)
        .color(color)
        .build();
  }

  private static StudyPlan plan() {
    return new StudyPlan(
        List.of(
            new StudyTask(
                DAY,
                "c1",
                "A",
                "#4a5d45",
                "Graphs",
                TaskKind.LEARN,
                1.0,
                "Textbook",
                new TaskNotes("f", "p", "m", "s"),
                false,
                false)),
        List.of(),
        List.of());
  }
}
