package com.flamingo.ai.studyplanner.service.plan;

import com.flamingo.ai.studyplanner.api.dto.request.ConstraintsRequest;
import com.flamingo.ai.studyplanner.api.dto.request.CourseRequest;
import com.flamingo.ai.studyplanner.api.dto.request.PlanRequest;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.enums.ReviewCadence;
import com.flamingo.ai.studyplanner.domain.model.Constraints;
import com.flamingo.ai.studyplanner.domain.model.Course;
import com.flamingo.ai.studyplanner.domain.model.ProgressEvent;
import com.flamingo.ai.studyplanner.domain.model.StudyPlan;
import com.flamingo.ai.studyplanner.domain.model.StudyTask;
import com.flamingo.ai.studyplanner.exception.PlanNotReadyException;
import com.flamingo.ai.studyplanner.service.pipeline.ExamDates;
import com.flamingo.ai.studyplanner.service.pipeline.PipelineOrchestrator;
import com.flamingo.ai.studyplanner.service.run.PlanRun;
import com.flamingo.ai.studyplanner.service.run.RunRegistry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/** Implementation of the PlanService. */
@Service
@Slf4j
public class PlanServiceImpl implements PlanService {

  private final RunRegistry runRegistry;
  private final PipelineOrchestrator pipelineOrchestrator;
  private final PlannerConfig plannerConfig;
  private final AsyncTaskExecutor planExecutor;
  private final MeterRegistry meterRegistry;

  public PlanServiceImpl(
      RunRegistry runRegistry,
      PipelineOrchestrator pipelineOrchestrator,
      PlannerConfig plannerConfig,
      @Qualifier("planExecutor") AsyncTaskExecutor planExecutor,
      MeterRegistry meterRegistry) {
    this.runRegistry = runRegistry;
    this.pipelineOrchestrator = pipelineOrchestrator;
    this.plannerConfig = plannerConfig;
    this.planExecutor = planExecutor;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "plan.start", description = "Time to accept a plan request")
  public String startPlan(PlanRequest request) {
    List<Course> courses = toCourses(request.getCourses());
    Constraints constraints = toConstraints(request.getConstraints());

    PlanRun run = runRegistry.start(request.getSessionId(), courses, constraints);
    meterRegistry.counter("pipeline.runs.started").increment();
    try {
      planExecutor.execute(() -> pipelineOrchestrator.execute(run));
    } catch (TaskRejectedException e) {
      log.error("Plan executor rejected run {}: {}", run.getRunId(), e.getMessage());
      run.fail("Server is busy, please try again later");
      meterRegistry.counter("pipeline.runs.completed", "outcome", "rejected").increment();
    }
    log.info(
        "Accepted plan request for session {} ({} courses), run {}",
        request.getSessionId(),
        courses.size(),
        run.getRunId());
    return run.getRunId();
  }

  @Override
  public List<ProgressEvent> getLogs(String sessionId) {
    return runRegistry.find(sessionId).map(run -> run.events().snapshot()).orElse(List.of());
  }

  @Override
  public Flux<ProgressEvent> streamProgress(String sessionId) {
    return runRegistry.require(sessionId).events().subscribeWithHistory();
  }

  @Override
  @Timed(value = "plan.result", description = "Time to read a plan result")
  public PlanOutcome getOutcome(String sessionId) {
    PlanRun run = runRegistry.require(sessionId);
    return new PlanOutcome(run.getState(), run.plan().orElse(null), run.error().orElse(null));
  }

  @Override
  public StudyPlan getPlan(String sessionId) {
    PlanRun run = runRegistry.require(sessionId);
    return run.plan()
        .orElseThrow(
            () -> {
              String reason =
                  run.error()
                      .map(error -> "Plan generation failed: " + error)
                      .orElse("Plan generation is still in progress");
              return new PlanNotReadyException(sessionId, reason);
            });
  }

  @Override
  public void cancel(String sessionId) {
    PlanRun run = runRegistry.require(sessionId);
    if (!run.isFinished()) {
      log.info("Cancellation requested for run {} of session {}", run.getRunId(), sessionId);
      run.requestCancel("cancelled by user");
    }
  }

  @Override
  public StudyTask updateTask(
      String sessionId, StudyTask.Key key, boolean completed, boolean flagged) {
    PlanRun run = runRegistry.require(sessionId);
    if (run.plan().isEmpty()) {
      throw new PlanNotReadyException(sessionId, "Plan generation is still in progress");
    }
    StudyTask updated = run.updateTask(key, completed, flagged);
    log.debug("Updated task {} of session {}", key, sessionId);
    return updated;
  }

  private List<Course> toCourses(List<CourseRequest> requests) {
    List<Course> courses = new ArrayList<>();
    Set<String> ids = new HashSet<>();
    for (int i = 0; i < requests.size(); i++) {
      CourseRequest request = requests.get(i);
      if (!ids.add(request.getId())) {
        throw new IllegalArgumentException("Duplicate course id: " + request.getId());
      }
      String color =
          request.getColor() == null || request.getColor().isBlank()
              ? plannerConfig.colorFor(i)
              : request.getColor();
      courses.add(
          new Course(
              request.getId(),
              request.getCode(),
              request.getName(),
              ExamDates.parse(request.getExamDate()),
              color));
    }
    return courses;
  }

  private Constraints toConstraints(ConstraintsRequest request) {
    return new Constraints(
        request.getWeekdayHours(),
        request.getWeekendHours(),
        request.getNoStudyDates() == null
            ? Set.of()
            : request.getNoStudyDates().stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toSet()),
        ReviewCadence.fromLabel(request.getReviewFrequency()));
  }
}
