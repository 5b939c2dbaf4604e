package com.flamingo.ai.studyplanner.service.run;

import com.flamingo.ai.studyplanner.domain.enums.PipelineState;
import com.flamingo.ai.studyplanner.domain.enums.ProgressStatus;
import com.flamingo.ai.studyplanner.domain.model.Constraints;
import com.flamingo.ai.studyplanner.domain.model.Course;
import com.flamingo.ai.studyplanner.domain.model.ProgressEvent;
import com.flamingo.ai.studyplanner.domain.model.StudyPlan;
import com.flamingo.ai.studyplanner.domain.model.StudyTask;
import com.flamingo.ai.studyplanner.exception.PipelineCancelledException;
import com.flamingo.ai.studyplanner.exception.TaskNotFoundException;
import com.flamingo.ai.studyplanner.service.pipeline.ProgressListener;
import com.flamingo.ai.studyplanner.service.progress.ProgressBroadcaster;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * One execution of the pipeline for a session. Holds its state, its progress log and, once it
 * has finished, either the plan or the failure message.
 *
 * <p>A run finishes exactly once: whichever of {@link #complete} and {@link #fail} comes first
 * wins, and only that call publishes the terminal event.
 */
@Slf4j
public class PlanRun {

  public static final String SYSTEM_AGENT = "System";

  @Getter private final String sessionId;
  @Getter private final String runId = UUID.randomUUID().toString();
  @Getter private final List<Course> courses;
  @Getter private final Constraints constraints;
  @Getter private final Instant startedAt;
  private final ProgressBroadcaster broadcaster;
  private final Clock clock;

  @Getter private volatile PipelineState state = PipelineState.IDLE;
  @Getter private volatile int courseIndex = -1;
  @Getter private volatile int stageIndex = -1;
  private volatile String cancelReason;
  private volatile StudyPlan plan;
  private volatile String error;
  @Getter private volatile Instant finishedAt;
  private volatile Instant lastAccessedAt;

  public PlanRun(String sessionId, List<Course> courses, Constraints constraints, Clock clock) {
    this.sessionId = sessionId;
    this.courses = List.copyOf(courses);
    this.constraints = constraints;
    this.clock = clock;
    this.startedAt = clock.instant();
    this.broadcaster = new ProgressBroadcaster(runId);
  }

  public ProgressBroadcaster events() {
    return broadcaster;
  }

  public void publish(String agent, String message, ProgressStatus status) {
    broadcaster.publish(ProgressEvent.of(agent, message, status, clock.instant()));
  }

  public ProgressListener progressListener() {
    return this::publish;
  }

  /** Moves to a non-terminal state and reports it. */
  public synchronized void transition(PipelineState next, String message) {
    if (state.isTerminal()) {
      throw new PipelineCancelledException("Run already " + state.name().toLowerCase(Locale.ROOT));
    }
    log.debug("Run {} {} -> {}", runId, state, next);
    state = next;
    publish(SYSTEM_AGENT, message, ProgressStatus.LOADING);
  }

  /** Records the course and stage the pipeline is entering. */
  public void enterStage(int course, int stage) {
    this.courseIndex = course;
    this.stageIndex = stage;
  }

  /** Asks the pipeline to stop at its next stage boundary. */
  public void requestCancel(String reason) {
    if (cancelReason == null) {
      cancelReason = reason;
    }
  }

  public boolean isCancelRequested() {
    return cancelReason != null;
  }

  /**
   * @throws PipelineCancelledException if cancellation was requested
   */
  public void checkCancelled() {
    String reason = cancelReason;
    if (reason != null) {
      throw new PipelineCancelledException(reason);
    }
  }

  /** @return false when the run had already finished and nothing changed */
  public synchronized boolean complete(StudyPlan result, String message) {
    if (state.isTerminal()) {
      return false;
    }
    plan = result;
    state = PipelineState.DONE;
    finishedAt = clock.instant();
    broadcaster.publish(ProgressEvent.finished(SYSTEM_AGENT, message, finishedAt));
    return true;
  }

  /** @return false when the run had already finished and nothing changed */
  public synchronized boolean fail(String message) {
    if (state.isTerminal()) {
      return false;
    }
    error = message;
    state = PipelineState.FAILED;
    finishedAt = clock.instant();
    broadcaster.publish(ProgressEvent.failed(SYSTEM_AGENT, message, finishedAt));
    return true;
  }

  public boolean isFinished() {
    return state.isTerminal();
  }

  public Optional<StudyPlan> plan() {
    return Optional.ofNullable(plan);
  }

  public Optional<String> error() {
    return Optional.ofNullable(error);
  }

  /** Time of the latest progress, used to detect stalled runs. */
  public Instant lastActivity() {
    Instant last = broadcaster.lastEventAt();
    return last != null ? last : startedAt;
  }

  /** Records that a client read or changed this run. */
  public void touch() {
    lastAccessedAt = clock.instant();
  }

  /**
   * Start of the retention window of a finished run: its finish time, or the latest client
   * access after it.
   */
  public Instant retainedSince() {
    Instant accessed = lastAccessedAt;
    Instant finished = finishedAt;
    if (finished == null || (accessed != null && accessed.isAfter(finished))) {
      return accessed;
    }
    return finished;
  }

  /**
   * Sets the completion and flag status of one task of the finished plan.
   *
   * @throws TaskNotFoundException if the plan has no such task
   */
  public synchronized StudyTask updateTask(StudyTask.Key key, boolean completed, boolean flagged) {
    StudyPlan current = plan;
    if (current == null) {
      throw new TaskNotFoundException(key);
    }
    List<StudyTask> tasks = new ArrayList<>(current.tasks());
    for (int i = 0; i < tasks.size(); i++) {
      if (tasks.get(i).key().equals(key)) {
        StudyTask updated = tasks.get(i).withStatus(completed, flagged);
        tasks.set(i, updated);
        plan = new StudyPlan(tasks, current.restDays(), current.droppedTopics());
        return updated;
      }
    }
    throw new TaskNotFoundException(key);
  }
}
