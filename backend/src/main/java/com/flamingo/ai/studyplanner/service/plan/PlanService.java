package com.flamingo.ai.studyplanner.service.plan;

import com.flamingo.ai.studyplanner.api.dto.request.PlanRequest;
import com.flamingo.ai.studyplanner.domain.model.ProgressEvent;
import com.flamingo.ai.studyplanner.domain.model.StudyPlan;
import com.flamingo.ai.studyplanner.domain.model.StudyTask;
import java.util.List;
import reactor.core.publisher.Flux;

/** Service for starting plan runs and reading their progress and results. */
public interface PlanService {

  /**
   * Registers a run for the session and starts it in the background.
   *
   * @return the run id
   * @throws com.flamingo.ai.studyplanner.exception.RunAlreadyActiveException if the session
   *     already has an active run
   */
  String startPlan(PlanRequest request);

  /** Full progress log of the session's run; empty when the session has none. */
  List<ProgressEvent> getLogs(String sessionId);

  /**
   * Past and future progress events of the session's run; completes after the terminal event.
   *
   * @throws com.flamingo.ai.studyplanner.exception.RunNotFoundException if the session has no run
   */
  Flux<ProgressEvent> streamProgress(String sessionId);

  /**
   * Current outcome of the session's run. Reading it extends the retention of a finished run.
   *
   * @throws com.flamingo.ai.studyplanner.exception.RunNotFoundException if the session has no run
   */
  PlanOutcome getOutcome(String sessionId);

  /**
   * The finished plan of the session.
   *
   * @throws com.flamingo.ai.studyplanner.exception.PlanNotReadyException if the run has not
   *     produced a plan
   */
  StudyPlan getPlan(String sessionId);

  /** Asks the session's run to stop at its next stage boundary. */
  void cancel(String sessionId);

  /** Sets the completion and review flags of one task of the finished plan. */
  StudyTask updateTask(String sessionId, StudyTask.Key key, boolean completed, boolean flagged);
}
