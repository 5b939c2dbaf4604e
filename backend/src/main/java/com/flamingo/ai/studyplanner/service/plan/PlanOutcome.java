package com.flamingo.ai.studyplanner.service.plan;

import com.flamingo.ai.studyplanner.domain.enums.PipelineState;
import com.flamingo.ai.studyplanner.domain.model.StudyPlan;

/**
 * Where a run stands, as seen by the result endpoint.
 *
 * @param plan set when {@code state} is DONE
 * @param error set when {@code state} is FAILED
 */
public record PlanOutcome(PipelineState state, StudyPlan plan, String error) {

  public boolean isDone() {
    return state == PipelineState.DONE;
  }

  public boolean isFailed() {
    return state == PipelineState.FAILED;
  }
}
