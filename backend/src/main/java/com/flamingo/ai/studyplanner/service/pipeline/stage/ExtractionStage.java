package com.flamingo.ai.studyplanner.service.pipeline.stage;

import com.flamingo.ai.studyplanner.exception.PipelineCancelledException;
import com.flamingo.ai.studyplanner.exception.StageException;
import com.flamingo.ai.studyplanner.service.pipeline.ProgressListener;

/**
 * One extraction step of the per-course pipeline.
 *
 * @param <I> stage input
 * @param <O> the record the stage produces
 */
public interface ExtractionStage<I extends StageInput, O> {

  /** Name shown as the {@code agent} of this stage's progress events. */
  String agentName();

  /**
   * Runs the stage. Emits a loading event before any work and exactly one success or error event
   * when it ends.
   *
   * @throws StageException if the external call or its output is unusable
   * @throws PipelineCancelledException if the run is cancelled while waiting
   */
  O run(I input, ProgressListener progress);

  /** The record used when the stage is skipped or has failed. */
  O fallback(I input);
}
