package com.flamingo.ai.studyplanner.domain.model;

import com.flamingo.ai.studyplanner.domain.enums.ProgressStatus;
import java.time.Instant;

/**
 * One entry of a run's progress log.
 *
 * @param done true only on the terminal event of a run
 * @param error overall failure message, set only on a failed terminal event
 */
public record ProgressEvent(
    String agent,
    String message,
    ProgressStatus status,
    Instant timestamp,
    boolean done,
    String error) {

  public static ProgressEvent of(
      String agent, String message, ProgressStatus status, Instant timestamp) {
    return new ProgressEvent(agent, message, status, timestamp, false, null);
  }

  public static ProgressEvent finished(String agent, String message, Instant timestamp) {
    return new ProgressEvent(agent, message, ProgressStatus.SUCCESS, timestamp, true, null);
  }

  public static ProgressEvent failed(String agent, String error, Instant timestamp) {
    return new ProgressEvent(
        agent, "Pipeline failed: " + error, ProgressStatus.ERROR, timestamp, true, error);
  }
}
