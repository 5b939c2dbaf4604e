package com.flamingo.ai.studyplanner.exception;

/**
 * Exception thrown when an extraction stage fails or returns unusable output. The orchestrator
 * recovers from it with an empty record.
 */
public class StageException extends RuntimeException {

  private final String stage;

  public StageException(String stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  public String getStage() {
    return stage;
  }
}
