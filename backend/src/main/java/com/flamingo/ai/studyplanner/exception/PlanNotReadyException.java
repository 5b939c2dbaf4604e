package com.flamingo.ai.studyplanner.exception;

/** Exception thrown when a finished plan is needed but the run has not produced one. */
public class PlanNotReadyException extends RuntimeException {

  private final String sessionId;

  public PlanNotReadyException(String sessionId, String reason) {
    super(reason);
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
