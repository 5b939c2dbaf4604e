package com.flamingo.ai.studyplanner.exception;

/** Exception thrown when a session already has a plan run in progress. */
public class RunAlreadyActiveException extends RuntimeException {

  private final String sessionId;

  public RunAlreadyActiveException(String sessionId) {
    super("A plan is already being generated for session: " + sessionId);
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
