package com.flamingo.ai.studyplanner.exception;

/** Exception thrown when a session has no plan run. */
public class RunNotFoundException extends RuntimeException {

  private final String sessionId;

  public RunNotFoundException(String sessionId) {
    super("No plan run for session: " + sessionId);
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
