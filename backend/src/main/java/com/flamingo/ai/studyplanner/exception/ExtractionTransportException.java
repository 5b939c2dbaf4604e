package com.flamingo.ai.studyplanner.exception;

/** Exception thrown when a call to the structured-extraction service itself fails. */
public class ExtractionTransportException extends RuntimeException {

  private final String agent;
  private final boolean rateLimited;

  public ExtractionTransportException(String agent, Throwable cause) {
    super(agent + " call failed: " + cause.getMessage(), cause);
    this.agent = agent;
    this.rateLimited = isRateLimit(cause);
  }

  public String getAgent() {
    return agent;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  private static boolean isRateLimit(Throwable cause) {
    String message = cause.getMessage();
    return message != null && (message.contains("429") || message.contains("rate limit"));
  }
}
