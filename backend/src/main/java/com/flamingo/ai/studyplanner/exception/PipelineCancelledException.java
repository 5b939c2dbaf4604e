package com.flamingo.ai.studyplanner.exception;

/** Exception thrown at a stage boundary once a run has been asked to stop. */
public class PipelineCancelledException extends RuntimeException {

  public PipelineCancelledException(String reason) {
    super(reason);
  }
}
