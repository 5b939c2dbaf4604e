package com.flamingo.ai.studyplanner.domain.enums;

/** Lifecycle of one plan run. */
public enum PipelineState {
  IDLE,

  /** Extraction stages are running for one course at a time. */
  PER_COURSE_RUNNING,

  /** All courses are analyzed; building the scheduling request. */
  AGGREGATING,

  SCHEDULING,

  /** A plan was produced. */
  DONE,

  /** The run ended without a plan. */
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
