package com.flamingo.ai.studyplanner.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String RUN_NOT_FOUND = "RUN_001";
  public static final String RUN_ALREADY_ACTIVE = "RUN_002";
  public static final String TASK_NOT_FOUND = "PLAN_001";
  public static final String PLAN_NOT_READY = "PLAN_002";
  public static final String DOCUMENT_PROCESSING_ERROR = "DOCUMENT_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
