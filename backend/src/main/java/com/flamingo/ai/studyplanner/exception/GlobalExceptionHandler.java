package com.flamingo.ai.studyplanner.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(RunNotFoundException.class)
  public ResponseEntity<ApiError> handleRunNotFound(
      RunNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("run_not_found");
    String errorId = generateErrorId();
    log.warn("Run not found [{}]: {}", errorId, ex.getSessionId());

    return build(
        HttpStatus.NOT_FOUND, errorId, ApiError.RUN_NOT_FOUND, "Plan run not found", request);
  }

  @ExceptionHandler(RunAlreadyActiveException.class)
  public ResponseEntity<ApiError> handleRunAlreadyActive(
      RunAlreadyActiveException ex, HttpServletRequest request) {

    incrementErrorCounter("run_already_active");
    String errorId = generateErrorId();
    log.warn("Rejected concurrent run [{}]: {}", errorId, ex.getSessionId());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.RUN_ALREADY_ACTIVE,
        "A plan is already being generated for this session",
        request);
  }

  @ExceptionHandler(TaskNotFoundException.class)
  public ResponseEntity<ApiError> handleTaskNotFound(
      TaskNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("task_not_found");
    String errorId = generateErrorId();
    log.warn("Task not found [{}]: {}", errorId, ex.getKey());

    return build(HttpStatus.NOT_FOUND, errorId, ApiError.TASK_NOT_FOUND, "Task not found", request);
  }

  @ExceptionHandler(PlanNotReadyException.class)
  public ResponseEntity<ApiError> handlePlanNotReady(
      PlanNotReadyException ex, HttpServletRequest request) {

    incrementErrorCounter("plan_not_ready");
    String errorId = generateErrorId();
    log.debug(
        "Plan not ready [{}] for session {}: {}", errorId, ex.getSessionId(), ex.getMessage());

    return build(HttpStatus.CONFLICT, errorId, ApiError.PLAN_NOT_READY, ex.getMessage(), request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("document_processing");
    String errorId = generateErrorId();
    log.error("Document processing error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_PROCESSING_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
  public ResponseEntity<ApiError> handleMalformedRequest(
      Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, "Malformed request", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
