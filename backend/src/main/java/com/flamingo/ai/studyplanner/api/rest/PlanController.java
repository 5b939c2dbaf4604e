package com.flamingo.ai.studyplanner.api.rest;

import com.flamingo.ai.studyplanner.api.dto.request.PlanRequest;
import com.flamingo.ai.studyplanner.api.dto.request.TaskUpdateRequest;
import com.flamingo.ai.studyplanner.api.dto.response.PlanAcceptedResponse;
import com.flamingo.ai.studyplanner.api.dto.response.PlanErrorResponse;
import com.flamingo.ai.studyplanner.api.dto.response.ProgressEventResponse;
import com.flamingo.ai.studyplanner.api.dto.response.StudyTaskResponse;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.enums.TaskKind;
import com.flamingo.ai.studyplanner.domain.model.StudyPlan;
import com.flamingo.ai.studyplanner.domain.model.StudyTask;
import com.flamingo.ai.studyplanner.service.plan.PlanExportService;
import com.flamingo.ai.studyplanner.service.plan.PlanOutcome;
import com.flamingo.ai.studyplanner.service.plan.PlanService;
import jakarta.validation.Valid;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for starting plan runs and reading their logs, results and exports. */
@RestController
@RequestMapping("/api/plan")
@RequiredArgsConstructor
@Slf4j
public class PlanController {

  private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);
  private static final MediaType TEXT_MARKDOWN =
      new MediaType("text", "markdown", StandardCharsets.UTF_8);

  private final PlanService planService;
  private final PlanExportService planExportService;
  private final PlannerConfig plannerConfig;

  /** Starts plan generation in the background. */
  @PostMapping
  public ResponseEntity<PlanAcceptedResponse> generatePlan(
      @Valid @RequestBody PlanRequest request) {
    planService.startPlan(request);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(
            PlanAcceptedResponse.builder()
                .message("Plan generation started")
                .sessionId(request.getSessionId())
                .build());
  }

  /** Returns the full progress log; empty for unknown sessions. */
  @GetMapping("/{sessionId}/logs")
  public ResponseEntity<List<ProgressEventResponse>> getLogs(@PathVariable String sessionId) {
    ZoneId zone = plannerConfig.zoneId();
    return ResponseEntity.ok(
        planService.getLogs(sessionId).stream()
            .map(event -> ProgressEventResponse.fromEvent(event, zone))
            .toList());
  }

  /**
   * Returns the plan when done. While the run is still going the body is an error object with
   * 202; a failed run answers 200 with its error.
   */
  @GetMapping("/{sessionId}/result")
  public ResponseEntity<?> getResult(@PathVariable String sessionId) {
    PlanOutcome outcome = planService.getOutcome(sessionId);
    if (outcome.isDone()) {
      return ResponseEntity.ok(toResponses(outcome.plan()));
    }
    if (outcome.isFailed()) {
      return ResponseEntity.ok(new PlanErrorResponse(outcome.error()));
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new PlanErrorResponse("Plan generation is still in progress"));
  }

  /** Requests cancellation of the session's run. */
  @DeleteMapping("/{sessionId}")
  public ResponseEntity<Void> cancel(@PathVariable String sessionId) {
    planService.cancel(sessionId);
    return ResponseEntity.accepted().build();
  }

  /** Marks a task completed or flagged for review. */
  @PatchMapping("/{sessionId}/tasks")
  public ResponseEntity<StudyTaskResponse> updateTask(
      @PathVariable String sessionId, @Valid @RequestBody TaskUpdateRequest request) {
    StudyTask.Key key =
        new StudyTask.Key(
            request.getCourseId(),
            request.getTopic(),
            TaskKind.fromLabel(request.getTaskType()),
            request.getDate());
    StudyTask updated =
        planService.updateTask(sessionId, key, request.isCompleted(), request.isFlagged());
    return ResponseEntity.ok(StudyTaskResponse.fromTask(updated));
  }

  /** Downloads the plan as CSV. */
  @GetMapping("/{sessionId}/export/csv")
  public ResponseEntity<String> exportCsv(@PathVariable String sessionId) {
    StudyPlan plan = planService.getPlan(sessionId);
    return ResponseEntity.ok()
        .contentType(TEXT_CSV)
        .header(HttpHeaders.CONTENT_DISPOSITION, attachment("study_plan.csv"))
        .body(planExportService.toCsv(plan.tasks()));
  }

  /** Downloads the plan as a Markdown table. */
  @GetMapping("/{sessionId}/export/markdown")
  public ResponseEntity<String> exportMarkdown(@PathVariable String sessionId) {
    StudyPlan plan = planService.getPlan(sessionId);
    return ResponseEntity.ok()
        .contentType(TEXT_MARKDOWN)
        .header(HttpHeaders.CONTENT_DISPOSITION, attachment("study_plan.md"))
        .body(planExportService.toMarkdown(plan.tasks()));
  }

  private static List<StudyTaskResponse> toResponses(StudyPlan plan) {
    return plan.tasks().stream().map(StudyTaskResponse::fromTask).toList();
  }

  private static String attachment(String fileName) {
    return ContentDisposition.attachment().filename(fileName).build().toString();
  }
}
