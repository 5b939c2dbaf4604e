package com.flamingo.ai.studyplanner.service.pipeline;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.enums.DocumentKind;
import com.flamingo.ai.studyplanner.domain.enums.PipelineState;
import com.flamingo.ai.studyplanner.domain.enums.ProgressStatus;
import com.flamingo.ai.studyplanner.domain.model.Course;
import com.flamingo.ai.studyplanner.domain.model.DocumentRef;
import com.flamingo.ai.studyplanner.domain.model.EffectiveTopicSet;
import com.flamingo.ai.studyplanner.domain.model.LocatorRecord;
import com.flamingo.ai.studyplanner.domain.model.LocatorRecord.Section;
import com.flamingo.ai.studyplanner.domain.model.MappingRecord;
import com.flamingo.ai.studyplanner.domain.model.MappingRecord.TopicMapping;
import com.flamingo.ai.studyplanner.domain.model.ModuleRecord;
import com.flamingo.ai.studyplanner.domain.model.ScopeRecord;
import com.flamingo.ai.studyplanner.domain.model.ScopeRecord.ScopedTopic;
import com.flamingo.ai.studyplanner.domain.model.StudyPlan;
import com.flamingo.ai.studyplanner.exception.DocumentProcessingException;
import com.flamingo.ai.studyplanner.exception.PipelineCancelledException;
import com.flamingo.ai.studyplanner.exception.SchedulingException;
import com.flamingo.ai.studyplanner.exception.StageException;
import com.flamingo.ai.studyplanner.service.document.DocumentService;
import com.flamingo.ai.studyplanner.service.document.DocumentTextSource;
import com.flamingo.ai.studyplanner.service.pipeline.stage.ExtractionStage;
import com.flamingo.ai.studyplanner.service.pipeline.stage.LocatorInput;
import com.flamingo.ai.studyplanner.service.pipeline.stage.LocatorStage;
import com.flamingo.ai.studyplanner.service.pipeline.stage.MapperInput;
import com.flamingo.ai.studyplanner.service.pipeline.stage.MapperStage;
import com.flamingo.ai.studyplanner.service.pipeline.stage.ScopeInput;
import com.flamingo.ai.studyplanner.service.pipeline.stage.ScopeStage;
import com.flamingo.ai.studyplanner.service.pipeline.stage.StageInput;
import com.flamingo.ai.studyplanner.service.pipeline.stage.StructureInput;
import com.flamingo.ai.studyplanner.service.pipeline.stage.StructureStage;
import com.flamingo.ai.studyplanner.service.run.PlanRun;
import com.flamingo.ai.studyplanner.service.schedule.CourseWorkload;
import com.flamingo.ai.studyplanner.service.schedule.SchedulingRequest;
import com.flamingo.ai.studyplanner.service.schedule.StudyScheduler;
import com.flamingo.ai.studyplanner.service.schedule.TopicWorkload;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives one plan run: the four extraction stages for every course in turn, then a single
 * scheduling pass across all courses.
 *
 * <p>Per-course problems never end a run. A failed stage or an unreadable document degrades to an
 * empty record and the pipeline moves on. Only scheduling failure, cancellation or an unexpected
 * error ends the run without a plan.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineOrchestrator {

  static final String SCHEDULER_AGENT = "Scheduler";

  private static final int STRUCTURE = 0;
  private static final int SCOPE = 1;
  private static final int LOCATOR = 2;
  private static final int MAPPER = 3;

  private final StructureStage structureStage;
  private final ScopeStage scopeStage;
  private final LocatorStage locatorStage;
  private final MapperStage mapperStage;
  private final FallbackResolver fallbackResolver;
  private final DocumentService documentService;
  private final DocumentTextSource documentTextSource;
  private final StudyScheduler studyScheduler;
  private final PlannerConfig plannerConfig;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  /** Runs the pipeline to completion. Never throws; the outcome is recorded on the run. */
  @Timed(value = "pipeline.run", description = "Time to run the whole planning pipeline")
  public void execute(PlanRun run) {
    log.info(
        "Starting run {} for session {} with {} courses",
        run.getRunId(),
        run.getSessionId(),
        run.getCourses().size());
    try {
      List<Course> courses = run.getCourses();
      run.transition(
          PipelineState.PER_COURSE_RUNNING, "Starting analysis of " + courses.size() + " courses");

      List<CourseAnalysis> analyses = new ArrayList<>();
      for (int i = 0; i < courses.size(); i++) {
        run.checkCancelled();
        analyses.add(analyzeCourse(run, i, courses.get(i)));
        run.publish(
            PlanRun.SYSTEM_AGENT,
            "Course " + (i + 1) + "/" + courses.size() + " analyzed: " + courses.get(i).code(),
            ProgressStatus.SUCCESS);
      }

      run.checkCancelled();
      SchedulingRequest request = aggregate(run, analyses);
      double totalHours =
          request.courses().stream()
              .flatMap(c -> c.topics().stream())
              .mapToDouble(TopicWorkload::hours)
              .sum();
      run.transition(
          PipelineState.AGGREGATING,
          String.format(
              Locale.ROOT,
              "Synthesizing schedule across %d courses (~%.1fh of content)",
              request.courses().size(),
              totalHours));

      run.checkCancelled();
      run.transition(PipelineState.SCHEDULING, "Building the study schedule");
      run.publish(SCHEDULER_AGENT, "Placing study sessions...", ProgressStatus.LOADING);
      StudyPlan plan = studyScheduler.schedule(request);
      meterRegistry.counter("pipeline.topics.dropped").increment(plan.droppedTopics().size());
      run.publish(
          SCHEDULER_AGENT,
          "Plan complete: "
              + plan.tasks().size()
              + " study sessions across "
              + plan.studyDayCount()
              + " days",
          ProgressStatus.SUCCESS);

      run.checkCancelled();
      if (run.complete(plan, "All agents finished.")) {
        meterRegistry.counter("pipeline.runs.completed", "outcome", "done").increment();
        log.info("Run {} finished with {} tasks", run.getRunId(), plan.tasks().size());
      }
    } catch (SchedulingException e) {
      log.warn("Run {} could not be scheduled: {}", run.getRunId(), e.getMessage());
      finishFailed(run, e.getMessage(), "unschedulable");
    } catch (PipelineCancelledException e) {
      log.info("Run {} cancelled: {}", run.getRunId(), e.getMessage());
      finishFailed(run, "Run cancelled: " + e.getMessage(), "cancelled");
    } catch (RuntimeException e) {
      log.error("Run {} failed unexpectedly: {}", run.getRunId(), e.getMessage(), e);
      finishFailed(run, e.getMessage() != null ? e.getMessage() : "Unexpected error", "error");
    }
  }

  private CourseAnalysis analyzeCourse(PlanRun run, int index, Course course) {
    String sessionId = run.getSessionId();

    run.enterStage(index, STRUCTURE);
    String syllabus = readText(run, course, DocumentKind.SYLLABUS);
    ModuleRecord modules = runStage(run, structureStage, new StructureInput(course, syllabus));

    run.enterStage(index, SCOPE);
    String overview = readText(run, course, DocumentKind.EXAM_OVERVIEW);
    ScopeRecord scope = runStage(run, scopeStage, new ScopeInput(course, overview));

    LocalDate examDate = resolveExamDate(run, course, scope);

    EffectiveTopicSet topics = fallbackResolver.resolve(scope, modules);
    if (topics.isEmpty()) {
      log.warn("No topics found for course {}", course.code());
      run.publish(
          PlanRun.SYSTEM_AGENT,
          "No topics found for " + course.code() + ", it will not be scheduled",
          ProgressStatus.ERROR);
      return new CourseAnalysis(
          course, examDate, modules, scope, topics, LocatorRecord.empty(), new MappingRecord(null));
    }
    if (topics.fromFallback()) {
      run.publish(
          PlanRun.SYSTEM_AGENT,
          "Using " + topics.topics().size() + " syllabus topics for " + course.code(),
          ProgressStatus.SUCCESS);
    }

    Optional<DocumentRef> textbook =
        documentService.find(sessionId, course.id(), DocumentKind.TEXTBOOK);

    run.enterStage(index, LOCATOR);
    LocatorRecord locator = locate(run, course, textbook.orElse(null), topics);

    run.enterStage(index, MAPPER);
    String sampled =
        textbook.isPresent() && !locator.sections().isEmpty()
            ? sampleSections(run, course, textbook.get(), locator)
            : null;
    MappingRecord mapping =
        runStage(run, mapperStage, new MapperInput(course, sampled, topics.names()));

    return new CourseAnalysis(course, examDate, modules, scope, topics, locator, mapping);
  }

  private LocatorRecord locate(
      PlanRun run, Course course, DocumentRef textbook, EffectiveTopicSet topics) {
    String toc = null;
    int totalPages = 0;
    if (textbook != null) {
      try {
        totalPages = documentTextSource.pageCount(textbook);
        toc =
            documentTextSource.extractPages(
                textbook, 1, plannerConfig.getExtraction().getTocPages());
      } catch (DocumentProcessingException e) {
        reportUnreadable(run, course, textbook, e);
      }
    }
    return runStage(run, locatorStage, new LocatorInput(course, toc, totalPages, topics.names()));
  }

  /** The leading pages of every located section, joined. */
  private String sampleSections(
      PlanRun run, Course course, DocumentRef textbook, LocatorRecord locator) {
    int pagesPerSection = plannerConfig.getExtraction().getSampledPagesPerSection();
    int maxChars = plannerConfig.getExtraction().getMaxMapperChars();
    StringBuilder sampled = new StringBuilder();
    try {
      for (Section section : locator.sections()) {
        int last = Math.min(section.endPage(), section.startPage() + pagesPerSection - 1);
        String text = documentTextSource.extractPages(textbook, section.startPage(), last);
        if (!text.isBlank()) {
          sampled.append("=== ").append(section.chapter()).append(" ===\n").append(text);
          sampled.append("\n\n");
        }
        if (sampled.length() > maxChars) {
          break;
        }
      }
    } catch (DocumentProcessingException e) {
      reportUnreadable(run, course, textbook, e);
      return null;
    }
    return sampled.toString().strip();
  }

  private LocalDate resolveExamDate(PlanRun run, Course course, ScopeRecord scope) {
    if (course.examDate() != null) {
      run.publish(
          PlanRun.SYSTEM_AGENT,
          "Exam date for " + course.code() + ": " + course.examDate() + " (entered)",
          ProgressStatus.SUCCESS);
      return course.examDate();
    }
    if (scope.examDate() != null) {
      run.publish(
          PlanRun.SYSTEM_AGENT,
          "Exam date for " + course.code() + ": " + scope.examDate() + " (from exam overview)",
          ProgressStatus.SUCCESS);
      return scope.examDate();
    }
    run.publish(
        PlanRun.SYSTEM_AGENT,
        "No exam date known for " + course.code() + ", using the latest exam date",
        ProgressStatus.SUCCESS);
    return null;
  }

  private <I extends StageInput, O> O runStage(
      PlanRun run, ExtractionStage<I, O> stage, I input) {
    run.checkCancelled();
    try {
      O output = stage.run(input, run.progressListener());
      // a call that completed after cancellation is discarded
      run.checkCancelled();
      return output;
    } catch (StageException e) {
      log.warn(
          "{} failed for {}, continuing with defaults: {}",
          stage.agentName(),
          input.course().code(),
          e.getMessage());
      return stage.fallback(input);
    }
  }

  private String readText(PlanRun run, Course course, DocumentKind kind) {
    Optional<DocumentRef> document = documentService.find(run.getSessionId(), course.id(), kind);
    if (document.isEmpty()) {
      return null;
    }
    try {
      return documentTextSource.extractText(document.get());
    } catch (DocumentProcessingException e) {
      reportUnreadable(run, course, document.get(), e);
      return null;
    }
  }

  private void reportUnreadable(
      PlanRun run, Course course, DocumentRef document, DocumentProcessingException e) {
    log.warn(
        "Could not read {} of {}: {}", document.kind().label(), course.code(), e.getMessage());
    run.publish(
        PlanRun.SYSTEM_AGENT,
        "Could not read "
            + document.kind().label()
            + " of "
            + course.code()
            + ": "
            + e.getMessage(),
        ProgressStatus.ERROR);
  }

  private SchedulingRequest aggregate(PlanRun run, List<CourseAnalysis> analyses) {
    PlannerConfig.Extraction settings = plannerConfig.getExtraction();
    List<CourseWorkload> workloads = new ArrayList<>();
    for (CourseAnalysis analysis : analyses) {
      List<TopicWorkload> topics = new ArrayList<>();
      for (ScopedTopic topic : analysis.topics().topics()) {
        TopicMapping mapping =
            analysis
                .mapping()
                .find(topic.name())
                .orElse(
                    new TopicMapping(
                        topic.name(), settings.getDefaultResource(), settings.getDefaultHours()));
        topics.add(
            new TopicWorkload(
                topic.name(), topic.importance(), mapping.estimatedHours(), mapping.resource()));
      }
      workloads.add(new CourseWorkload(analysis.course(), analysis.examDate(), topics));
    }
    return new SchedulingRequest(LocalDate.now(clock), workloads, run.getConstraints());
  }

  private void finishFailed(PlanRun run, String message, String outcome) {
    if (run.fail(message)) {
      meterRegistry.counter("pipeline.runs.completed", "outcome", outcome).increment();
    }
  }
}
