package com.flamingo.ai.studyplanner.service.pipeline.stage;

import com.flamingo.ai.studyplanner.agent.ExamScopeAgent;
import com.flamingo.ai.studyplanner.agent.dto.ExamScopeAnalysis;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.enums.Importance;
import com.flamingo.ai.studyplanner.domain.model.ScopeRecord;
import com.flamingo.ai.studyplanner.domain.model.ScopeRecord.ScopedTopic;
import com.flamingo.ai.studyplanner.service.pipeline.ExamDates;
import com.flamingo.ai.studyplanner.service.pipeline.ExtractionSupport;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Extracts the exam date and the testable topics from an exam overview. */
@Component
public class ScopeStage extends AbstractExtractionStage<ScopeInput, ScopeRecord> {

  public static final String AGENT_NAME = "ScopeAnalyst";

  private final ExtractionSupport extractionSupport;
  private final PlannerConfig.Extraction settings;

  public ScopeStage(
      ExtractionSupport extractionSupport,
      PlannerConfig plannerConfig,
      MeterRegistry meterRegistry) {
    super(meterRegistry);
    this.extractionSupport = extractionSupport;
    this.settings = plannerConfig.getExtraction();
  }

  @Override
  public String agentName() {
    return AGENT_NAME;
  }

  @Override
  public ScopeRecord fallback(ScopeInput input) {
    return ScopeRecord.empty();
  }

  @Override
  protected String startMessage(ScopeInput input) {
    return "Identifying exam topics for " + input.course().code() + "...";
  }

  @Override
  protected Optional<String> skipReason(ScopeInput input) {
    if (isBlank(input.overviewText())) {
      return Optional.of(
          "No exam overview uploaded for " + input.course().code() + ", using syllabus topics");
    }
    return Optional.empty();
  }

  @Override
  protected ScopeRecord extract(ScopeInput input) {
    String content = clamp(input.overviewText(), settings.getMaxInputChars());
    ExamScopeAnalysis analysis =
        extractionSupport.call(
            AGENT_NAME,
            ExamScopeAgent.class,
            (agent, context) -> agent.analyze(content, settings.getMaxScopeTopics()));
    return analysis == null ? null : normalize(analysis);
  }

  @Override
  protected String successMessage(ScopeInput input, ScopeRecord output) {
    List<String> names = output.topics().stream().map(ScopedTopic::name).toList();
    String message =
        "Exam scope for " + input.course().code() + ": " + names.size() + " topics";
    if (!names.isEmpty()) {
      message += " (" + preview(names, 4) + ")";
    }
    if (output.examDate() != null) {
      message += ", exam on " + output.examDate();
    }
    return message;
  }

  private ScopeRecord normalize(ExamScopeAnalysis analysis) {
    LocalDate examDate = ExamDates.parse(analysis.examDate());
    List<ScopedTopic> topics = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    if (analysis.topics() != null) {
      for (ExamScopeAnalysis.TopicItem item : analysis.topics()) {
        if (topics.size() >= settings.getMaxScopeTopics()) {
          break;
        }
        if (item == null || isBlank(item.name())) {
          continue;
        }
        String name = item.name().trim();
        if (seen.add(name.toLowerCase(Locale.ROOT))) {
          topics.add(new ScopedTopic(name, Importance.fromLabel(item.importance())));
        }
      }
    }
    return new ScopeRecord(examDate, topics);
  }
}
