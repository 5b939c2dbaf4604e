package com.flamingo.ai.studyplanner.service.pipeline.stage;

import com.flamingo.ai.studyplanner.agent.SyllabusStructureAgent;
import com.flamingo.ai.studyplanner.agent.dto.SyllabusAnalysis;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.ModuleRecord;
import com.flamingo.ai.studyplanner.domain.model.ModuleRecord.Assessment;
import com.flamingo.ai.studyplanner.domain.model.ModuleRecord.Module;
import com.flamingo.ai.studyplanner.service.pipeline.ExtractionSupport;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Extracts modules, topics and assessments from a syllabus. */
@Component
public class StructureStage extends AbstractExtractionStage<StructureInput, ModuleRecord> {

  public static final String AGENT_NAME = "StructureAnalyst";

  private final ExtractionSupport extractionSupport;
  private final PlannerConfig.Extraction settings;

  public StructureStage(
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
  public ModuleRecord fallback(StructureInput input) {
    return ModuleRecord.empty();
  }

  @Override
  protected String startMessage(StructureInput input) {
    return "Analyzing syllabus for " + input.course().code() + "...";
  }

  @Override
  protected Optional<String> skipReason(StructureInput input) {
    if (isBlank(input.syllabusText())) {
      return Optional.of("No syllabus uploaded for " + input.course().code() + ", skipping");
    }
    return Optional.empty();
  }

  @Override
  protected ModuleRecord extract(StructureInput input) {
    String content = clamp(input.syllabusText(), settings.getMaxInputChars());
    SyllabusAnalysis analysis =
        extractionSupport.call(
            AGENT_NAME,
            SyllabusStructureAgent.class,
            (agent, context) ->
                agent.analyze(
                    content, settings.getMaxModules(), settings.getMaxTopicsPerModule()));
    return analysis == null ? null : normalize(analysis);
  }

  @Override
  protected String successMessage(StructureInput input, ModuleRecord output) {
    return "Found "
        + output.modules().size()
        + " modules and "
        + output.topicCount()
        + " topics in "
        + input.course().code()
        + " syllabus";
  }

  private ModuleRecord normalize(SyllabusAnalysis analysis) {
    List<Module> modules =
        analysis.modules() == null
            ? List.of()
            : analysis.modules().stream()
                .filter(Objects::nonNull)
                .filter(m -> !isBlank(m.name()) || (m.topics() != null && !m.topics().isEmpty()))
                .limit(settings.getMaxModules())
                .map(m -> new Module(trim(m.name()), topics(m.topics()), m.week()))
                .toList();
    List<Assessment> assessments =
        analysis.assessments() == null
            ? List.of()
            : analysis.assessments().stream()
                .filter(Objects::nonNull)
                .map(a -> new Assessment(a.type(), a.weight(), a.date()))
                .toList();
    return new ModuleRecord(analysis.courseName(), analysis.courseCode(), modules, assessments);
  }

  private List<String> topics(List<String> raw) {
    if (raw == null) {
      return List.of();
    }
    return raw.stream()
        .filter(t -> !isBlank(t))
        .map(String::trim)
        .distinct()
        .limit(settings.getMaxTopicsPerModule())
        .toList();
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
