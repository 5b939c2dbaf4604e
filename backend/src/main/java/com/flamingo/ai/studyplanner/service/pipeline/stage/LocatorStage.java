package com.flamingo.ai.studyplanner.service.pipeline.stage;

import com.flamingo.ai.studyplanner.agent.TocLocatorAgent;
import com.flamingo.ai.studyplanner.agent.dto.TocLocation;
import com.flamingo.ai.studyplanner.agent.dto.TocLocation.SectionItem;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.LocatorRecord;
import com.flamingo.ai.studyplanner.domain.model.LocatorRecord.Section;
import com.flamingo.ai.studyplanner.service.pipeline.ExtractionSupport;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Finds the textbook sections covering the effective topics from the table of contents. */
@Component
@Slf4j
public class LocatorStage extends AbstractExtractionStage<LocatorInput, LocatorRecord> {

  public static final String AGENT_NAME = "TocLocator";

  private final ExtractionSupport extractionSupport;
  private final TopicListFormatter topicListFormatter;
  private final PlannerConfig.Extraction settings;

  public LocatorStage(
      ExtractionSupport extractionSupport,
      TopicListFormatter topicListFormatter,
      PlannerConfig plannerConfig,
      MeterRegistry meterRegistry) {
    super(meterRegistry);
    this.extractionSupport = extractionSupport;
    this.topicListFormatter = topicListFormatter;
    this.settings = plannerConfig.getExtraction();
  }

  @Override
  public String agentName() {
    return AGENT_NAME;
  }

  @Override
  public LocatorRecord fallback(LocatorInput input) {
    return LocatorRecord.empty();
  }

  @Override
  protected String startMessage(LocatorInput input) {
    return "Scanning textbook table of contents for " + input.course().code() + "...";
  }

  @Override
  protected Optional<String> skipReason(LocatorInput input) {
    if (isBlank(input.tocText())) {
      return Optional.of("No textbook uploaded for " + input.course().code() + ", skipping");
    }
    if (input.topics().isEmpty()) {
      return Optional.of("No topics to locate for " + input.course().code() + ", skipping");
    }
    return Optional.empty();
  }

  @Override
  protected LocatorRecord extract(LocatorInput input) {
    String toc = clamp(input.tocText(), settings.getMaxInputChars());
    String topics = topicListFormatter.toJson(input.topics());
    TocLocation location =
        extractionSupport.call(
            AGENT_NAME,
            TocLocatorAgent.class,
            (agent, context) -> agent.locate(input.totalPages(), topics, toc));
    return location == null ? null : normalize(location, input.totalPages());
  }

  @Override
  protected String successMessage(LocatorInput input, LocatorRecord output) {
    return "Located "
        + output.sections().size()
        + " relevant sections in "
        + input.course().code()
        + " textbook";
  }

  /** Repairs page ranges so that 1 <= start <= end, within the book when its size is known. */
  private LocatorRecord normalize(TocLocation location, int totalPages) {
    List<Section> sections = new ArrayList<>();
    if (location.relevantSections() == null) {
      return new LocatorRecord(sections);
    }
    for (SectionItem item : location.relevantSections()) {
      if (item == null) {
        continue;
      }
      int start = item.startPage() == null ? 1 : Math.max(1, item.startPage());
      int end = item.endPage() == null ? start : Math.max(start, item.endPage());
      if (totalPages > 0) {
        if (start > totalPages) {
          log.debug("Dropping section '{}' starting past page {}", item.chapter(), totalPages);
          continue;
        }
        end = Math.min(end, totalPages);
      }
      List<String> covered =
          item.coversTopics() == null
              ? List.of()
              : item.coversTopics().stream().filter(Objects::nonNull).map(String::trim).toList();
      String chapter = isBlank(item.chapter()) ? "pp. " + start + "-" + end : item.chapter().trim();
      sections.add(new Section(chapter, start, end, covered));
    }
    return new LocatorRecord(sections);
  }
}
