package com.flamingo.ai.studyplanner.service.pipeline.stage;

import com.flamingo.ai.studyplanner.agent.ResourceMapperAgent;
import com.flamingo.ai.studyplanner.agent.dto.ResourceMapping;
import com.flamingo.ai.studyplanner.agent.dto.ResourceMapping.MappingItem;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.MappingRecord;
import com.flamingo.ai.studyplanner.domain.model.MappingRecord.TopicMapping;
import com.flamingo.ai.studyplanner.service.pipeline.ExtractionSupport;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Maps every effective topic to a study resource and an hour estimate. The result always holds
 * exactly one entry per requested topic, in request order; gaps are filled with the defaults.
 */
@Component
public class MapperStage extends AbstractExtractionStage<MapperInput, MappingRecord> {

  public static final String AGENT_NAME = "ResourceMapper";

  private final ExtractionSupport extractionSupport;
  private final TopicListFormatter topicListFormatter;
  private final PlannerConfig.Extraction settings;

  public MapperStage(
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

  /** Default resource and hours for every topic. */
  @Override
  public MappingRecord fallback(MapperInput input) {
    return new MappingRecord(input.topics().stream().map(this::defaultMapping).toList());
  }

  @Override
  protected String startMessage(MapperInput input) {
    return "Mapping study resources for " + input.course().code() + "...";
  }

  @Override
  protected Optional<String> skipReason(MapperInput input) {
    if (input.topics().isEmpty()) {
      return Optional.of("No topics to map for " + input.course().code() + ", skipping");
    }
    if (isBlank(input.sampledText())) {
      return Optional.of(
          "No textbook excerpts for "
              + input.course().code()
              + ", using default estimates of "
              + settings.getDefaultHours()
              + "h per topic");
    }
    return Optional.empty();
  }

  @Override
  protected MappingRecord extract(MapperInput input) {
    String text = clamp(input.sampledText(), settings.getMaxMapperChars());
    String topics = topicListFormatter.toJson(input.topics());
    ResourceMapping mapping =
        extractionSupport.call(
            AGENT_NAME, ResourceMapperAgent.class, (agent, context) -> agent.map(topics, text));
    return mapping == null ? null : normalize(mapping, input.topics());
  }

  @Override
  protected String successMessage(MapperInput input, MappingRecord output) {
    return String.format(
        Locale.ROOT,
        "Mapped %d topics for %s (~%.1fh of study)",
        output.mappings().size(),
        input.course().code(),
        output.totalHours());
  }

  private MappingRecord normalize(ResourceMapping mapping, List<String> topics) {
    Map<String, MappingItem> byTopic = new HashMap<>();
    if (mapping.mappings() != null) {
      for (MappingItem item : mapping.mappings()) {
        if (item != null && !isBlank(item.topic())) {
          byTopic.putIfAbsent(key(item.topic()), item);
        }
      }
    }
    return new MappingRecord(
        topics.stream()
            .map(
                topic -> {
                  MappingItem item = byTopic.get(key(topic));
                  if (item == null) {
                    return defaultMapping(topic);
                  }
                  String resource =
                      isBlank(item.resource())
                          ? settings.getDefaultResource()
                          : item.resource().trim();
                  return new TopicMapping(topic, resource, hours(item.estimatedHours()));
                })
            .toList());
  }

  private TopicMapping defaultMapping(String topic) {
    return new TopicMapping(topic, settings.getDefaultResource(), settings.getDefaultHours());
  }

  /**
   * Positive and at most {@code maxTopicHours}, rounded to the nearest quarter hour; anything else
   * falls back to the default.
   */
  private double hours(Double estimate) {
    if (estimate == null || estimate.isNaN() || estimate.isInfinite() || estimate <= 0) {
      return settings.getDefaultHours();
    }
    double bounded = Math.min(estimate, settings.getMaxTopicHours());
    return Math.max(0.25, Math.round(bounded * 4) / 4.0);
  }

  private static String key(String topic) {
    return topic.trim().toLowerCase(Locale.ROOT);
  }
}
