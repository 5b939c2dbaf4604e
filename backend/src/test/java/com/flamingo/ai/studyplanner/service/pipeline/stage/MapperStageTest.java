package com.flamingo.ai.studyplanner.service.pipeline.stage;

import static com.flamingo.ai.studyplanner.support.ExtractionFixtures.COURSE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studyplanner.agent.ResourceMapperAgent;
import com.flamingo.ai.studyplanner.agent.dto.ResourceMapping;
import com.flamingo.ai.studyplanner.agent.dto.ResourceMapping.MappingItem;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.enums.ProgressStatus;
import com.flamingo.ai.studyplanner.domain.model.MappingRecord;
import com.flamingo.ai.studyplanner.domain.model.MappingRecord.TopicMapping;
import com.flamingo.ai.studyplanner.service.pipeline.AgentFactory;
import com.flamingo.ai.studyplanner.support.ExtractionFixtures;
import com.flamingo.ai.studyplanner.support.RecordingProgressListener;
import dev.langchain4j.memory.ChatMemory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("MapperStage Tests")
class MapperStageTest {

  @Mock private AgentFactory agentFactory;
  @Mock private ResourceMapperAgent agent;

  private MapperStage stage;
  private RecordingProgressListener progress;

  @BeforeEach
  void setUp() {
    PlannerConfig config = ExtractionFixtures.plannerConfig();
    stage =
        new MapperStage(
            ExtractionFixtures.extractionSupport(agentFactory, config),
            new TopicListFormatter(new ObjectMapper()),
            config,
            new SimpleMeterRegistry());
    progress = new RecordingProgressListener();
    when(agentFactory.create(eq(ResourceMapperAgent.class), any(ChatMemory.class)))
        .thenReturn(agent);
  }

  @Test
  @DisplayName("exactly one mapping per topic, in topic order")
  void shouldAlignMappingsWithTopics_whenAgentAnswersOutOfOrder() {
    // Given
    when(agent.map(anyString(), anyString()))
        .thenReturn(
            new ResourceMapping(
                Arrays.asList(
                    new MappingItem("trees", "Ch 4 (pp. 80-95)", 1.3),
                    new MappingItem("Graphs", "Ch 5 (pp. 120-150)", 3.0),
                    new MappingItem("Graphs", "Ch 6", 9.0),
                    new MappingItem("Unasked", "Ch 9", 1.0),
                    null)));

    // When
    MappingRecord result =
        stage.run(
            new MapperInput(COURSE, "=== Ch 5 ===\n...", List.of("Graphs", "Trees", "Heaps")),
            progress);

    // Then
    assertThat(result.mappings())
        .containsExactly(
            new TopicMapping("Graphs", "Ch 5 (pp. 120-150)", 3.0),
            new TopicMapping("Trees", "Ch 4 (pp. 80-95)", 1.25),
            new TopicMapping("Heaps", "Textbook", 2.0));
    assertThat(progress.last().message()).isEqualTo("Mapped 3 topics for CS101 (~6.3h of study)");
  }

  @Test
  @DisplayName("unusable hour estimates fall back to the default")
  void shouldUseDefaults_whenEstimatesAreUnusable() {
    // Given
    when(agent.map(anyString(), anyString()))
        .thenReturn(
            new ResourceMapping(
                List.of(
                    new MappingItem("A", " ", null),
                    new MappingItem("B", "Ch 1", -1.0),
                    new MappingItem("C", "Ch 2", Double.NaN),
                    new MappingItem("D", "Ch 3", 0.05))));

    // When
    MappingRecord result =
        stage.run(new MapperInput(COURSE, "text", List.of("A", "B", "C", "D")), progress);

    // Then
    assertThat(result.mappings())
        .containsExactly(
            new TopicMapping("A", "Textbook", 2.0),
            new TopicMapping("B", "Ch 1", 2.0),
            new TopicMapping("C", "Ch 2", 2.0),
            new TopicMapping("D", "Ch 3", 0.25));
  }

  @Test
  void shouldCapEstimate_whenAgentReturnsAbsurdHours() {
    // Given
    when(agent.map(anyString(), anyString()))
        .thenReturn(
            new ResourceMapping(
                List.of(new MappingItem("A", "Ch 1", 1e9), new MappingItem("B", "Ch 2", 8.2))));

    // When
    MappingRecord result = stage.run(new MapperInput(COURSE, "text", List.of("A", "B")), progress);

    // Then
    assertThat(result.mappings())
        .containsExactly(new TopicMapping("A", "Ch 1", 8.0), new TopicMapping("B", "Ch 2", 8.0));
  }

  @Test
  void shouldUseDefaultEstimates_whenNoTextbookText() {
    // When
    MappingRecord result =
        stage.run(new MapperInput(COURSE, null, List.of("Graphs", "Trees")), progress);

    // Then
    assertThat(result.mappings())
        .containsExactly(
            new TopicMapping("Graphs", "Textbook", 2.0),
            new TopicMapping("Trees", "Textbook", 2.0));
    assertThat(progress.statuses()).containsExactly(ProgressStatus.LOADING, ProgressStatus.SUCCESS);
    assertThat(progress.last().message())
        .isEqualTo("No textbook excerpts for CS101, using default estimates of 2.0h per topic");
    verifyNoInteractions(agentFactory);
  }

  @Test
  void shouldReturnDefaults_whenFallbackIsRequested() {
    // When
    MappingRecord result = stage.fallback(new MapperInput(COURSE, "text", List.of("Graphs")));

    // Then
    assertThat(result.mappings()).containsExactly(new TopicMapping("Graphs", "Textbook", 2.0));
  }
}
