package com.flamingo.ai.studyplanner.service.pipeline;

import com.flamingo.ai.studyplanner.domain.enums.Importance;
import com.flamingo.ai.studyplanner.domain.model.EffectiveTopicSet;
import com.flamingo.ai.studyplanner.domain.model.ModuleRecord;
import com.flamingo.ai.studyplanner.domain.model.ModuleRecord.Module;
import com.flamingo.ai.studyplanner.domain.model.ScopeRecord;
import com.flamingo.ai.studyplanner.domain.model.ScopeRecord.ScopedTopic;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Picks the topics a course is scheduled on: the exam scope when it named any, otherwise every
 * syllabus topic at medium importance. Modules without topics stand in with their own name.
 */
@Component
public class FallbackResolver {

  public EffectiveTopicSet resolve(ScopeRecord scope, ModuleRecord modules) {
    if (scope != null && !scope.topics().isEmpty()) {
      return new EffectiveTopicSet(scope.topics(), false);
    }
    List<ScopedTopic> topics = new ArrayList<>();
    if (modules != null) {
      for (Module module : modules.modules()) {
        if (module.topics().isEmpty()) {
          if (!module.name().isBlank()) {
            topics.add(new ScopedTopic(module.name(), Importance.MEDIUM));
          }
          continue;
        }
        for (String topic : module.topics()) {
          topics.add(new ScopedTopic(topic, Importance.MEDIUM));
        }
      }
    }
    return new EffectiveTopicSet(topics, true);
  }
}
