package com.flamingo.ai.studyplanner.agent;

import com.flamingo.ai.studyplanner.agent.dto.ResourceMapping;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that maps exam topics to textbook resources and estimates study hours. */
public interface ResourceMapperAgent {

  @SystemMessage(
      """
        You map exam topics to textbook reading and estimate the study effort for each.

        For every topic return exactly one entry with:
        - topic: copied exactly from the topic list
        - resource: where to study it, e.g. "Ch 3.2-3.4 (pp. 45-67)"
        - estimatedHours: hours a student needs to learn and practice it (0.5 to 8)

        Return ONLY valid JSON matching this structure:
        {"mappings": [{"topic": "...", "resource": "...", "estimatedHours": 2.0}]}
        """)
  @UserMessage(
      """
        Topics: {{topics}}

        Textbook excerpts:
        {{text}}
        """)
  ResourceMapping map(@V("topics") String topicsJson, @V("text") String sampledText);
}
