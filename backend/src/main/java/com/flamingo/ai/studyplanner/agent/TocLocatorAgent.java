package com.flamingo.ai.studyplanner.agent;

import com.flamingo.ai.studyplanner.agent.dto.TocLocation;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that finds the textbook chapters covering the exam topics in a table of contents. */
public interface TocLocatorAgent {

  @SystemMessage(
      """
        You read textbook tables of contents. Identify the chapters or sections that cover the
        given exam topics, and ONLY those.

        Return ONLY valid JSON matching this structure:
        {
          "relevantSections": [
            {"chapter": "Ch 3: Probability", "startPage": 45, "endPage": 78,
             "coversTopics": ["Topic A"]}
          ]
        }

        Use page numbers as printed in the table of contents. Topic names in coversTopics must be
        copied exactly from the exam topic list.
        """)
  @UserMessage(
      """
        The textbook has {{totalPages}} pages.

        Exam topics: {{topics}}

        Table of contents:
        {{toc}}
        """)
  TocLocation locate(
      @V("totalPages") int totalPages, @V("topics") String topicsJson, @V("toc") String tocText);
}
