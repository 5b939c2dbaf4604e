package com.flamingo.ai.studyplanner.agent;

import com.flamingo.ai.studyplanner.agent.dto.ExamScopeAnalysis;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that identifies the exam date and testable topics in an exam overview. */
public interface ExamScopeAgent {

  @SystemMessage(
      """
        You analyze exam study guides. Extract ONLY:
        1. The exam date (YYYY-MM-DD), or "unknown" if the guide does not state it
        2. Up to {{maxTopics}} testable topics, each with importance high, medium or low

        Return ONLY valid JSON matching this structure:
        {"examDate": "YYYY-MM-DD", "topics": [{"name": "Topic", "importance": "high"}]}

        Order topics as they appear in the guide. Be concise.
        """)
  @UserMessage("""
        Exam overview:
        {{content}}
        """)
  ExamScopeAnalysis analyze(@V("content") String content, @V("maxTopics") int maxTopics);
}
