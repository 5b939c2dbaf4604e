package com.flamingo.ai.studyplanner.agent;

import com.flamingo.ai.studyplanner.agent.dto.SyllabusAnalysis;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that extracts course structure (modules, topics, assessments) from a syllabus. */
public interface SyllabusStructureAgent {

  @SystemMessage(
      """
        You analyze university course syllabi. Extract ONLY:
        1. Course name and code
        2. Up to {{maxModules}} modules, each with at most {{maxTopics}} topics
        3. Assessments with their type, weight and date (YYYY-MM-DD when known)

        Return ONLY valid JSON matching this structure:
        {
          "courseName": "...",
          "courseCode": "...",
          "modules": [{"name": "...", "topics": ["t1", "t2"], "week": 1}],
          "assessments": [{"type": "midterm", "weight": "30%", "date": "YYYY-MM-DD"}]
        }

        Be concise. Use short topic names.
        """)
  @UserMessage("""
        Syllabus:
        {{content}}
        """)
  SyllabusAnalysis analyze(
      @V("content") String content,
      @V("maxModules") int maxModules,
      @V("maxTopics") int maxTopicsPerModule);
}
