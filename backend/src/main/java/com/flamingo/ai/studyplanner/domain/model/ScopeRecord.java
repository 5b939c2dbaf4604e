package com.flamingo.ai.studyplanner.domain.model;

import com.flamingo.ai.studyplanner.domain.enums.Importance;
import java.time.LocalDate;
import java.util.List;

/** Exam scope detected in an exam overview. */
public record ScopeRecord(LocalDate examDate, List<ScopedTopic> topics) {

  public ScopeRecord {
    topics = topics == null ? List.of() : List.copyOf(topics);
  }

  public static ScopeRecord empty() {
    return new ScopeRecord(null, List.of());
  }

  /** A topic named by the exam overview. */
  public record ScopedTopic(String name, Importance importance) {
    public ScopedTopic {
      importance = importance == null ? Importance.MEDIUM : importance;
    }
  }
}
