package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.domain.enums.Importance;

/** A topic to schedule with its total effort across learn, practice and review. */
public record TopicWorkload(String name, Importance importance, double hours, String resource) {

  public TopicWorkload {
    importance = importance == null ? Importance.MEDIUM : importance;
  }
}
