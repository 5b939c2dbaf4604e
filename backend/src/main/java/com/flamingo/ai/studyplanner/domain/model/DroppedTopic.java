package com.flamingo.ai.studyplanner.domain.model;

import com.flamingo.ai.studyplanner.domain.enums.Importance;

/** A topic the scheduler could not fit before its course's exam. */
public record DroppedTopic(String courseId, String topic, Importance importance, String reason) {}
