package com.flamingo.ai.studyplanner.service.pipeline.stage;

import com.flamingo.ai.studyplanner.domain.model.Course;

/** @param overviewText extracted exam overview text, or null when none was uploaded */
public record ScopeInput(Course course, String overviewText) implements StageInput {}
