package com.flamingo.ai.studyplanner.service.pipeline.stage;

import com.flamingo.ai.studyplanner.domain.model.Course;

/** Input of an extraction stage; always scoped to a single course. */
public interface StageInput {

  Course course();
}
