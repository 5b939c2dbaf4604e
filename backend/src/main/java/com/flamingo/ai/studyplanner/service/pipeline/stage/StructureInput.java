package com.flamingo.ai.studyplanner.service.pipeline.stage;

import com.flamingo.ai.studyplanner.domain.model.Course;

/** @param syllabusText extracted syllabus text, or null when no syllabus was uploaded */
public record StructureInput(Course course, String syllabusText) implements StageInput {}
