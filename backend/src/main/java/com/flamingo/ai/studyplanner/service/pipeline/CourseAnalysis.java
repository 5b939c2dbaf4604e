package com.flamingo.ai.studyplanner.service.pipeline;

import com.flamingo.ai.studyplanner.domain.model.Course;
import com.flamingo.ai.studyplanner.domain.model.EffectiveTopicSet;
import com.flamingo.ai.studyplanner.domain.model.LocatorRecord;
import com.flamingo.ai.studyplanner.domain.model.MappingRecord;
import com.flamingo.ai.studyplanner.domain.model.ModuleRecord;
import com.flamingo.ai.studyplanner.domain.model.ScopeRecord;
import java.time.LocalDate;

/**
 * Everything the per-course stages produced for one course.
 *
 * @param examDate resolved exam date, null when unknown
 */
public record CourseAnalysis(
    Course course,
    LocalDate examDate,
    ModuleRecord modules,
    ScopeRecord scope,
    EffectiveTopicSet topics,
    LocatorRecord locator,
    MappingRecord mapping) {}
