package com.flamingo.ai.studyplanner.service.plan;

import com.flamingo.ai.studyplanner.domain.enums.TaskKind;
import java.time.LocalDate;

/** One data row of an exported plan CSV, as read back. */
public record CsvPlanRow(
    LocalDate date,
    String course,
    String topic,
    TaskKind taskType,
    double durationHours,
    String resources,
    String notes) {}
