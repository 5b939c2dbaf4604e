package com.flamingo.ai.studyplanner.api.dto.request;

import jakarta.validation.constraints.Positive;
import java.time.LocalDate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for the student's scheduling constraints. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConstraintsRequest {

  @Positive(message = "Weekday hours must be positive")
  private double weekdayHours;

  @Positive(message = "Weekend hours must be positive")
  private double weekendHours;

  private List<LocalDate> noStudyDates;

  /** daily, every_2_days or weekly; defaults to daily. */
  private String reviewFrequency;
}
