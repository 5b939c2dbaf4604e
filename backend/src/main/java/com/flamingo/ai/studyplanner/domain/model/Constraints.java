package com.flamingo.ai.studyplanner.domain.model;

import com.flamingo.ai.studyplanner.domain.enums.ReviewCadence;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Set;

/** Student-supplied limits on the schedule. Both hour budgets are strictly positive. */
public record Constraints(
    double weekdayHours, double weekendHours, Set<LocalDate> blockedDates, ReviewCadence cadence) {

  public Constraints {
    if (!(weekdayHours > 0) || !(weekendHours > 0)) {
      throw new IllegalArgumentException("Hour budgets must be positive");
    }
    blockedDates = blockedDates == null ? Set.of() : Set.copyOf(blockedDates);
    cadence = cadence == null ? ReviewCadence.DAILY : cadence;
  }

  public double budgetFor(LocalDate date) {
    DayOfWeek day = date.getDayOfWeek();
    return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY ? weekendHours : weekdayHours;
  }

  public boolean isBlocked(LocalDate date) {
    return blockedDates.contains(date);
  }
}
